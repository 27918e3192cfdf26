package dev.presscrawl.checkpoint;

import dev.presscrawl.source.Granularity;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Identifies one archive unit of a source: a calendar day ({@code yyyy-MM-dd}) or a page number.
 *
 * <p>Keys are totally ordered within a granularity. Comparing keys of different granularities is a
 * programming error and throws {@link IllegalArgumentException}.
 *
 * @param granularity DAILY or PAGINATED
 * @param value       canonical ISO date or decimal page number
 */
public record UnitKey(Granularity granularity, String value) implements Comparable<UnitKey> {

  public UnitKey {
    Objects.requireNonNull(granularity, "granularity");
    Objects.requireNonNull(value, "value");
    value = switch (granularity) {
      case DAILY -> parseDate(value).toString();
      case PAGINATED -> Integer.toString(parsePage(value));
    };
  }

  public static UnitKey ofDate(LocalDate date) {
    return new UnitKey(Granularity.DAILY, date.toString());
  }

  public static UnitKey ofPage(int page) {
    return new UnitKey(Granularity.PAGINATED, Integer.toString(page));
  }

  public LocalDate asDate() {
    requireGranularity(Granularity.DAILY);
    return LocalDate.parse(value);
  }

  public int asPage() {
    requireGranularity(Granularity.PAGINATED);
    return Integer.parseInt(value);
  }

  /** The unit immediately following this one. */
  public UnitKey next() {
    return switch (granularity) {
      case DAILY -> ofDate(asDate().plusDays(1));
      case PAGINATED -> ofPage(asPage() + 1);
    };
  }

  public boolean isAfter(UnitKey other) {
    return compareTo(other) > 0;
  }

  @Override
  public int compareTo(UnitKey other) {
    if (granularity != other.granularity) {
      throw new IllegalArgumentException(
          "Cannot compare " + granularity + " key " + value + " with " + other.granularity + " key " + other.value);
    }
    return switch (granularity) {
      case DAILY -> asDate().compareTo(other.asDate());
      case PAGINATED -> Integer.compare(asPage(), other.asPage());
    };
  }

  @Override
  public String toString() {
    return granularity == Granularity.DAILY ? value : "page " + value;
  }

  private void requireGranularity(Granularity expected) {
    if (granularity != expected) {
      throw new IllegalStateException("Unit key " + value + " is " + granularity + ", not " + expected);
    }
  }

  private static LocalDate parseDate(String value) {
    try {
      return LocalDate.parse(value.trim());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Daily unit key must be an ISO date: " + value, e);
    }
  }

  private static int parsePage(String value) {
    int page;
    try {
      page = Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Page unit key must be a number: " + value, e);
    }
    if (page < 1) {
      throw new IllegalArgumentException("Page unit key must be >= 1: " + value);
    }
    return page;
  }
}
