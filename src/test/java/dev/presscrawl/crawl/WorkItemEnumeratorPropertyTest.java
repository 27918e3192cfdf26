package dev.presscrawl.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import dev.presscrawl.checkpoint.Checkpoint;
import dev.presscrawl.checkpoint.UnitKey;
import dev.presscrawl.fixture.SourceConfigBuilder;
import dev.presscrawl.source.SourceConfig;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;

/**
 * Ordering and resume invariants of {@link WorkItemEnumerator} over arbitrary ranges and
 * checkpoints.
 */
class WorkItemEnumeratorPropertyTest {

  private static final LocalDate TODAY = LocalDate.of(2024, 6, 30);
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-30T12:00:00Z"), ZoneOffset.UTC);

  private final WorkItemEnumerator enumerator = new WorkItemEnumerator(CLOCK, new CrawlProperties(1, 3, 50, false));

  @Property
  void dailyItemsAreContiguousAscendingAndWithinBounds(
      @ForAll @IntRange(min = 0, max = 200) int startOffset,
      @ForAll @IntRange(min = 0, max = 200) int length,
      @ForAll @IntRange(min = -10, max = 250) int checkpointOffset,
      @ForAll boolean hasCheckpoint) {
    LocalDate start = TODAY.minusDays(startOffset);
    LocalDate end = start.plusDays(length);
    SourceConfig source = SourceConfigBuilder.daily()
        .startDate(start.toString()).endDate(end.toString()).build();
    LocalDate checkpointDate = start.plusDays(checkpointOffset);
    Optional<Checkpoint> checkpoint = hasCheckpoint
        ? Optional.of(new Checkpoint("example", UnitKey.ofDate(checkpointDate), Instant.EPOCH))
        : Optional.empty();

    List<UnitKey> keys = enumerator.enumerate(source, checkpoint).map(WorkItem::unitKey).toList();

    LocalDate ceiling = end.isBefore(TODAY) ? end : TODAY.minusDays(1);
    LocalDate expectedFirst = hasCheckpoint && !checkpointDate.isBefore(start) ? checkpointDate.plusDays(1) : start;
    if (expectedFirst.isAfter(ceiling)) {
      assertThat(keys).isEmpty();
      return;
    }
    assertThat(keys.get(0).asDate()).isEqualTo(expectedFirst);
    assertThat(keys.get(keys.size() - 1).asDate()).isEqualTo(ceiling);
    for (int i = 1; i < keys.size(); i++) {
      assertThat(keys.get(i)).isEqualTo(keys.get(i - 1).next());
    }
  }

  @Property
  void paginatedItemsNeverRepeatACompletedPage(
      @ForAll @IntRange(min = 1, max = 20) int startPage,
      @ForAll @IntRange(min = 1, max = 80) int checkpointPage) {
    SourceConfig source = SourceConfigBuilder.paginated().startPage(startPage).build();
    Optional<Checkpoint> checkpoint =
        Optional.of(new Checkpoint("example", UnitKey.ofPage(checkpointPage), Instant.EPOCH));

    List<Integer> pages = enumerator.enumerate(source, checkpoint).map(item -> item.unitKey().asPage()).toList();

    assertThat(pages).allSatisfy(page -> assertThat(page).isGreaterThan(checkpointPage).isGreaterThanOrEqualTo(startPage));
    assertThat(pages).allSatisfy(page -> assertThat(page).isLessThanOrEqualTo(startPage + 49));
    assertThat(pages).isSorted().doesNotHaveDuplicates();
  }
}
