package dev.presscrawl.crawl;

import dev.presscrawl.checkpoint.Checkpoint;
import dev.presscrawl.checkpoint.UnitKey;
import dev.presscrawl.exception.ConfigException;
import dev.presscrawl.source.SourceConfig;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * Lazily lists the units a source still has to crawl, in order.
 *
 * <p>The sequence starts strictly after the checkpoint, or at the configured range floor when
 * there is no checkpoint or the checkpoint lies before the floor. Daily ranges end at the
 * configured end date but never later than yesterday; paginated ranges end at
 * {@code end-page}, or after {@code presscrawl.crawl.max-open-ended-pages} pages when none is
 * configured.
 */
@Component
public class WorkItemEnumerator {

  private final Clock clock;
  private final CrawlProperties properties;

  public WorkItemEnumerator(Clock clock, CrawlProperties properties) {
    this.clock = clock;
    this.properties = properties;
  }

  public Stream<WorkItem> enumerate(SourceConfig source, Optional<Checkpoint> checkpoint) {
    UnitKey floor = floorOf(source);
    UnitKey first = checkpoint
        .map(cp -> resumeKey(source, cp, floor))
        .orElse(floor);
    UnitKey last = ceilingOf(source);
    if (first.isAfter(last)) {
      return Stream.empty();
    }
    return Stream.iterate(first, key -> !key.isAfter(last), UnitKey::next)
        .map(key -> WorkItem.pending(source.id(), key));
  }

  private static UnitKey resumeKey(SourceConfig source, Checkpoint checkpoint, UnitKey floor) {
    UnitKey completed = checkpoint.lastCompletedUnitKey();
    if (completed.granularity() != source.granularity()) {
      throw new ConfigException("Checkpoint of " + source.id() + " is " + completed.granularity()
          + " but the source is " + source.granularity() + "; reset the checkpoint");
    }
    UnitKey next = completed.next();
    return next.isAfter(floor) ? next : floor;
  }

  private static UnitKey floorOf(SourceConfig source) {
    return switch (source.granularity()) {
      case DAILY -> UnitKey.ofDate(source.rangeStartDate());
      case PAGINATED -> UnitKey.ofPage(source.startPage());
    };
  }

  private UnitKey ceilingOf(SourceConfig source) {
    return switch (source.granularity()) {
      case DAILY -> {
        // today's archive is still growing; checkpointing it would skip what is published later
        LocalDate latest = LocalDate.now(clock).minusDays(1);
        LocalDate end = source.rangeEndDate().filter(date -> !date.isAfter(latest)).orElse(latest);
        yield UnitKey.ofDate(end);
      }
      case PAGINATED -> UnitKey.ofPage(source.endPage() != null
          ? source.endPage()
          : source.startPage() + properties.maxOpenEndedPages() - 1);
    };
  }
}
