package dev.presscrawl.crawl;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Immutable snapshot of a source's crawl.
 *
 * <p>Created and updated by {@link CrawlProgressTracker}. Each mutation produces a new record.
 *
 * @param sourceId        the source being crawled
 * @param status          RUNNING until the crawl ends
 * @param stage           stage of the unit in progress
 * @param currentUnit     unit in progress, e.g. {@code 2024-05-01} or {@code page 7}
 * @param counters        tallies so far
 * @param cancelRequested whether cancellation was requested
 * @param outcome         how the crawl ended, once it has
 * @param failure         failure message of a FAILED crawl
 * @param startedAt       when the crawl started
 * @param finishedAt      when the crawl ended
 */
public record CrawlProgress(
    String sourceId,
    Status status,
    @Nullable CrawlStage stage,
    @Nullable String currentUnit,
    CrawlCounters counters,
    boolean cancelRequested,
    @Nullable RunOutcome outcome,
    @Nullable String failure,
    Instant startedAt,
    @Nullable Instant finishedAt) {

  public enum Status {
    RUNNING,
    FINISHED
  }

  public boolean isRunning() {
    return status == Status.RUNNING;
  }
}
