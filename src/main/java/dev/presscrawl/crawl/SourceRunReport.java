package dev.presscrawl.crawl;

import dev.presscrawl.checkpoint.UnitKey;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Result of crawling one source.
 *
 * @param sourceId           the source
 * @param outcome            how the crawl ended
 * @param counters           tallies for this run
 * @param lastCompletedUnit  checkpoint after the run, null if the source has none
 * @param failure            failure message of a FAILED crawl
 * @param startedAt          when the crawl started
 * @param finishedAt         when the crawl ended
 */
public record SourceRunReport(
    String sourceId,
    RunOutcome outcome,
    CrawlCounters counters,
    @Nullable UnitKey lastCompletedUnit,
    @Nullable String failure,
    Instant startedAt,
    Instant finishedAt) {
}
