package dev.presscrawl.crawl;

import java.time.Instant;
import java.util.List;

/** Results of one {@link CrawlRunService#run} call, one entry per source. */
public record RunReport(List<SourceRunReport> sources, Instant startedAt, Instant finishedAt) {

  public RunReport {
    sources = List.copyOf(sources);
  }

  public CrawlCounters totals() {
    return sources.stream().map(SourceRunReport::counters).reduce(CrawlCounters.ZERO, CrawlCounters::plus);
  }

  public boolean hasFailures() {
    return sources.stream().anyMatch(report -> report.outcome() == RunOutcome.FAILED);
  }
}
