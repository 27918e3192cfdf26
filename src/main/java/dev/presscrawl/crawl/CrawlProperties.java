package dev.presscrawl.crawl;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Run-level crawl settings bound from {@code presscrawl.crawl.*}.
 *
 * @param sourceConcurrency         sources crawled at the same time
 * @param maxConsecutiveEmptyPages  empty pages in a row that end a paginated source
 * @param maxOpenEndedPages         page cap for paginated sources without an {@code end-page}
 * @param runOnStartup              crawl all enabled sources once the application has started
 */
@ConfigurationProperties(prefix = "presscrawl.crawl")
public record CrawlProperties(
    @DefaultValue("2") int sourceConcurrency,
    @DefaultValue("3") int maxConsecutiveEmptyPages,
    @DefaultValue("10000") int maxOpenEndedPages,
    @DefaultValue("false") boolean runOnStartup) {

  public CrawlProperties {
    if (sourceConcurrency < 1) {
      throw new IllegalStateException("presscrawl.crawl.source-concurrency must be >= 1");
    }
    if (maxConsecutiveEmptyPages < 1) {
      throw new IllegalStateException("presscrawl.crawl.max-consecutive-empty-pages must be >= 1");
    }
    if (maxOpenEndedPages < 1) {
      throw new IllegalStateException("presscrawl.crawl.max-open-ended-pages must be >= 1");
    }
  }
}
