package dev.presscrawl.crawl;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Crawls every enabled source once the application is up, when {@code presscrawl.crawl.run-on-startup} is set. */
@Component
@ConditionalOnProperty(prefix = "presscrawl.crawl", name = "run-on-startup", havingValue = "true")
public class CrawlStartupRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(CrawlStartupRunner.class);

  private final CrawlRunService runService;

  public CrawlStartupRunner(CrawlRunService runService) {
    this.runService = runService;
  }

  @Override
  public void run(ApplicationArguments args) {
    RunReport report = runService.run(List.of());
    for (SourceRunReport source : report.sources()) {
      log.info("{}: {} (checkpoint {}) {}", source.sourceId(), source.outcome(),
          source.lastCompletedUnit(), source.counters());
    }
  }
}
