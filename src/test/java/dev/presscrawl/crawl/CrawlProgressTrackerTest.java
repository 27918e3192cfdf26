package dev.presscrawl.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.presscrawl.checkpoint.UnitKey;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CrawlProgressTrackerTest {

  private static final Instant NOW = Instant.parse("2024-06-01T08:00:00Z");

  private CrawlProgressTracker tracker;

  @BeforeEach
  void setUp() {
    tracker = new CrawlProgressTracker(Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void startCrawlCreatesRunningSnapshot() {
    tracker.startCrawl("news18");

    CrawlProgress progress = tracker.getProgress("news18").orElseThrow();
    assertThat(progress.isRunning()).isTrue();
    assertThat(progress.stage()).isEqualTo(CrawlStage.PENDING);
    assertThat(progress.counters()).isEqualTo(CrawlCounters.ZERO);
    assertThat(progress.startedAt()).isEqualTo(NOW);
    assertThat(progress.finishedAt()).isNull();
  }

  @Test
  void startCrawlRejectsSecondRunningCrawlButAllowsRestartAfterFinish() {
    tracker.startCrawl("news18");
    assertThatThrownBy(() -> tracker.startCrawl("news18")).isInstanceOf(IllegalStateException.class);

    tracker.finishCrawl("news18", RunOutcome.COMPLETED, null);
    tracker.startCrawl("news18");

    assertThat(tracker.getProgress("news18").orElseThrow().isRunning()).isTrue();
  }

  @Test
  void stagesAndCountersAccumulate() {
    tracker.startCrawl("news18");
    tracker.enterStage("news18", CrawlStage.DEDUPING, UnitKey.ofPage(4));
    tracker.addCounters("news18", new CrawlCounters(10, 2, 0, 0, 0, 0, 0, 0));
    tracker.addCounters("news18", new CrawlCounters(0, 0, 7, 1, 0, 0, 0, 1));

    CrawlProgress progress = tracker.getProgress("news18").orElseThrow();
    assertThat(progress.stage()).isEqualTo(CrawlStage.DEDUPING);
    assertThat(progress.currentUnit()).isEqualTo("page 4");
    assertThat(progress.counters()).isEqualTo(new CrawlCounters(10, 2, 7, 1, 0, 0, 0, 1));
  }

  @Test
  void finishCrawlRecordsOutcomeAndFailure() {
    tracker.startCrawl("news18");
    tracker.finishCrawl("news18", RunOutcome.FAILED, "archive unavailable");

    CrawlProgress progress = tracker.getProgress("news18").orElseThrow();
    assertThat(progress.isRunning()).isFalse();
    assertThat(progress.outcome()).isEqualTo(RunOutcome.FAILED);
    assertThat(progress.failure()).isEqualTo("archive unavailable");
    assertThat(progress.finishedAt()).isEqualTo(NOW);
  }

  @Test
  void cancelOnlyFlagsRunningCrawls() {
    assertThat(tracker.requestCancel("news18")).isFalse();
    assertThat(tracker.isCancelled("news18")).isFalse();

    tracker.startCrawl("news18");
    assertThat(tracker.requestCancel("news18")).isTrue();
    assertThat(tracker.isCancelled("news18")).isTrue();

    tracker.finishCrawl("news18", RunOutcome.CANCELLED, null);
    assertThat(tracker.requestCancel("news18")).isFalse();
  }

  @Test
  void restartClearsPreviousCancellation() {
    tracker.startCrawl("news18");
    tracker.requestCancel("news18");
    tracker.finishCrawl("news18", RunOutcome.CANCELLED, null);

    tracker.startCrawl("news18");

    assertThat(tracker.isCancelled("news18")).isFalse();
  }

  @Test
  void updatesForUnknownSourcesAreIgnored() {
    tracker.enterStage("ghost", CrawlStage.DONE, UnitKey.ofPage(1));
    tracker.addCounters("ghost", CrawlCounters.unitCompleted());
    tracker.finishCrawl("ghost", RunOutcome.COMPLETED, null);

    assertThat(tracker.getProgress("ghost")).isEmpty();
    assertThat(tracker.all()).isEmpty();
  }

  @Test
  void allIsSortedBySourceId() {
    tracker.startCrawl("publictv");
    tracker.startCrawl("jagran");
    tracker.startCrawl("news18");

    assertThat(tracker.all()).extracting(CrawlProgress::sourceId).containsExactly("jagran", "news18", "publictv");
  }

  @Test
  void concurrentCounterUpdatesAreNotLost() throws InterruptedException {
    tracker.startCrawl("news18");
    ExecutorService executor = Executors.newFixedThreadPool(8);
    for (int i = 0; i < 1000; i++) {
      executor.submit(() -> tracker.addCounters("news18", new CrawlCounters(1, 0, 1, 0, 0, 0, 0, 0)));
    }
    executor.shutdown();
    assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

    CrawlCounters counters = tracker.getProgress("news18").orElseThrow().counters();
    assertThat(counters.candidatesFound()).isEqualTo(1000);
    assertThat(counters.ingested()).isEqualTo(1000);
  }
}
