package dev.presscrawl.crawl;

import dev.presscrawl.checkpoint.UnitKey;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory tracker of crawl progress, one snapshot per source.
 *
 * <p>Each update atomically replaces the source's {@link CrawlProgress} through
 * {@code compute()}. The cancellation flag lives here too: {@link CrawlDriver} and the
 * {@link ExtractionPool} poll {@link #isCancelled} while they work.
 *
 * <p>Progress is transient and lost on restart; the checkpoint store holds what must survive.
 */
@Component
public class CrawlProgressTracker {

  private final ConcurrentHashMap<String, CrawlProgress> crawls = new ConcurrentHashMap<>();
  private final Clock clock;

  public CrawlProgressTracker(Clock clock) {
    this.clock = clock;
  }

  /**
   * Start tracking a crawl, replacing the snapshot of any earlier finished crawl.
   *
   * @throws IllegalStateException if a crawl of this source is already running
   */
  public void startCrawl(String sourceId) {
    crawls.compute(sourceId, (id, current) -> {
      if (current != null && current.isRunning()) {
        throw new IllegalStateException("Source " + id + " is already being crawled");
      }
      return new CrawlProgress(id, CrawlProgress.Status.RUNNING, CrawlStage.PENDING, null,
          CrawlCounters.ZERO, false, null, null, clock.instant(), null);
    });
  }

  public void enterStage(String sourceId, CrawlStage stage, UnitKey unitKey) {
    crawls.computeIfPresent(sourceId, (id, progress) -> new CrawlProgress(
        id,
        progress.status(),
        stage,
        unitKey.toString(),
        progress.counters(),
        progress.cancelRequested(),
        progress.outcome(),
        progress.failure(),
        progress.startedAt(),
        progress.finishedAt()));
  }

  public void addCounters(String sourceId, CrawlCounters delta) {
    crawls.computeIfPresent(sourceId, (id, progress) -> new CrawlProgress(
        id,
        progress.status(),
        progress.stage(),
        progress.currentUnit(),
        progress.counters().plus(delta),
        progress.cancelRequested(),
        progress.outcome(),
        progress.failure(),
        progress.startedAt(),
        progress.finishedAt()));
  }

  public void finishCrawl(String sourceId, RunOutcome outcome, @Nullable String failure) {
    crawls.computeIfPresent(sourceId, (id, progress) -> new CrawlProgress(
        id,
        CrawlProgress.Status.FINISHED,
        progress.stage(),
        progress.currentUnit(),
        progress.counters(),
        progress.cancelRequested(),
        outcome,
        failure,
        progress.startedAt(),
        clock.instant()));
  }

  /**
   * Flag a running crawl for cancellation.
   *
   * @return true if the source had a running crawl
   */
  public boolean requestCancel(String sourceId) {
    CrawlProgress updated = crawls.computeIfPresent(sourceId, (id, progress) -> {
      if (!progress.isRunning()) {
        return progress;
      }
      return new CrawlProgress(
          id,
          progress.status(),
          progress.stage(),
          progress.currentUnit(),
          progress.counters(),
          true,
          progress.outcome(),
          progress.failure(),
          progress.startedAt(),
          progress.finishedAt());
    });
    return updated != null && updated.isRunning();
  }

  public boolean isCancelled(String sourceId) {
    CrawlProgress progress = crawls.get(sourceId);
    return progress != null && progress.cancelRequested();
  }

  public Optional<CrawlProgress> getProgress(String sourceId) {
    return Optional.ofNullable(crawls.get(sourceId));
  }

  public List<CrawlProgress> all() {
    return crawls.values().stream().sorted(Comparator.comparing(CrawlProgress::sourceId)).toList();
  }
}
