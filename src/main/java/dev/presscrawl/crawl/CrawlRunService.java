package dev.presscrawl.crawl;

import dev.presscrawl.checkpoint.CheckpointStore;
import dev.presscrawl.source.SourceCatalog;
import dev.presscrawl.source.SourceConfig;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs crawls of several sources, up to {@code presscrawl.crawl.source-concurrency} at a time.
 *
 * <p>Each source runs in its own {@link CrawlDriver} call on a dedicated worker thread; an
 * unexpected error in one source is logged and reported as FAILED without touching the others.
 * A source can only be crawled by one run at a time. Sources waiting for a free worker can be
 * cancelled too; they then finish as CANCELLED without being crawled.
 */
@Service
public class CrawlRunService {

  private static final Logger log = LoggerFactory.getLogger(CrawlRunService.class);

  private final SourceCatalog catalog;
  private final CrawlDriver driver;
  private final CrawlProgressTracker progressTracker;
  private final CheckpointStore checkpointStore;
  private final Clock clock;
  private final ExecutorService executor;

  private final ConcurrentHashMap<String, ActiveSource> active = new ConcurrentHashMap<>();
  private final Map<String, Thread> workers = new HashMap<>();

  public CrawlRunService(
      SourceCatalog catalog,
      CrawlDriver driver,
      CrawlProgressTracker progressTracker,
      CheckpointStore checkpointStore,
      CrawlProperties properties,
      Clock clock) {
    this.catalog = catalog;
    this.driver = driver;
    this.progressTracker = progressTracker;
    this.checkpointStore = checkpointStore;
    this.clock = clock;
    AtomicInteger counter = new AtomicInteger();
    this.executor = Executors.newFixedThreadPool(properties.sourceConcurrency(), runnable -> {
      Thread thread = new Thread(runnable, "crawl-source-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   * Crawl the given sources, or every enabled source when {@code sourceIds} is empty, and wait
   * for all of them to finish.
   */
  public RunReport run(List<String> sourceIds) {
    return start(sourceIds).join();
  }

  /**
   * Start crawling the given sources, or every enabled source when {@code sourceIds} is empty.
   *
   * @return a future completing with the report once every started source has finished
   * @throws IllegalArgumentException if a source id is unknown
   * @throws IllegalStateException    if one of the sources is already being crawled
   */
  public CompletableFuture<RunReport> start(List<String> sourceIds) {
    List<SourceConfig> sources = resolve(sourceIds);
    Instant startedAt = clock.instant();

    Map<String, ActiveSource> started = new LinkedHashMap<>();
    for (SourceConfig source : sources) {
      ActiveSource pending = new ActiveSource();
      if (active.putIfAbsent(source.id(), pending) != null) {
        started.keySet().forEach(active::remove);
        throw new IllegalStateException("Source " + source.id() + " is already being crawled");
      }
      started.put(source.id(), pending);
    }

    log.info("Starting crawl run for {} source(s): {}", sources.size(), started.keySet());
    List<CompletableFuture<SourceRunReport>> reports = new ArrayList<>();
    for (SourceConfig source : sources) {
      ActiveSource pending = started.get(source.id());
      CompletableFuture.supplyAsync(() -> runSource(source, pending), executor)
          .whenComplete((report, error) -> {
            active.remove(source.id(), pending);
            if (error != null) {
              pending.report.completeExceptionally(error);
            } else {
              pending.report.complete(report);
            }
          });
      reports.add(pending.report);
    }

    return CompletableFuture.allOf(reports.toArray(CompletableFuture[]::new))
        .thenApply(ignored -> {
          RunReport report = new RunReport(reports.stream().map(CompletableFuture::join).toList(),
              startedAt, clock.instant());
          log.info("Crawl run finished: {}", report.totals());
          return report;
        });
  }

  /**
   * Request cancellation of a source's crawl. The in-flight unit is abandoned without being
   * checkpointed; a source still waiting for a worker is never crawled.
   *
   * @return true if the source was being crawled or waiting to be
   * @throws IllegalArgumentException if the source id is unknown
   */
  public boolean cancel(String sourceId) {
    catalog.require(sourceId);
    boolean running = progressTracker.requestCancel(sourceId);
    ActiveSource pending = active.get(sourceId);
    if (pending != null) {
      pending.cancelled = true;
      running = true;
    }
    synchronized (workers) {
      Thread worker = workers.get(sourceId);
      if (worker != null) {
        worker.interrupt();
        running = true;
      }
    }
    if (running) {
      log.info("Cancellation requested for {}", sourceId);
    }
    return running;
  }

  public void cancelAll() {
    active.keySet().forEach(this::cancel);
  }

  public boolean isRunning(String sourceId) {
    return active.containsKey(sourceId);
  }

  /**
   * Forget a source's checkpoint so its next crawl starts from the range floor.
   *
   * @throws IllegalStateException if the source is being crawled
   */
  public void resetCheckpoint(String sourceId) {
    catalog.require(sourceId);
    if (isRunning(sourceId)) {
      throw new IllegalStateException("Cannot reset the checkpoint of " + sourceId + " while it is being crawled");
    }
    checkpointStore.reset(sourceId);
  }

  private List<SourceConfig> resolve(List<String> sourceIds) {
    if (sourceIds == null || sourceIds.isEmpty()) {
      return catalog.enabled();
    }
    return sourceIds.stream().distinct().map(catalog::require).toList();
  }

  private SourceRunReport runSource(SourceConfig source, ActiveSource pending) {
    if (pending.cancelled) {
      log.info("Crawl of {} cancelled before it started", source.id());
      return cancelledBeforeStart(source.id());
    }
    Thread current = Thread.currentThread();
    synchronized (workers) {
      workers.put(source.id(), current);
    }
    Instant startedAt = clock.instant();
    try {
      return driver.crawl(source);
    } catch (RuntimeException e) {
      log.error("Crawl of {} aborted", source.id(), e);
      return new SourceRunReport(source.id(), RunOutcome.FAILED, CrawlCounters.ZERO, null,
          e.getClass().getSimpleName() + ": " + e.getMessage(), startedAt, clock.instant());
    } finally {
      synchronized (workers) {
        workers.remove(source.id());
        // a cancel() that raced with completion must not leak into the next task on this thread
        Thread.interrupted();
      }
    }
  }

  private SourceRunReport cancelledBeforeStart(String sourceId) {
    Instant now = clock.instant();
    return new SourceRunReport(sourceId, RunOutcome.CANCELLED, CrawlCounters.ZERO, null, null, now, now);
  }

  @PreDestroy
  void shutdown() {
    cancelAll();
    executor.shutdownNow();
    // tasks dropped from the queue never run, so their reports are completed here
    active.forEach((sourceId, pending) -> pending.report.complete(cancelledBeforeStart(sourceId)));
    active.clear();
  }

  private static final class ActiveSource {

    private final CompletableFuture<SourceRunReport> report = new CompletableFuture<>();
    private volatile boolean cancelled;
  }
}
