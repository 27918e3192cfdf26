package dev.presscrawl.api;

import dev.presscrawl.checkpoint.Checkpoint;
import dev.presscrawl.checkpoint.CheckpointStore;
import dev.presscrawl.crawl.CrawlProgress;
import dev.presscrawl.crawl.CrawlProgressTracker;
import dev.presscrawl.crawl.CrawlRunService;
import dev.presscrawl.crawl.RunReport;
import dev.presscrawl.crawl.SourceRunReport;
import dev.presscrawl.source.SourceCatalog;
import dev.presscrawl.source.SourceConfig;
import jakarta.validation.Valid;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for starting, watching and cancelling crawls and for managing checkpoints.
 *
 * <p>Runs are asynchronous: {@code POST /runs} returns as soon as the crawls are scheduled and
 * their progress is then read from {@code GET /progress}.
 */
@RestController
@RequestMapping("/api/crawl")
public class CrawlController {

  private static final Logger log = LoggerFactory.getLogger(CrawlController.class);

  private final CrawlRunService runService;
  private final CrawlProgressTracker progressTracker;
  private final CheckpointStore checkpointStore;
  private final SourceCatalog catalog;

  public CrawlController(
      CrawlRunService runService,
      CrawlProgressTracker progressTracker,
      CheckpointStore checkpointStore,
      SourceCatalog catalog) {
    this.runService = runService;
    this.progressTracker = progressTracker;
    this.checkpointStore = checkpointStore;
    this.catalog = catalog;
  }

  @PostMapping("/runs")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public RunStarted startRun(@Valid @RequestBody(required = false) RunRequest request) {
    List<String> requested = request == null ? List.of() : request.sourceIds();
    CompletableFuture<RunReport> run = runService.start(requested);
    run.whenComplete((report, error) -> {
      if (error != null) {
        log.error("Crawl run failed", error);
      } else if (report.hasFailures()) {
        log.warn("Crawl run finished with failures: {}", report.sources().stream()
            .filter(source -> source.failure() != null)
            .map(SourceRunReport::sourceId)
            .toList());
      }
    });
    List<String> started = requested.isEmpty()
        ? catalog.enabled().stream().map(SourceConfig::id).toList()
        : requested.stream().distinct().toList();
    return new RunStarted(started);
  }

  @GetMapping("/progress")
  public List<CrawlProgress> progress() {
    return progressTracker.all();
  }

  @GetMapping("/progress/{sourceId}")
  public ResponseEntity<CrawlProgress> progress(@PathVariable String sourceId) {
    catalog.require(sourceId);
    return ResponseEntity.of(progressTracker.getProgress(sourceId));
  }

  @PostMapping("/{sourceId}/cancel")
  public ResponseEntity<Void> cancel(@PathVariable String sourceId) {
    boolean running = runService.cancel(sourceId);
    return running ? ResponseEntity.accepted().build() : ResponseEntity.notFound().build();
  }

  @GetMapping("/checkpoints")
  public List<Checkpoint> checkpoints() {
    return checkpointStore.findAll();
  }

  @DeleteMapping("/checkpoints/{sourceId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void resetCheckpoint(@PathVariable String sourceId) {
    runService.resetCheckpoint(sourceId);
  }
}
