package dev.presscrawl.crawl;

import dev.presscrawl.article.ArticleSink;
import dev.presscrawl.article.CommitResult;
import dev.presscrawl.checkpoint.Checkpoint;
import dev.presscrawl.checkpoint.CheckpointStore;
import dev.presscrawl.checkpoint.UnitKey;
import dev.presscrawl.exception.CrawlCancelledException;
import dev.presscrawl.exception.CrawlException;
import dev.presscrawl.exception.PageParseException;
import dev.presscrawl.exception.PermanentFetchException;
import dev.presscrawl.extract.ArchiveParserFactory;
import dev.presscrawl.extract.ArchiveUrlBuilder;
import dev.presscrawl.extract.CandidateLink;
import dev.presscrawl.fetch.FetchResult;
import dev.presscrawl.fetch.Fetcher;
import dev.presscrawl.source.Granularity;
import dev.presscrawl.source.SourceConfig;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Crawls one source from its checkpoint to the end of its range.
 *
 * <p>Units run strictly one after another. Each unit goes through fetching the archive page,
 * extracting candidates, dedup, parallel article extraction and commit; the checkpoint moves only
 * after the commit succeeded, so a crash or failure at any point leaves the unit to be redone on
 * the next run. Redoing is safe because committed articles are deduplicated.
 *
 * <p>Archive-level rules: a 404 ends a paginated archive and marks an empty day for a daily one;
 * any other unrecoverable archive fetch fails the unit and the run; an archive page that cannot be
 * parsed counts as a unit with no articles. Paginated sources also stop after
 * {@code max-consecutive-empty-pages} empty pages in a row.
 */
@Service
public class CrawlDriver {

  private static final Logger log = LoggerFactory.getLogger(CrawlDriver.class);

  private final WorkItemEnumerator enumerator;
  private final CheckpointStore checkpointStore;
  private final Fetcher fetcher;
  private final ArchiveParserFactory parserFactory;
  private final DedupFilter dedupFilter;
  private final ExtractionPool extractionPool;
  private final ArticleSink articleSink;
  private final CrawlProgressTracker progressTracker;
  private final CrawlProperties properties;
  private final Clock clock;

  public CrawlDriver(
      WorkItemEnumerator enumerator,
      CheckpointStore checkpointStore,
      Fetcher fetcher,
      ArchiveParserFactory parserFactory,
      DedupFilter dedupFilter,
      ExtractionPool extractionPool,
      ArticleSink articleSink,
      CrawlProgressTracker progressTracker,
      CrawlProperties properties,
      Clock clock) {
    this.enumerator = enumerator;
    this.checkpointStore = checkpointStore;
    this.fetcher = fetcher;
    this.parserFactory = parserFactory;
    this.dedupFilter = dedupFilter;
    this.extractionPool = extractionPool;
    this.articleSink = articleSink;
    this.progressTracker = progressTracker;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Crawl {@code source} until its range is exhausted, the archive ends, a unit fails or the crawl
   * is cancelled. Failures of the source are reported, not thrown.
   *
   * @throws IllegalStateException if the source is already being crawled
   */
  public SourceRunReport crawl(SourceConfig source) {
    String sourceId = source.id();
    Instant startedAt = clock.instant();
    progressTracker.startCrawl(sourceId);
    BooleanSupplier cancelled = () -> progressTracker.isCancelled(sourceId)
        || Thread.currentThread().isInterrupted();

    CrawlCounters counters = CrawlCounters.ZERO;
    @Nullable UnitKey lastCompleted = null;
    RunOutcome outcome = RunOutcome.COMPLETED;
    @Nullable String failure = null;
    try {
      Optional<Checkpoint> checkpoint = checkpointStore.load(sourceId);
      lastCompleted = checkpoint.map(Checkpoint::lastCompletedUnitKey).orElse(null);
      log.info("Crawling {} ({}) resuming after {}", sourceId, source.mediaName(),
          lastCompleted == null ? "nothing" : lastCompleted);

      int consecutiveEmpty = 0;
      try (Stream<WorkItem> workItems = enumerator.enumerate(source, checkpoint)) {
        Iterator<WorkItem> iterator = workItems.iterator();
        while (iterator.hasNext()) {
          if (cancelled.getAsBoolean()) {
            throw new CrawlCancelledException("Crawl of " + sourceId + " cancelled");
          }
          UnitRun unit = new UnitRun(iterator.next());
          UnitResult result = process(source, unit, cancelled);
          counters = counters.plus(result.counters());
          progressTracker.addCounters(sourceId, result.counters());

          if (result.endOfArchive()) {
            log.info("{} reached the end of its archive at {}", sourceId, unit.key());
            outcome = RunOutcome.END_OF_ARCHIVE;
            break;
          }

          lastCompleted = checkpointStore.advance(sourceId, unit.key()).lastCompletedUnitKey();
          counters = counters.plus(CrawlCounters.unitCompleted());
          progressTracker.addCounters(sourceId, CrawlCounters.unitCompleted());
          log.info("{} {} done: {} candidate(s), {} new article(s)", sourceId, unit.key(),
              result.counters().candidatesFound(), result.counters().ingested());

          if (source.granularity() == Granularity.PAGINATED) {
            consecutiveEmpty = result.counters().candidatesFound() == 0 ? consecutiveEmpty + 1 : 0;
            if (consecutiveEmpty >= properties.maxConsecutiveEmptyPages()) {
              log.info("{} returned {} empty page(s) in a row, treating as end of archive",
                  sourceId, consecutiveEmpty);
              outcome = RunOutcome.END_OF_ARCHIVE;
              break;
            }
          }
        }
      }
    } catch (CrawlCancelledException e) {
      log.info("Crawl of {} cancelled: {}", sourceId, e.getMessage());
      outcome = RunOutcome.CANCELLED;
    } catch (CrawlException e) {
      log.error("Crawl of {} failed: {}", sourceId, e.getMessage());
      outcome = RunOutcome.FAILED;
      failure = e.getMessage();
    } catch (RuntimeException e) {
      progressTracker.finishCrawl(sourceId, RunOutcome.FAILED, e.getMessage());
      throw e;
    }

    progressTracker.finishCrawl(sourceId, outcome, failure);
    log.info("Crawl of {} finished {}: {}", sourceId, outcome, counters);
    return new SourceRunReport(sourceId, outcome, counters, lastCompleted, failure, startedAt, clock.instant());
  }

  private UnitResult process(SourceConfig source, UnitRun unit, BooleanSupplier cancelled) {
    try {
      return runStages(source, unit, cancelled);
    } catch (RuntimeException e) {
      unit.fail();
      throw e;
    }
  }

  private UnitResult runStages(SourceConfig source, UnitRun unit, BooleanSupplier cancelled) {
    String sourceId = source.id();
    unit.moveTo(CrawlStage.FETCHING_ARCHIVE);
    String archiveUrl = ArchiveUrlBuilder.build(source, unit.key());
    FetchResult archivePage = fetcher.fetch(archiveUrl, source.fetchPolicy(), cancelled);
    if (!archivePage.isOk()) {
      if (archivePage.isNotFound() && source.granularity() == Granularity.PAGINATED) {
        return UnitResult.END_OF_ARCHIVE;
      }
      if (archivePage.isNotFound()) {
        log.info("{} has no archive page for {}", sourceId, unit.key());
        unit.moveTo(CrawlStage.DONE);
        return UnitResult.of(CrawlCounters.ZERO);
      }
      throw new PermanentFetchException(archiveUrl, archivePage.httpStatus(),
          "Archive page " + archiveUrl + " unavailable: " + archivePage.errorDetail());
    }

    unit.moveTo(CrawlStage.EXTRACTING_CANDIDATES);
    List<CandidateLink> candidates;
    try {
      candidates = parserFactory.parserFor(sourceId).parse(archivePage, unit.key());
    } catch (PageParseException e) {
      log.warn("{} archive page for {} could not be parsed: {}", sourceId, unit.key(), e.getMessage());
      unit.moveTo(CrawlStage.DONE);
      return UnitResult.of(new CrawlCounters(0, 0, 0, 0, 0, 0, 1, 0));
    }
    if (candidates.isEmpty()) {
      unit.moveTo(CrawlStage.DONE);
      return UnitResult.of(CrawlCounters.ZERO);
    }

    unit.moveTo(CrawlStage.DEDUPING);
    List<CandidateLink> fresh = dedupFilter.filter(candidates);
    int deduped = candidates.size() - fresh.size();
    if (fresh.isEmpty()) {
      log.debug("{} {}: all {} candidate(s) already stored", sourceId, unit.key(), candidates.size());
      unit.moveTo(CrawlStage.DONE);
      return UnitResult.of(new CrawlCounters(candidates.size(), deduped, 0, 0, 0, 0, 0, 0));
    }

    unit.moveTo(CrawlStage.PARALLEL_EXTRACTING);
    ExtractionBatch batch = extractionPool.extract(source, fresh, cancelled);

    unit.moveTo(CrawlStage.COMMITTING);
    CommitResult commit = articleSink.commit(batch.records());

    unit.moveTo(CrawlStage.DONE);
    return UnitResult.of(new CrawlCounters(
        candidates.size(),
        deduped,
        commit.written(),
        batch.count(ExtractionOutcome.Kind.SKIPPED_PERMANENT_FAILURE),
        batch.count(ExtractionOutcome.Kind.SKIPPED_EMPTY_CONTENT) + commit.droppedEmpty(),
        commit.alreadyPresent(),
        batch.count(ExtractionOutcome.Kind.SKIPPED_PARSE_ERROR),
        0));
  }

  /** Stage bookkeeping for the unit in flight. */
  private final class UnitRun {

    private WorkItem item;
    private CrawlStage stage = CrawlStage.PENDING;

    UnitRun(WorkItem item) {
      this.item = item;
    }

    UnitKey key() {
      return item.unitKey();
    }

    void moveTo(CrawlStage next) {
      if (!stage.canMoveTo(next)) {
        throw new IllegalStateException("Unit " + item.unitKey() + " cannot move from " + stage + " to " + next);
      }
      stage = next;
      item = item.withStatus(next.toStatus());
      progressTracker.enterStage(item.sourceId(), next, item.unitKey());
    }

    void fail() {
      if (!stage.isTerminal()) {
        moveTo(CrawlStage.FAILED);
      }
    }
  }

  private record UnitResult(CrawlCounters counters, boolean endOfArchive) {

    static final UnitResult END_OF_ARCHIVE = new UnitResult(CrawlCounters.ZERO, true);

    static UnitResult of(CrawlCounters counters) {
      return new UnitResult(counters, false);
    }
  }
}
