package dev.presscrawl.crawl;

import dev.presscrawl.article.ArticleRecord;
import dev.presscrawl.exception.CrawlCancelledException;
import dev.presscrawl.exception.PageParseException;
import dev.presscrawl.extract.ArticlePageParser;
import dev.presscrawl.extract.CandidateLink;
import dev.presscrawl.fetch.FetchResult;
import dev.presscrawl.fetch.Fetcher;
import dev.presscrawl.source.SourceConfig;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fetches and parses the article pages of one unit on a bounded pool of worker threads.
 *
 * <p>Each call gets its own pool of at most {@code poolSize} threads, torn down before returning.
 * Every candidate ends in exactly one {@link ExtractionOutcome}; a failing article never affects
 * its siblings. When the cancellation flag turns true, in-flight workers are interrupted and the
 * call throws {@link CrawlCancelledException}.
 */
@Component
public class ExtractionPool {

  private static final Logger log = LoggerFactory.getLogger(ExtractionPool.class);

  private static final long POLL_INTERVAL_MS = 250;

  private final Fetcher fetcher;
  private final ArticlePageParser articlePageParser;

  public ExtractionPool(Fetcher fetcher, ArticlePageParser articlePageParser) {
    this.fetcher = fetcher;
    this.articlePageParser = articlePageParser;
  }

  public ExtractionBatch extract(SourceConfig source, List<CandidateLink> candidates, BooleanSupplier cancelled) {
    if (candidates.isEmpty()) {
      return ExtractionBatch.EMPTY;
    }
    int threads = Math.min(source.poolSize(), candidates.size());
    ExecutorService executor = Executors.newFixedThreadPool(threads, workerThreads(source.id()));
    CompletionService<IndexedOutcome> completion = new ExecutorCompletionService<>(executor);
    try {
      for (int i = 0; i < candidates.size(); i++) {
        int index = i;
        CandidateLink candidate = candidates.get(i);
        completion.submit(() -> new IndexedOutcome(index, extractOne(source, candidate, cancelled)));
      }

      ExtractionOutcome[] outcomes = new ExtractionOutcome[candidates.size()];
      int done = 0;
      while (done < candidates.size()) {
        if (cancelled.getAsBoolean()) {
          throw new CrawlCancelledException("Extraction for " + source.id() + " cancelled with "
              + (candidates.size() - done) + " article(s) in flight");
        }
        Future<IndexedOutcome> future = completion.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
        if (future != null) {
          IndexedOutcome outcome = await(future);
          outcomes[outcome.index()] = outcome.outcome();
          done++;
        }
      }
      return new ExtractionBatch(Arrays.asList(outcomes));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CrawlCancelledException("Extraction for " + source.id() + " interrupted");
    } finally {
      executor.shutdownNow();
    }
  }

  ExtractionOutcome extractOne(SourceConfig source, CandidateLink candidate, BooleanSupplier cancelled) {
    try {
      FetchResult page = fetcher.fetch(candidate.url(), source.fetchPolicy(), cancelled);
      if (!page.isOk()) {
        log.warn("Skipping {}: {}", candidate.url(), page.errorDetail());
        return ExtractionOutcome.skipped(candidate, ExtractionOutcome.Kind.SKIPPED_PERMANENT_FAILURE,
            page.errorDetail() == null ? "fetch failed" : page.errorDetail());
      }
      ArticleRecord record = articlePageParser.parse(candidate, page, source);
      if (record.wordCount() == 0) {
        log.warn("Skipping {}: no article text found", candidate.url());
        return ExtractionOutcome.skipped(candidate, ExtractionOutcome.Kind.SKIPPED_EMPTY_CONTENT, "empty body");
      }
      log.debug("Extracted {} ({} words)", candidate.url(), record.wordCount());
      return ExtractionOutcome.produced(candidate, record);
    } catch (CrawlCancelledException e) {
      throw e;
    } catch (PageParseException e) {
      log.warn("Skipping {}: {}", candidate.url(), e.getMessage());
      return ExtractionOutcome.skipped(candidate, ExtractionOutcome.Kind.SKIPPED_PARSE_ERROR, e.getMessage());
    } catch (RuntimeException e) {
      log.error("Unexpected error extracting {}", candidate.url(), e);
      return ExtractionOutcome.skipped(candidate, ExtractionOutcome.Kind.SKIPPED_PARSE_ERROR,
          e.getClass().getSimpleName() + ": " + e.getMessage());
    }
  }

  private static IndexedOutcome await(Future<IndexedOutcome> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      if (e.getCause() instanceof CrawlCancelledException cancelled) {
        throw cancelled;
      }
      throw new IllegalStateException("Extraction worker failed", e.getCause());
    }
  }

  private static ThreadFactory workerThreads(String sourceId) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, "extract-" + sourceId + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  private record IndexedOutcome(int index, ExtractionOutcome outcome) {}
}
