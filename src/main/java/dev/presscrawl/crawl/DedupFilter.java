package dev.presscrawl.crawl;

import dev.presscrawl.article.ArticleStore;
import dev.presscrawl.exception.StoreUnavailableException;
import dev.presscrawl.extract.CandidateLink;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * Drops candidates whose URL is already stored, and repeats of a URL within the batch.
 *
 * <p>Lookups are batched, at most {@code presscrawl.store.lookup-batch-size} URLs per query. If
 * the store cannot answer, nothing is assumed: the call fails with
 * {@link StoreUnavailableException}.
 */
@Component
public class DedupFilter {

  private static final Logger log = LoggerFactory.getLogger(DedupFilter.class);

  private final ArticleStore articleStore;
  private final int lookupBatchSize;

  public DedupFilter(
      ArticleStore articleStore,
      @Value("${presscrawl.store.lookup-batch-size:1000}") int lookupBatchSize) {
    if (lookupBatchSize < 1) {
      throw new IllegalStateException("presscrawl.store.lookup-batch-size must be >= 1");
    }
    this.articleStore = articleStore;
    this.lookupBatchSize = lookupBatchSize;
  }

  /**
   * @return the candidates not yet stored, in input order, first occurrence of each URL only
   */
  public List<CandidateLink> filter(List<CandidateLink> candidates) {
    Map<String, CandidateLink> unique = new LinkedHashMap<>();
    for (CandidateLink candidate : candidates) {
      unique.putIfAbsent(candidate.url(), candidate);
    }
    if (unique.isEmpty()) {
      return List.of();
    }

    Set<String> existing = new HashSet<>();
    List<String> urls = new ArrayList<>(unique.keySet());
    for (int from = 0; from < urls.size(); from += lookupBatchSize) {
      List<String> batch = urls.subList(from, Math.min(from + lookupBatchSize, urls.size()));
      try {
        existing.addAll(articleStore.findExistingSourceUrls(batch));
      } catch (DataAccessException | TransactionException e) {
        throw new StoreUnavailableException("Dedup lookup failed for " + batch.size() + " URL(s)", e);
      }
    }

    List<CandidateLink> fresh = unique.values().stream()
        .filter(candidate -> !existing.contains(candidate.url()))
        .toList();
    log.debug("Dedup kept {} of {} candidate(s)", fresh.size(), candidates.size());
    return fresh;
  }
}
