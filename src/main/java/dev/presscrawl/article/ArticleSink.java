package dev.presscrawl.article;

import dev.presscrawl.exception.StoreUnavailableException;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Durably writes extracted articles.
 *
 * <p>Records without words are dropped. The remaining records are inserted idempotently in one
 * transaction; afterwards the newly inserted ones are appended to the {@link LocalArticleCache},
 * whose failures are logged and otherwise ignored. A record whose URL was already stored is not
 * appended again, so the cache holds each URL at most once.
 */
@Service
public class ArticleSink {

    private static final Logger log = LoggerFactory.getLogger(ArticleSink.class);

    private final ArticleStore articleStore;
    private final LocalArticleCache cache;

    public ArticleSink(ArticleStore articleStore, LocalArticleCache cache) {
        this.articleStore = articleStore;
        this.cache = cache;
    }

    /**
     * @throws StoreUnavailableException if the transaction could not be committed; nothing from
     *                                   this call is then stored
     */
    public CommitResult commit(List<ArticleRecord> records) {
        List<ArticleRecord> persistable = records.stream().filter(r -> r.wordCount() > 0).toList();
        int droppedEmpty = records.size() - persistable.size();
        if (droppedEmpty > 0) {
            log.warn("Dropping {} article(s) without body text", droppedEmpty);
        }
        if (persistable.isEmpty()) {
            return new CommitResult(0, 0, droppedEmpty);
        }

        List<ArticleRecord> inserted;
        try {
            inserted = articleStore.insertIfAbsent(persistable);
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("Failed to commit " + persistable.size() + " article(s)", e);
        }
        log.debug("Committed {} of {} article(s)", inserted.size(), persistable.size());

        appendToCache(inserted);
        return new CommitResult(inserted.size(), persistable.size() - inserted.size(), droppedEmpty);
    }

    private void appendToCache(List<ArticleRecord> records) {
        if (records.isEmpty() || !cache.isEnabled()) {
            return;
        }
        Map<String, List<ArticleRecord>> bySource = records.stream()
                .collect(Collectors.groupingBy(ArticleRecord::sourceId, LinkedHashMap::new, Collectors.toList()));
        bySource.forEach((sourceId, sourceRecords) -> {
            try {
                cache.append(sourceId, sourceRecords);
            } catch (IOException e) {
                log.warn("Local cache append failed for {} ({} article(s)): {}",
                        sourceId, sourceRecords.size(), e.getMessage());
            }
        });
    }
}
