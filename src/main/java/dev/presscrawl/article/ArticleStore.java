package dev.presscrawl.article;

import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JDBC access to the {@code articles} table.
 *
 * <p>Inserts use {@code ON CONFLICT (source_url) DO NOTHING}, so re-committing an article that is
 * already stored is a no-op rather than an error.
 */
@Repository
public class ArticleStore {

    private static final String EXISTING_URLS_SQL =
            "SELECT source_url FROM articles WHERE source_url IN (:urls)";

    private static final String INSERT_SQL = """
            INSERT INTO articles (source_url, source_id, media_name, title, author, publish_date,
                                  modified_date, section, body_text, tags, word_count, language_code,
                                  unit_key, fetched_at)
            VALUES (:sourceUrl, :sourceId, :mediaName, :title, :author, :publishDate,
                    :modifiedDate, :section, :bodyText, :tags, :wordCount, :languageCode,
                    :unitKey, :fetchedAt)
            ON CONFLICT (source_url) DO NOTHING
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public ArticleStore(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Returns the subset of {@code sourceUrls} already present in the store.
     * Callers are expected to keep the collection within database parameter limits.
     */
    public Set<String> findExistingSourceUrls(Collection<String> sourceUrls) {
        if (sourceUrls.isEmpty()) {
            return Set.of();
        }
        List<String> found = jdbcTemplate.queryForList(
                EXISTING_URLS_SQL, Map.of("urls", sourceUrls), String.class);
        return new HashSet<>(found);
    }

    /**
     * Inserts all records in one transaction, skipping those whose URL is already stored.
     *
     * @return the records actually inserted, in input order
     */
    @Transactional
    public List<ArticleRecord> insertIfAbsent(List<ArticleRecord> records) {
        if (records.isEmpty()) {
            return List.of();
        }
        SqlParameterSource[] batch = records.stream()
                .map(ArticleStore::toParameters)
                .toArray(SqlParameterSource[]::new);
        int[] counts = jdbcTemplate.batchUpdate(INSERT_SQL, batch);
        List<ArticleRecord> inserted = new ArrayList<>();
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] == 1) {
                inserted.add(records.get(i));
            }
        }
        return inserted;
    }

    private static SqlParameterSource toParameters(ArticleRecord record) {
        return new MapSqlParameterSource()
                .addValue("sourceUrl", record.sourceUrl())
                .addValue("sourceId", record.sourceId())
                .addValue("mediaName", record.mediaName())
                .addValue("title", record.title())
                .addValue("author", record.author(), Types.VARCHAR)
                .addValue("publishDate", record.publishDate(), Types.VARCHAR)
                .addValue("modifiedDate", record.modifiedDate(), Types.VARCHAR)
                .addValue("section", record.section(), Types.VARCHAR)
                .addValue("bodyText", record.bodyText())
                .addValue("tags", record.tags().toArray(String[]::new))
                .addValue("wordCount", record.wordCount())
                .addValue("languageCode", record.languageCode())
                .addValue("unitKey", record.unitKey())
                .addValue("fetchedAt", OffsetDateTime.ofInstant(record.fetchedAt(), ZoneOffset.UTC));
    }
}
