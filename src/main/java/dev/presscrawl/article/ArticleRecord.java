package dev.presscrawl.article;

import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One extracted news article, keyed by its canonical {@code sourceUrl}.
 *
 * <p>Records with {@code wordCount == 0} are never persisted.
 *
 * @param sourceUrl    canonical article URL, the deduplication key
 * @param sourceId     configured source that discovered the article
 * @param mediaName    outlet name, e.g. "News18"
 * @param title        headline
 * @param author       byline, if any
 * @param publishDate  ISO {@code yyyy-MM-dd} when parseable, otherwise the date text as published
 * @param modifiedDate last-modified date in the same format, if any
 * @param section      site section or category
 * @param bodyText     sanitized body text
 * @param tags         keywords published with the article
 * @param wordCount    whitespace-delimited words in {@code bodyText}
 * @param languageCode ISO 639-1 language of the source
 * @param unitKey      archive unit (date or page) whose listing yielded the article
 * @param fetchedAt    when the article page was fetched
 */
public record ArticleRecord(
        String sourceUrl,
        String sourceId,
        String mediaName,
        String title,
        @Nullable String author,
        @Nullable String publishDate,
        @Nullable String modifiedDate,
        @Nullable String section,
        String bodyText,
        List<String> tags,
        int wordCount,
        String languageCode,
        String unitKey,
        Instant fetchedAt
) {

    public ArticleRecord {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static int countWords(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
