package dev.presscrawl.crawl;

import dev.presscrawl.article.ArticleRecord;
import dev.presscrawl.extract.CandidateLink;
import org.jspecify.annotations.Nullable;

/**
 * Terminal result of extracting one candidate.
 *
 * @param candidate the candidate processed
 * @param kind      how extraction ended
 * @param record    the article, present only for {@link Kind#PRODUCED}
 * @param detail    reason for a skip
 */
public record ExtractionOutcome(
    CandidateLink candidate, Kind kind, @Nullable ArticleRecord record, @Nullable String detail) {

  public enum Kind {
    PRODUCED,
    SKIPPED_PERMANENT_FAILURE,
    SKIPPED_EMPTY_CONTENT,
    SKIPPED_PARSE_ERROR
  }

  public static ExtractionOutcome produced(CandidateLink candidate, ArticleRecord record) {
    return new ExtractionOutcome(candidate, Kind.PRODUCED, record, null);
  }

  public static ExtractionOutcome skipped(CandidateLink candidate, Kind kind, String detail) {
    if (kind == Kind.PRODUCED) {
      throw new IllegalArgumentException("A skipped outcome cannot be PRODUCED");
    }
    return new ExtractionOutcome(candidate, kind, null, detail);
  }
}
