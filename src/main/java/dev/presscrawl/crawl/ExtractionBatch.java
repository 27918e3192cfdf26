package dev.presscrawl.crawl;

import dev.presscrawl.article.ArticleRecord;
import java.util.List;
import java.util.Objects;

/** Outcomes of one {@link ExtractionPool#extract} call, in candidate order. */
public record ExtractionBatch(List<ExtractionOutcome> outcomes) {

  public static final ExtractionBatch EMPTY = new ExtractionBatch(List.of());

  public ExtractionBatch {
    outcomes = List.copyOf(outcomes);
  }

  public List<ArticleRecord> records() {
    return outcomes.stream()
        .filter(outcome -> outcome.kind() == ExtractionOutcome.Kind.PRODUCED)
        .map(ExtractionOutcome::record)
        .filter(Objects::nonNull)
        .toList();
  }

  public int count(ExtractionOutcome.Kind kind) {
    return (int) outcomes.stream().filter(outcome -> outcome.kind() == kind).count();
  }
}
