package dev.presscrawl.crawl;

/**
 * Per-source tallies of a crawl run.
 *
 * @param candidatesFound         links extracted from archive pages
 * @param deduped                 candidates dropped because their URL was already stored
 * @param ingested                articles newly written
 * @param skippedPermanentFailure articles whose page could not be fetched
 * @param skippedEmptyContent     articles without body text
 * @param skippedDuplicate        articles stored concurrently by someone else (upsert no-ops)
 * @param parseErrors             archive or article pages that could not be interpreted
 * @param unitsCompleted          units checkpointed
 */
public record CrawlCounters(
    int candidatesFound,
    int deduped,
    int ingested,
    int skippedPermanentFailure,
    int skippedEmptyContent,
    int skippedDuplicate,
    int parseErrors,
    int unitsCompleted) {

  public static final CrawlCounters ZERO = new CrawlCounters(0, 0, 0, 0, 0, 0, 0, 0);

  public CrawlCounters plus(CrawlCounters other) {
    return new CrawlCounters(
        candidatesFound + other.candidatesFound,
        deduped + other.deduped,
        ingested + other.ingested,
        skippedPermanentFailure + other.skippedPermanentFailure,
        skippedEmptyContent + other.skippedEmptyContent,
        skippedDuplicate + other.skippedDuplicate,
        parseErrors + other.parseErrors,
        unitsCompleted + other.unitsCompleted);
  }

  public static CrawlCounters unitCompleted() {
    return new CrawlCounters(0, 0, 0, 0, 0, 0, 0, 1);
  }
}
