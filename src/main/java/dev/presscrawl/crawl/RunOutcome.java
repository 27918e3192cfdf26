package dev.presscrawl.crawl;

/** How a source's crawl ended. */
public enum RunOutcome {
  /** Every enumerated unit was committed. */
  COMPLETED,
  /** The source signalled that no further pages exist. */
  END_OF_ARCHIVE,
  FAILED,
  CANCELLED
}
