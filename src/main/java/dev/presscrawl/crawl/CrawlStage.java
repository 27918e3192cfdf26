package dev.presscrawl.crawl;

/**
 * Stages a {@link WorkItem} passes through inside {@link CrawlDriver}.
 *
 * <p>Stages only move forward. A unit with nothing left to do may jump ahead (e.g. straight to
 * {@link #DONE} when its archive page lists no articles); {@link #FAILED} is reachable from every
 * non-terminal stage.
 */
public enum CrawlStage {
  PENDING,
  FETCHING_ARCHIVE,
  EXTRACTING_CANDIDATES,
  DEDUPING,
  PARALLEL_EXTRACTING,
  COMMITTING,
  DONE,
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }

  public boolean canMoveTo(CrawlStage next) {
    if (isTerminal()) {
      return false;
    }
    return next == FAILED || next.ordinal() > ordinal();
  }

  public WorkItemStatus toStatus() {
    return switch (this) {
      case PENDING -> WorkItemStatus.PENDING;
      case DONE -> WorkItemStatus.DONE;
      case FAILED -> WorkItemStatus.FAILED;
      default -> WorkItemStatus.IN_PROGRESS;
    };
  }
}
