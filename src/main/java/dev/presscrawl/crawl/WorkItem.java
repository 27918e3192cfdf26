package dev.presscrawl.crawl;

import dev.presscrawl.checkpoint.UnitKey;

/**
 * One archive unit of a source scheduled for crawling.
 *
 * @param sourceId     source being crawled
 * @param unitKey      date or page to crawl
 * @param status       lifecycle status
 * @param attemptCount times the unit has been started in this run
 */
public record WorkItem(String sourceId, UnitKey unitKey, WorkItemStatus status, int attemptCount) {

  public static WorkItem pending(String sourceId, UnitKey unitKey) {
    return new WorkItem(sourceId, unitKey, WorkItemStatus.PENDING, 0);
  }

  public WorkItem withStatus(WorkItemStatus newStatus) {
    int attempts = newStatus == WorkItemStatus.IN_PROGRESS && status != WorkItemStatus.IN_PROGRESS
        ? attemptCount + 1
        : attemptCount;
    return new WorkItem(sourceId, unitKey, newStatus, attempts);
  }
}
