package dev.presscrawl.crawl;

public enum WorkItemStatus {
  PENDING,
  IN_PROGRESS,
  DONE,
  FAILED
}
