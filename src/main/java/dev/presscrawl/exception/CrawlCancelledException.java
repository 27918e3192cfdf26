package dev.presscrawl.exception;

/** Thrown inside a source run once its cancellation signal has been raised. */
public class CrawlCancelledException extends CrawlException {

  public CrawlCancelledException(String message) {
    super(message);
  }
}
