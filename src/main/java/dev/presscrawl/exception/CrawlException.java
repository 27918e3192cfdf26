package dev.presscrawl.exception;

/**
 * Base type for every failure raised by the crawl pipeline.
 *
 * <p>Subclasses map one-to-one onto the error taxonomy the driver reasons about: transient and
 * permanent fetch failures, page parse failures, store unavailability, invalid configuration and
 * run cancellation.
 */
public abstract class CrawlException extends RuntimeException {

  protected CrawlException(String message) {
    super(message);
  }

  protected CrawlException(String message, Throwable cause) {
    super(message, cause);
  }
}
