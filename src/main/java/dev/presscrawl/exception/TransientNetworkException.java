package dev.presscrawl.exception;

/**
 * A retryable fetch failure: connection problems, timeouts, HTTP 5xx, HTTP 429 or an empty body.
 * Only this type is retried by the fetcher's backoff policy.
 */
public class TransientNetworkException extends CrawlException {

  private final String url;
  private final int httpStatus;

  public TransientNetworkException(String url, int httpStatus, String message) {
    super(message);
    this.url = url;
    this.httpStatus = httpStatus;
  }

  public TransientNetworkException(String url, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
    this.httpStatus = 0;
  }

  public String url() {
    return url;
  }

  /** HTTP status of the failed attempt, or {@code 0} when no response was received. */
  public int httpStatus() {
    return httpStatus;
  }
}
