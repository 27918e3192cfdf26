package dev.presscrawl.exception;

/** A non-retryable fetch failure (HTTP 4xx other than 429, or an unusable request). */
public class PermanentFetchException extends CrawlException {

  private final String url;
  private final int httpStatus;

  public PermanentFetchException(String url, int httpStatus, String message) {
    super(message);
    this.url = url;
    this.httpStatus = httpStatus;
  }

  public String url() {
    return url;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
