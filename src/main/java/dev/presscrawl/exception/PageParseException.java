package dev.presscrawl.exception;

/**
 * Raised when an archive or article page cannot be interpreted. Distinct from a page that
 * legitimately lists zero articles, which is returned as an empty result.
 */
public class PageParseException extends CrawlException {

  private final String url;

  public PageParseException(String url, String message) {
    super(message);
    this.url = url;
  }

  public PageParseException(String url, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
  }

  public String url() {
    return url;
  }
}
