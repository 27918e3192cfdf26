package dev.presscrawl.exception;

/** Invalid source configuration. Raised at startup and never downgraded to a warning. */
public class ConfigException extends CrawlException {

  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
