package dev.presscrawl.exception;

/**
 * The article store or checkpoint store could not be reached. Fatal to the current source run;
 * the checkpoint is left untouched so the run can be resumed.
 */
public class StoreUnavailableException extends CrawlException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
