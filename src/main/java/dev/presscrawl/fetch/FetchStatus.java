package dev.presscrawl.fetch;

/**
 * Outcome class of a fetch attempt.
 *
 * <p>{@link Fetcher} only ever returns {@code OK} or {@code PERMANENT_ERROR}; {@code TRANSIENT_ERROR}
 * describes an individual attempt that will be retried and appears in attempt logs.
 */
public enum FetchStatus {
    OK,
    TRANSIENT_ERROR,
    PERMANENT_ERROR
}
