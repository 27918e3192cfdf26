package dev.presscrawl.fetch;

import org.jspecify.annotations.Nullable;

/**
 * Result of fetching one URL, after pacing and retries.
 *
 * @param url         the requested URL
 * @param status      final outcome
 * @param rawPayload  response body, present only when {@code status} is {@link FetchStatus#OK}
 * @param httpStatus  last HTTP status seen, 0 when no response was received
 * @param errorDetail human-readable failure reason, null on success
 * @param attempts    number of HTTP attempts made
 */
public record FetchResult(
        String url,
        FetchStatus status,
        @Nullable String rawPayload,
        int httpStatus,
        @Nullable String errorDetail,
        int attempts
) {

    public static FetchResult ok(String url, String rawPayload, int httpStatus, int attempts) {
        return new FetchResult(url, FetchStatus.OK, rawPayload, httpStatus, null, attempts);
    }

    public static FetchResult permanentError(String url, int httpStatus, String errorDetail, int attempts) {
        return new FetchResult(url, FetchStatus.PERMANENT_ERROR, null, httpStatus, errorDetail, attempts);
    }

    public boolean isOk() {
        return status == FetchStatus.OK;
    }

    public boolean isNotFound() {
        return status == FetchStatus.PERMANENT_ERROR && httpStatus == 404;
    }
}
