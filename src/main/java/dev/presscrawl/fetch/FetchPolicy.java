package dev.presscrawl.fetch;

import java.time.Duration;
import java.util.Map;

/**
 * Per-source politeness and retry settings applied by {@link Fetcher}.
 *
 * @param minDelay    lower bound of the random delay before each attempt
 * @param maxDelay    upper bound of the random delay before each attempt
 * @param maxRetries  retries after the first attempt for transient failures
 * @param baseBackoff first backoff interval
 * @param maxBackoff  cap on any single backoff interval
 * @param headers     extra request headers (e.g. {@code Referer}, {@code Authorization})
 */
public record FetchPolicy(
        Duration minDelay,
        Duration maxDelay,
        int maxRetries,
        Duration baseBackoff,
        Duration maxBackoff,
        Map<String, String> headers
) {

    public FetchPolicy {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }
}
