package dev.presscrawl.fetch;

import dev.presscrawl.exception.CrawlCancelledException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Component;

/**
 * Sleeps a uniformly random delay in {@code [min, max]} before every request to a source.
 */
@Component
public class RequestPacer {

    private final Sleeper sleeper;

    public RequestPacer(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * @throws CrawlCancelledException if the calling thread is interrupted while waiting
     */
    public void pause(Duration min, Duration max) {
        long delay = delayMillis(min, max);
        if (delay <= 0) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlCancelledException("Interrupted while pacing requests");
        }
    }

    long delayMillis(Duration min, Duration max) {
        long lower = min.toMillis();
        long upper = Math.max(lower, max.toMillis());
        if (lower == upper) {
            return lower;
        }
        return ThreadLocalRandom.current().nextLong(lower, upper + 1);
    }
}
