package dev.presscrawl.fetch;

import dev.presscrawl.exception.CrawlCancelledException;
import dev.presscrawl.exception.PermanentFetchException;
import dev.presscrawl.exception.TransientNetworkException;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.ExponentialRandomBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

/**
 * Fetches a URL politely and classifies the outcome.
 *
 * <p>Each attempt is preceded by a random delay from the {@link FetchPolicy}. Network errors,
 * HTTP 5xx, HTTP 429 and empty 2xx bodies are transient and retried with exponential backoff plus
 * jitter, up to {@code maxRetries} times. Any other non-2xx status is permanent and never retried.
 * When retries are exhausted the result is {@link FetchStatus#PERMANENT_ERROR}.
 *
 * <p>Cancellation (interruption of the calling thread, or the supplied flag turning true) aborts
 * the fetch with {@link CrawlCancelledException} instead of producing a result.
 */
@Component
public class Fetcher {

    private static final Logger log = LoggerFactory.getLogger(Fetcher.class);

    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final RestClient restClient;
    private final RequestPacer pacer;
    private final Sleeper backoffSleeper;

    public Fetcher(@Qualifier("archiveRestClient") RestClient restClient, RequestPacer pacer, Sleeper backoffSleeper) {
        this.restClient = restClient;
        this.pacer = pacer;
        this.backoffSleeper = backoffSleeper;
    }

    public FetchResult fetch(String url, FetchPolicy policy) {
        return fetch(url, policy, () -> false);
    }

    public FetchResult fetch(String url, FetchPolicy policy, BooleanSupplier cancelled) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            log.warn("GET {} not attempted: malformed URL", url);
            return FetchResult.permanentError(url, 0, "Malformed URL: " + e.getMessage(), 0);
        }
        if (!uri.isAbsolute()) {
            log.warn("GET {} not attempted: URL is not absolute", url);
            return FetchResult.permanentError(url, 0, "URL is not absolute", 0);
        }

        RetryTemplate retryTemplate = retryTemplate(policy);
        try {
            return retryTemplate.execute(
                    ctx -> attempt(uri, url, policy, ctx.getRetryCount() + 1, cancelled),
                    ctx -> recover(url, ctx));
        } catch (BackOffInterruptedException e) {
            throw new CrawlCancelledException("Interrupted during backoff for " + url);
        }
    }

    private FetchResult attempt(URI uri, String url, FetchPolicy policy, int attempt, BooleanSupplier cancelled) {
        checkCancelled(url, cancelled);
        pacer.pause(policy.minDelay(), policy.maxDelay());
        checkCancelled(url, cancelled);

        try {
            FetchResult result = restClient.get()
                    .uri(uri)
                    .headers(headers -> policy.headers().forEach(headers::set))
                    .exchange((request, response) -> classify(url, response, attempt), true);
            log.debug("GET {} attempt {}/{} -> {} (HTTP {})", url, attempt, policy.maxAttempts(),
                    FetchStatus.OK, result.httpStatus());
            return result;
        } catch (TransientNetworkException e) {
            log.warn("GET {} attempt {}/{} -> {} ({})", url, attempt, policy.maxAttempts(),
                    FetchStatus.TRANSIENT_ERROR, e.getMessage());
            throw e;
        } catch (PermanentFetchException e) {
            log.info("GET {} attempt {}/{} -> {} ({})", url, attempt, policy.maxAttempts(),
                    FetchStatus.PERMANENT_ERROR, e.getMessage());
            throw e;
        } catch (ResourceAccessException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CrawlCancelledException("Fetch of " + url + " interrupted");
            }
            log.warn("GET {} attempt {}/{} -> {} ({})", url, attempt, policy.maxAttempts(),
                    FetchStatus.TRANSIENT_ERROR, e.getMessage());
            throw new TransientNetworkException(url, "I/O error: " + e.getMessage(), e);
        }
    }

    private FetchResult classify(String url, ClientHttpResponse response, int attempt) throws IOException {
        HttpStatusCode status = response.getStatusCode();
        int code = status.value();
        if (status.is2xxSuccessful()) {
            String body = StreamUtils.copyToString(response.getBody(), charsetOf(response));
            if (body.isBlank()) {
                throw new TransientNetworkException(url, code, "empty response body");
            }
            return FetchResult.ok(url, body, code, attempt);
        }
        if (status.is5xxServerError() || code == 429) {
            throw new TransientNetworkException(url, code, "HTTP " + code);
        }
        throw new PermanentFetchException(url, code, "HTTP " + code);
    }

    private FetchResult recover(String url, RetryContext ctx) {
        Throwable last = ctx.getLastThrowable();
        int attempts = ctx.getRetryCount();
        if (last instanceof PermanentFetchException permanent) {
            return FetchResult.permanentError(url, permanent.httpStatus(), permanent.getMessage(), attempts);
        }
        if (last instanceof TransientNetworkException transientError) {
            log.warn("GET {} giving up after {} attempt(s): {}", url, attempts, transientError.getMessage());
            return FetchResult.permanentError(url, transientError.httpStatus(),
                    "retries exhausted: " + transientError.getMessage(), attempts);
        }
        if (last instanceof RuntimeException runtime) {
            throw runtime;
        }
        throw new IllegalStateException("Unexpected failure fetching " + url, last);
    }

    private RetryTemplate retryTemplate(FetchPolicy policy) {
        ExponentialRandomBackOffPolicy backOff = new ExponentialRandomBackOffPolicy();
        backOff.setInitialInterval(policy.baseBackoff().toMillis());
        backOff.setMaxInterval(policy.maxBackoff().toMillis());
        backOff.setMultiplier(BACKOFF_MULTIPLIER);
        backOff.setSleeper(backoffSleeper);

        return RetryTemplate.builder()
                .maxAttempts(policy.maxAttempts())
                .retryOn(TransientNetworkException.class)
                .customBackoff(backOff)
                .build();
    }

    private static void checkCancelled(String url, BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
            throw new CrawlCancelledException("Fetch of " + url + " cancelled");
        }
    }

    private static Charset charsetOf(ClientHttpResponse response) {
        MediaType contentType = response.getHeaders().getContentType();
        if (contentType != null && contentType.getCharset() != null) {
            return contentType.getCharset();
        }
        return StandardCharsets.UTF_8;
    }
}
