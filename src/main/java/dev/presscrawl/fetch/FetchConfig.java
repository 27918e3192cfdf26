package dev.presscrawl.fetch;

import java.net.http.HttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to fetch archive and article pages.
 *
 * <p>The client runs on the JDK {@link HttpClient}, so a blocked request is aborted when the
 * calling thread is interrupted. Browser-like default headers come from {@code presscrawl.http.*};
 * per-source headers are added on each request by {@link Fetcher}.
 */
@Configuration
public class FetchConfig {

    @Bean
    public RestClient archiveRestClient(RestClient.Builder builder, HttpProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        var requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.readTimeout());

        return builder
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, properties.userAgent())
                .defaultHeader(HttpHeaders.ACCEPT, properties.accept())
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, properties.acceptLanguage())
                .build();
    }

    /** Shared by request pacing and retry backoff. */
    @Bean
    public Sleeper crawlSleeper() {
        return new ThreadWaitSleeper();
    }
}
