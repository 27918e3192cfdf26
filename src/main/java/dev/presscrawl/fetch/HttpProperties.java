package dev.presscrawl.fetch;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "presscrawl.http")
public record HttpProperties(
        @DefaultValue("10s") Duration connectTimeout,
        @DefaultValue("30s") Duration readTimeout,
        @DefaultValue("Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36")
        String userAgent,
        @DefaultValue("text/html,application/xhtml+xml,application/json;q=0.9,*/*;q=0.8") String accept,
        @DefaultValue("en-US,en;q=0.9") String acceptLanguage
) {
}
