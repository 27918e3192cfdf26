package dev.presscrawl.source;

import dev.presscrawl.fetch.FetchPolicy;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Static configuration of one news source, bound from {@code presscrawl.sources[*]}.
 *
 * <p>Instances are validated once by {@link SourceCatalog}; code downstream of the catalog can
 * rely on the date bounds parsing and on the delay, retry and pool settings being in range.
 *
 * <p>{@code baseUrlTemplate} placeholders: {@code {date}} (yyyy-MM-dd), {@code {yyyy}},
 * {@code {MM}}, {@code {dd}}, {@code {M}}, {@code {d}} for daily sources and {@code {page}} for
 * paginated ones. {@code firstPageUrl}, when set, replaces the template for page 1.
 */
public record SourceConfig(
        String id,
        String mediaName,
        @DefaultValue("en") String languageCode,
        @DefaultValue("true") boolean enabled,
        Granularity granularity,
        ExtractorType extractor,
        String baseUrlTemplate,
        @Nullable String firstPageUrl,
        @Nullable String startDate,
        @Nullable String endDate,
        @DefaultValue("1") int startPage,
        @Nullable Integer endPage,
        @DefaultValue("1s") Duration minDelay,
        @DefaultValue("3s") Duration maxDelay,
        @DefaultValue("3") int maxRetries,
        @DefaultValue("2s") Duration baseBackoff,
        @DefaultValue("60s") Duration maxBackoff,
        @DefaultValue("5") int poolSize,
        @DefaultValue("true") boolean stripQuery,
        Map<String, String> headers,
        @DefaultValue LinkRules links,
        List<String> bodySelectors
) {

    public SourceConfig {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        links = links == null ? LinkRules.acceptAll() : links;
        bodySelectors = bodySelectors == null ? List.of() : List.copyOf(bodySelectors);
    }

    public LocalDate rangeStartDate() {
        return LocalDate.parse(startDate);
    }

    public Optional<LocalDate> rangeEndDate() {
        return endDate == null || endDate.isBlank() ? Optional.empty() : Optional.of(LocalDate.parse(endDate));
    }

    public FetchPolicy fetchPolicy() {
        return new FetchPolicy(minDelay, maxDelay, maxRetries, baseBackoff, maxBackoff, headers);
    }
}
