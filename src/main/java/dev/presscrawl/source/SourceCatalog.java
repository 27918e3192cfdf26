package dev.presscrawl.source;

import dev.presscrawl.exception.ConfigException;
import java.net.URI;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Validated, read-only registry of configured sources.
 *
 * <p>Validation runs in the constructor, so an invalid source aborts application startup with a
 * {@link ConfigException} naming the offending property.
 */
@Component
public class SourceCatalog {

    private static final Logger log = LoggerFactory.getLogger(SourceCatalog.class);

    private static final Pattern SOURCE_ID = Pattern.compile("[a-z0-9][a-z0-9_-]*");
    private static final List<String> DATE_PLACEHOLDERS =
            List.of("{date}", "{yyyy}", "{MM}", "{dd}", "{M}", "{d}");
    private static final int MAX_POOL_SIZE = 64;

    private final Map<String, SourceConfig> sources;
    private final List<String> orderedIds;

    public SourceCatalog(SourceProperties properties) {
        Map<String, SourceConfig> byId = new LinkedHashMap<>();
        for (SourceConfig source : properties.sources()) {
            validate(source);
            if (byId.putIfAbsent(source.id(), source) != null) {
                throw new ConfigException("Duplicate source id: " + source.id());
            }
        }
        this.sources = Map.copyOf(byId);
        this.orderedIds = List.copyOf(byId.keySet());
        log.info("Loaded {} source(s): {}", orderedIds.size(), orderedIds);
    }

    public List<SourceConfig> all() {
        return orderedIds.stream().map(sources::get).toList();
    }

    public List<SourceConfig> enabled() {
        return all().stream().filter(SourceConfig::enabled).toList();
    }

    public Optional<SourceConfig> find(String sourceId) {
        return Optional.ofNullable(sources.get(sourceId));
    }

    /**
     * @throws IllegalArgumentException if no source with this id is configured
     */
    public SourceConfig require(String sourceId) {
        return find(sourceId).orElseThrow(() -> new IllegalArgumentException("Unknown source: " + sourceId));
    }

    static void validate(SourceConfig source) {
        if (source.id() == null || !SOURCE_ID.matcher(source.id()).matches()) {
            throw new ConfigException("presscrawl.sources[].id must match " + SOURCE_ID.pattern()
                    + ", got: " + source.id());
        }
        String prefix = "presscrawl.sources[" + source.id() + "].";
        require(source.mediaName() != null && !source.mediaName().isBlank(), prefix + "media-name is required");
        require(source.languageCode() != null && !source.languageCode().isBlank(),
                prefix + "language-code is required");
        require(source.granularity() != null, prefix + "granularity is required");
        require(source.extractor() != null, prefix + "extractor is required");
        require(source.baseUrlTemplate() != null && !source.baseUrlTemplate().isBlank(),
                prefix + "base-url-template is required");

        switch (source.granularity()) {
            case DAILY -> validateDailyRange(source, prefix);
            case PAGINATED -> validatePageRange(source, prefix);
        }
        validateUrl(sampleUrl(source.baseUrlTemplate()), prefix + "base-url-template");
        if (source.firstPageUrl() != null) {
            validateUrl(source.firstPageUrl(), prefix + "first-page-url");
        }

        require(!source.minDelay().isNegative(), prefix + "min-delay must not be negative");
        require(source.maxDelay().compareTo(source.minDelay()) >= 0, prefix + "max-delay must be >= min-delay");
        require(source.maxRetries() >= 0, prefix + "max-retries must not be negative");
        require(source.baseBackoff().toMillis() > 0, prefix + "base-backoff must be positive");
        require(source.maxBackoff().compareTo(source.baseBackoff()) >= 0,
                prefix + "max-backoff must be >= base-backoff");
        require(source.poolSize() >= 1 && source.poolSize() <= MAX_POOL_SIZE,
                prefix + "pool-size must be in [1, " + MAX_POOL_SIZE + "], got: " + source.poolSize());

        validateLinkRules(source, prefix);
    }

    private static void validateDailyRange(SourceConfig source, String prefix) {
        require(DATE_PLACEHOLDERS.stream().anyMatch(source.baseUrlTemplate()::contains),
                prefix + "base-url-template needs a date placeholder for DAILY sources");
        require(source.startDate() != null, prefix + "start-date is required for DAILY sources");
        try {
            LocalDate start = source.rangeStartDate();
            source.rangeEndDate().ifPresent(end -> require(!end.isBefore(start),
                    prefix + "end-date must not be before start-date"));
        } catch (DateTimeParseException e) {
            throw new ConfigException(prefix + "start-date/end-date must be ISO dates (yyyy-MM-dd)", e);
        }
    }

    private static void validatePageRange(SourceConfig source, String prefix) {
        require(source.baseUrlTemplate().contains("{page}"),
                prefix + "base-url-template needs a {page} placeholder for PAGINATED sources");
        require(source.startPage() >= 1, prefix + "start-page must be >= 1");
        require(source.endPage() == null || source.endPage() >= source.startPage(),
                prefix + "end-page must be >= start-page");
    }

    private static void validateLinkRules(SourceConfig source, String prefix) {
        LinkRules links = source.links();
        if (links.linkPattern() != null) {
            try {
                Pattern.compile(links.linkPattern());
            } catch (PatternSyntaxException e) {
                throw new ConfigException(prefix + "links.link-pattern is not a valid regex", e);
            }
        }
        if (links.itemsPath() != null && !links.itemsPath().isBlank() && !links.itemsPath().startsWith("/")) {
            throw new ConfigException(prefix + "links.items-path must be a JSON pointer starting with '/'");
        }
        if (source.extractor() == ExtractorType.PAGINATED_API) {
            require(links.urlField() != null || links.articleUrlTemplate() != null,
                    prefix + "links.url-field or links.article-url-template is required for PAGINATED_API");
        }
    }

    private static String sampleUrl(String template) {
        return template
                .replace("{date}", "2024-01-01")
                .replace("{yyyy}", "2024")
                .replace("{MM}", "01")
                .replace("{dd}", "01")
                .replace("{M}", "1")
                .replace("{d}", "1")
                .replace("{page}", "1");
    }

    private static void validateUrl(String url, String property) {
        try {
            URI uri = URI.create(url);
            require(uri.getHost() != null && ("http".equals(uri.getScheme()) || "https".equals(uri.getScheme())),
                    property + " must be an absolute http(s) URL, got: " + url);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(property + " is not a valid URL: " + url, e);
        }
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigException(message);
        }
    }
}
