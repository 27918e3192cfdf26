package dev.presscrawl.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.presscrawl.source.SourceCatalog;
import dev.presscrawl.source.SourceConfig;
import java.util.HashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Builds one {@link ArchivePageParser} per configured source at startup.
 */
@Component
public class ArchiveParserFactory {

    private final Map<String, ArchivePageParser> parsers;

    public ArchiveParserFactory(SourceCatalog catalog, ObjectMapper objectMapper) {
        Map<String, ArchivePageParser> byId = new HashMap<>();
        for (SourceConfig source : catalog.all()) {
            byId.put(source.id(), create(source, objectMapper));
        }
        this.parsers = Map.copyOf(byId);
    }

    public ArchivePageParser parserFor(String sourceId) {
        ArchivePageParser parser = parsers.get(sourceId);
        if (parser == null) {
            throw new IllegalArgumentException("No archive parser for source: " + sourceId);
        }
        return parser;
    }

    static ArchivePageParser create(SourceConfig source, ObjectMapper objectMapper) {
        return switch (source.extractor()) {
            case ARCHIVE_HTML -> new ArchiveHtmlStrategy(source);
            case CATEGORY_LISTING -> new CategoryListingStrategy(source);
            case PAGINATED_API -> new PaginatedApiStrategy(source, objectMapper);
        };
    }
}
