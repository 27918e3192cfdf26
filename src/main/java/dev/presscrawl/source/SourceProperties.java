package dev.presscrawl.source;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Binds the {@code presscrawl.sources} list. Validation happens in {@link SourceCatalog}. */
@ConfigurationProperties(prefix = "presscrawl")
public record SourceProperties(List<SourceConfig> sources) {

    public SourceProperties {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
