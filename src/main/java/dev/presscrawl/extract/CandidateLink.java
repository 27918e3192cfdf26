package dev.presscrawl.extract;

import dev.presscrawl.checkpoint.UnitKey;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * An article URL discovered on an archive page, with whatever the listing said about it.
 *
 * @param sourceId source the archive page belongs to
 * @param unitKey  archive unit whose page listed the link
 * @param url      normalized absolute article URL
 * @param metadata listing-provided fields such as {@code headline} or {@code category}
 */
public record CandidateLink(String sourceId, UnitKey unitKey, String url, Map<String, String> metadata) {

    public static final String HEADLINE = "headline";

    public CandidateLink {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public @Nullable String metadataValue(String key) {
        String value = metadata.get(key);
        return value == null || value.isBlank() ? null : value;
    }
}
