package dev.presscrawl.source;

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Site-specific rules used to pick article links out of an archive page.
 *
 * <p>HTML strategies use {@code linkPattern}, {@code excludePatterns} and {@code sameSiteOnly}.
 * The JSON API strategy uses {@code itemsPath} (a JSON pointer, empty for a root array) together
 * with either {@code urlField} or {@code articleUrlTemplate}, whose {@code {field}} placeholders
 * are filled from each item. {@code metadataFields} are copied from API items onto candidates.
 *
 * @param linkPattern        regex an absolute article URL must match, or null to accept any link
 * @param excludePatterns    URL fragments that disqualify a link (e.g. {@code /tag/})
 * @param sameSiteOnly       whether links must share the archive page's host
 * @param itemsPath          JSON pointer to the items array in an API response
 * @param urlField           item field holding an absolute or relative article URL
 * @param articleUrlTemplate template building an article URL from item fields
 * @param metadataFields     item fields copied into candidate metadata
 */
public record LinkRules(
        @Nullable String linkPattern,
        List<String> excludePatterns,
        @DefaultValue("true") boolean sameSiteOnly,
        @Nullable String itemsPath,
        @Nullable String urlField,
        @Nullable String articleUrlTemplate,
        List<String> metadataFields
) {

    public LinkRules {
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
        metadataFields = metadataFields == null ? List.of() : List.copyOf(metadataFields);
    }

    /** Rules that accept every same-site link. */
    public static LinkRules acceptAll() {
        return new LinkRules(null, List.of(), true, null, null, null, List.of());
    }
}
