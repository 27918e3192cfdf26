package dev.presscrawl.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.presscrawl.checkpoint.UnitKey;
import dev.presscrawl.exception.PageParseException;
import dev.presscrawl.fetch.FetchResult;
import dev.presscrawl.source.LinkRules;
import dev.presscrawl.source.SourceConfig;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON listing APIs returning one page of article stubs per request.
 *
 * <p>Items are read from the array at {@link LinkRules#itemsPath()} (a JSON pointer such as
 * {@code /data/items}; the root when unset). A missing or null array means the page is empty.
 * Each item's article URL comes from {@link LinkRules#urlField()}, or is rendered from
 * {@link LinkRules#articleUrlTemplate()} whose {@code {field}} placeholders take item values.
 * Items lacking the needed fields are skipped.
 */
public class PaginatedApiStrategy implements ArchivePageParser {

    private static final Logger log = LoggerFactory.getLogger(PaginatedApiStrategy.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_.-]+)}");

    private final String sourceId;
    private final LinkRules rules;
    private final boolean stripQuery;
    private final ObjectMapper objectMapper;

    public PaginatedApiStrategy(SourceConfig source, ObjectMapper objectMapper) {
        this.sourceId = source.id();
        this.rules = source.links();
        this.stripQuery = source.stripQuery();
        this.objectMapper = objectMapper;
    }

    @Override
    public List<CandidateLink> parse(FetchResult page, UnitKey unitKey) {
        JsonNode items = itemsOf(page);
        if (items.isMissingNode() || items.isNull()) {
            return List.of();
        }
        if (!items.isArray()) {
            throw new PageParseException(page.url(), "Expected an array at '" + itemsPath() + "' but got "
                    + items.getNodeType());
        }

        Set<String> seen = new LinkedHashSet<>();
        List<CandidateLink> candidates = new ArrayList<>();
        for (JsonNode item : items) {
            String articleUrl = articleUrl(page.url(), item);
            if (articleUrl == null) {
                log.debug("Skipping item without usable URL on {}", page.url());
                continue;
            }
            String url = UrlNormalizer.normalize(articleUrl, stripQuery);
            if (seen.add(url)) {
                candidates.add(new CandidateLink(sourceId, unitKey, url, metadataOf(item)));
            }
        }
        return candidates;
    }

    private JsonNode itemsOf(FetchResult page) {
        if (!page.isOk()) {
            throw new IllegalArgumentException("Cannot parse unsuccessful fetch of " + page.url());
        }
        JsonNode root;
        try {
            root = page.rawPayload() == null ? null : objectMapper.readTree(page.rawPayload());
        } catch (JsonProcessingException e) {
            throw new PageParseException(page.url(), "Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new PageParseException(page.url(), "Empty JSON document");
        }
        String path = itemsPath();
        return path.isEmpty() ? root : root.at(path);
    }

    private @Nullable String articleUrl(String pageUrl, JsonNode item) {
        if (rules.urlField() != null) {
            String href = textOf(item, rules.urlField());
            if (href != null) {
                return UrlNormalizer.resolve(pageUrl, href);
            }
        }
        if (rules.articleUrlTemplate() != null) {
            String rendered = render(rules.articleUrlTemplate(), item);
            return rendered == null ? null : UrlNormalizer.resolve(pageUrl, rendered);
        }
        return null;
    }

    private static @Nullable String render(String template, JsonNode item) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = textOf(item, matcher.group(1));
            if (value == null) {
                return null;
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value.strip()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private Map<String, String> metadataOf(JsonNode item) {
        Map<String, String> metadata = new HashMap<>();
        for (String field : rules.metadataFields()) {
            String value = textOf(item, field);
            if (value != null) {
                metadata.put(field, value);
            }
        }
        return metadata;
    }

    private static @Nullable String textOf(JsonNode item, String field) {
        JsonNode node = item.path(field);
        if (!node.isValueNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    private String itemsPath() {
        return rules.itemsPath() == null ? "" : rules.itemsPath().strip();
    }
}
