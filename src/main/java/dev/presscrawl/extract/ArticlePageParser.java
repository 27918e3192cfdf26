package dev.presscrawl.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.presscrawl.article.ArticleRecord;
import dev.presscrawl.exception.PageParseException;
import dev.presscrawl.fetch.FetchResult;
import dev.presscrawl.source.Granularity;
import dev.presscrawl.source.SourceConfig;
import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts an {@link ArticleRecord} from a fetched article page.
 *
 * <p>Fields are taken from the most specific source available: visible markup and Open Graph /
 * {@code article:*} meta tags first, then the page's JSON-LD {@code NewsArticle} block, then the
 * metadata the archive listing attached to the candidate. The body comes from the source's
 * configured selectors, else {@code <article>}, else all paragraphs of the page. A body under
 * {@value #MIN_BODY_WORDS} words is replaced by the JSON-LD {@code articleBody} when that is longer.
 */
@Component
public class ArticlePageParser {

    private static final Logger log = LoggerFactory.getLogger(ArticlePageParser.class);

    static final int MIN_BODY_WORDS = 50;

    private static final Set<String> ARTICLE_TYPES = Set.of("NewsArticle", "Article", "ReportageNewsArticle",
            "AnalysisNewsArticle", "OpinionNewsArticle", "BlogPosting");

    private final ContentSanitizer sanitizer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ArticlePageParser(ContentSanitizer sanitizer, ObjectMapper objectMapper, Clock clock) {
        this.sanitizer = sanitizer;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @throws PageParseException if the payload is not an HTML document
     */
    public ArticleRecord parse(CandidateLink candidate, FetchResult page, SourceConfig source) {
        String payload = page.rawPayload() == null ? "" : page.rawPayload().strip();
        if (payload.isEmpty() || payload.startsWith("{") || payload.startsWith("[")) {
            throw new PageParseException(candidate.url(), "Article page is not HTML");
        }
        Document doc = Jsoup.parse(payload, page.url());
        JsonNode linkedData = findLinkedData(doc, candidate.url());

        String title = firstNonBlank(
                text(doc.selectFirst("h1")),
                meta(doc, "meta[property=og:title]"),
                doc.title(),
                jsonText(linkedData, "headline"),
                candidate.metadataValue(CandidateLink.HEADLINE));
        String author = firstNonBlank(
                meta(doc, "meta[name=author]"),
                text(doc.selectFirst("a[href*=/byline/], a[rel=author], a[href*=/author/]")),
                jsonAuthor(linkedData));
        String publishDate = PublishDateNormalizer.normalize(firstNonBlank(
                meta(doc, "meta[property=article:published_time]"),
                meta(doc, "meta[itemprop=datePublished]"),
                jsonText(linkedData, "datePublished"),
                candidate.metadataValue("publishDate"),
                candidate.metadataValue("date"),
                source.granularity() == Granularity.DAILY ? candidate.unitKey().value() : null));
        String modifiedDate = PublishDateNormalizer.normalize(firstNonBlank(
                meta(doc, "meta[property=article:modified_time]"),
                jsonText(linkedData, "dateModified"),
                candidate.metadataValue("modDate")));
        String section = firstNonBlank(
                meta(doc, "meta[property=article:section]"),
                candidate.metadataValue("category"),
                firstPathSegment(candidate.url()));
        List<String> tags = tagsOf(doc);

        String body = bodyOf(doc, source);
        if (ArticleRecord.countWords(body) < MIN_BODY_WORDS) {
            String linkedBody = sanitizer.sanitize(jsonText(linkedData, "articleBody"));
            if (ArticleRecord.countWords(linkedBody) > ArticleRecord.countWords(body)) {
                log.debug("Using JSON-LD articleBody for {}", candidate.url());
                body = linkedBody;
            }
        }

        return new ArticleRecord(
                candidate.url(),
                source.id(),
                source.mediaName(),
                title == null ? "" : title,
                author,
                publishDate,
                modifiedDate,
                section,
                body,
                tags,
                ArticleRecord.countWords(body),
                source.languageCode(),
                candidate.unitKey().value(),
                clock.instant());
    }

    private String bodyOf(Document doc, SourceConfig source) {
        sanitizer.clean(doc.body());
        for (String selector : source.bodySelectors()) {
            Element element = doc.selectFirst(selector);
            if (element != null) {
                String paragraphs = sanitizer.extractParagraphs(element);
                if (!paragraphs.isEmpty()) {
                    return paragraphs;
                }
            }
        }
        Element article = doc.selectFirst("article");
        if (article != null) {
            String paragraphs = sanitizer.extractParagraphs(article);
            if (!paragraphs.isEmpty()) {
                return paragraphs;
            }
        }
        return sanitizer.extractParagraphs(doc.body());
    }

    private List<String> tagsOf(Document doc) {
        Set<String> tags = new LinkedHashSet<>();
        for (Element tag : doc.select("meta[property=article:tag]")) {
            addTag(tags, tag.attr("content"));
        }
        if (tags.isEmpty()) {
            String keywords = meta(doc, "meta[name=keywords]");
            if (keywords != null) {
                Arrays.stream(keywords.split(",")).forEach(keyword -> addTag(tags, keyword));
            }
        }
        return new ArrayList<>(tags);
    }

    private static void addTag(Set<String> tags, String tag) {
        String trimmed = tag.strip();
        if (!trimmed.isEmpty()) {
            tags.add(trimmed);
        }
    }

    private @Nullable JsonNode findLinkedData(Document doc, String url) {
        for (Element script : doc.select("script[type=application/ld+json]")) {
            try {
                JsonNode article = findArticleNode(objectMapper.readTree(script.data()));
                if (article != null) {
                    return article;
                }
            } catch (JsonProcessingException e) {
                log.debug("Ignoring malformed JSON-LD block on {}: {}", url, e.getOriginalMessage());
            }
        }
        return null;
    }

    private static @Nullable JsonNode findArticleNode(@Nullable JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                JsonNode found = findArticleNode(element);
                if (found != null) {
                    return found;
                }
            }
            return null;
        }
        if (!node.isObject()) {
            return null;
        }
        if (isArticleType(node.path("@type"))) {
            return node;
        }
        return findArticleNode(node.get("@graph"));
    }

    private static boolean isArticleType(JsonNode type) {
        if (type.isTextual()) {
            return ARTICLE_TYPES.contains(type.asText());
        }
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (ARTICLE_TYPES.contains(t.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static @Nullable String jsonText(@Nullable JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static @Nullable String jsonAuthor(@Nullable JsonNode node) {
        if (node == null) {
            return null;
        }
        JsonNode author = node.path("author");
        if (author.isArray()) {
            author = author.path(0);
        }
        if (author.isTextual()) {
            return author.asText();
        }
        return jsonText(author, "name");
    }

    private static @Nullable String meta(Document doc, String selector) {
        Element element = doc.selectFirst(selector);
        return element == null ? null : element.attr("content");
    }

    private static @Nullable String text(@Nullable Element element) {
        return element == null ? null : element.text();
    }

    /** "politics" for {@code /politics/some-story.html}; null when the article sits at the root. */
    private static @Nullable String firstPathSegment(String url) {
        String path;
        try {
            path = URI.create(url).getPath();
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (path == null) {
            return null;
        }
        List<String> segments = Arrays.stream(path.split("/")).filter(segment -> !segment.isBlank()).toList();
        return segments.size() >= 2 ? segments.get(0) : null;
    }

    private static @Nullable String firstNonBlank(@Nullable String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return ContentSanitizer.collapseWhitespace(value);
            }
        }
        return null;
    }
}
