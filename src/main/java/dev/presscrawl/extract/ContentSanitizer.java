package dev.presscrawl.extract;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Strips page furniture and boilerplate from article markup.
 *
 * <p>All methods are deterministic and never throw on malformed input.
 */
@Component
public class ContentSanitizer {

    static final String BOILERPLATE_TAGS = "script, style, nav, header, footer, aside, form, iframe, noscript";

    private static final Pattern AD_MARKUP =
            Pattern.compile("(?i)(^|[\\s_-])(ad|ads|advert\\w*|sponsored|promo\\w*)([\\s_-]|$)");

    static final int MIN_PARAGRAPH_LENGTH = 20;

    private static final List<String> SKIP_PHRASES = List.of(
            "advertisement", "also read", "read more", "subscribe now",
            "follow us", "download app", "share your feedback");

    /**
     * Plain text of {@code html} with boilerplate markup removed and whitespace collapsed.
     *
     * @return the cleaned text, empty for null or blank input
     */
    public String sanitize(@Nullable String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document doc = Jsoup.parse(html);
        clean(doc);
        return collapseWhitespace(doc.text());
    }

    /** Removes boilerplate and ad markup below {@code root}, in place. */
    public void clean(Element root) {
        root.select(BOILERPLATE_TAGS).remove();
        for (Element element : root.select("[class], [id]")) {
            if (element != root && isAdMarkup(element)) {
                element.remove();
            }
        }
    }

    /**
     * Joins the substantive paragraphs below {@code root} with blank lines. Short paragraphs and
     * those carrying promotional phrases are left out.
     */
    public String extractParagraphs(Element root) {
        return root.select("p").stream()
                .map(p -> collapseWhitespace(p.text()))
                .filter(text -> text.length() > MIN_PARAGRAPH_LENGTH)
                .filter(text -> !isPromotional(text))
                .collect(Collectors.joining("\n\n"));
    }

    private static boolean isAdMarkup(Element element) {
        return AD_MARKUP.matcher(element.className()).find() || AD_MARKUP.matcher(element.id()).find();
    }

    private static boolean isPromotional(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return SKIP_PHRASES.stream().anyMatch(lower::contains);
    }

    static String collapseWhitespace(String text) {
        return text.replaceAll("[\\s\\u00A0]+", " ").strip();
    }
}
