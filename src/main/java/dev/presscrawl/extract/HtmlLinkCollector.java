package dev.presscrawl.extract;

import dev.presscrawl.checkpoint.UnitKey;
import dev.presscrawl.exception.PageParseException;
import dev.presscrawl.fetch.FetchResult;
import dev.presscrawl.source.LinkRules;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Shared anchor scanning for the HTML archive strategies.
 */
final class HtmlLinkCollector {

    private final String sourceId;
    private final LinkRules rules;
    private final @Nullable Pattern linkPattern;
    private final boolean stripQuery;

    HtmlLinkCollector(String sourceId, LinkRules rules, boolean stripQuery) {
        this.sourceId = sourceId;
        this.rules = rules;
        this.linkPattern = rules.linkPattern() == null ? null : Pattern.compile(rules.linkPattern());
        this.stripQuery = stripQuery;
    }

    List<CandidateLink> collect(FetchResult page, UnitKey unitKey, Predicate<String> pageFilter) {
        Document doc = parseHtml(page);
        Set<String> seen = new LinkedHashSet<>();
        List<CandidateLink> candidates = new ArrayList<>();

        for (Element anchor : doc.select("a[href]")) {
            String absolute = UrlNormalizer.resolve(page.url(), anchor.attr("href"));
            if (absolute == null) {
                continue;
            }
            String url = UrlNormalizer.normalize(absolute, stripQuery);
            if (!accepts(page.url(), url) || !pageFilter.test(url) || !seen.add(url)) {
                continue;
            }
            String headline = anchor.text().strip();
            Map<String, String> metadata = headline.isEmpty() ? Map.of() : Map.of(CandidateLink.HEADLINE, headline);
            candidates.add(new CandidateLink(sourceId, unitKey, url, metadata));
        }
        return candidates;
    }

    private boolean accepts(String pageUrl, String url) {
        if (rules.sameSiteOnly() && !UrlNormalizer.isSameSite(pageUrl, url)) {
            return false;
        }
        for (String excluded : rules.excludePatterns()) {
            if (url.contains(excluded)) {
                return false;
            }
        }
        return linkPattern == null || linkPattern.matcher(url).find();
    }

    private static Document parseHtml(FetchResult page) {
        if (!page.isOk()) {
            throw new IllegalArgumentException("Cannot parse unsuccessful fetch of " + page.url());
        }
        String payload = page.rawPayload() == null ? "" : page.rawPayload().strip();
        if (payload.isEmpty()) {
            throw new PageParseException(page.url(), "Archive page is empty");
        }
        if (payload.startsWith("{") || payload.startsWith("[")) {
            throw new PageParseException(page.url(), "Expected an HTML archive page but got JSON");
        }
        return Jsoup.parse(payload, page.url());
    }
}
