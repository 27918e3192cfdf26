package dev.presscrawl.extract;

import dev.presscrawl.checkpoint.UnitKey;
import dev.presscrawl.fetch.FetchResult;
import dev.presscrawl.source.SourceConfig;
import java.net.URI;
import java.util.List;

/**
 * Paginated category listings. Besides the source's link rules, navigation links back into the
 * listing (other pages, categories, tags, authors, the site root) are never candidates.
 */
public class CategoryListingStrategy implements ArchivePageParser {

    private static final List<String> NAVIGATION_FRAGMENTS = List.of("/page/", "/category/", "/tag/", "/author/");

    private final HtmlLinkCollector collector;
    private final boolean stripQuery;

    public CategoryListingStrategy(SourceConfig source) {
        this.collector = new HtmlLinkCollector(source.id(), source.links(), source.stripQuery());
        this.stripQuery = source.stripQuery();
    }

    @Override
    public List<CandidateLink> parse(FetchResult page, UnitKey unitKey) {
        String listingUrl = UrlNormalizer.normalize(page.url(), stripQuery);
        return collector.collect(page, unitKey, url -> !isNavigation(url, listingUrl));
    }

    private static boolean isNavigation(String url, String listingUrl) {
        if (url.equals(listingUrl) || isSiteRoot(url)) {
            return true;
        }
        return NAVIGATION_FRAGMENTS.stream().anyMatch(url::contains);
    }

    private static boolean isSiteRoot(String url) {
        String path = URI.create(url).getRawPath();
        return path == null || path.isEmpty() || "/".equals(path);
    }
}
