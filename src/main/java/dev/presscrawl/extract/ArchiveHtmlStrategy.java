package dev.presscrawl.extract;

import dev.presscrawl.checkpoint.UnitKey;
import dev.presscrawl.fetch.FetchResult;
import dev.presscrawl.source.SourceConfig;
import java.util.List;

/**
 * Date-archive HTML pages: every link on the page that passes the source's link rules is an
 * article candidate. Typical of sites publishing one archive page per day.
 */
public class ArchiveHtmlStrategy implements ArchivePageParser {

    private final HtmlLinkCollector collector;

    public ArchiveHtmlStrategy(SourceConfig source) {
        this.collector = new HtmlLinkCollector(source.id(), source.links(), source.stripQuery());
    }

    @Override
    public List<CandidateLink> parse(FetchResult page, UnitKey unitKey) {
        return collector.collect(page, unitKey, url -> true);
    }
}
