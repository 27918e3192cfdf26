package dev.presscrawl.extract;

import dev.presscrawl.checkpoint.UnitKey;
import dev.presscrawl.exception.PageParseException;
import dev.presscrawl.fetch.FetchResult;
import java.util.List;

/**
 * Turns a fetched archive page into the article links it lists.
 *
 * <p>One instance is bound to one source's {@link dev.presscrawl.source.LinkRules}.
 */
public interface ArchivePageParser {

    /**
     * @param page    a successful fetch of an archive page
     * @param unitKey the unit the page belongs to
     * @return candidates in page order without duplicates; empty if the page lists no articles
     * @throws PageParseException if the payload cannot be interpreted as this kind of page
     */
    List<CandidateLink> parse(FetchResult page, UnitKey unitKey);
}
