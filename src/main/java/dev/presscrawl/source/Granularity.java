package dev.presscrawl.source;

/** How a source's archive is divided into crawl units. */
public enum Granularity {
    /** One unit per calendar day, keyed by ISO date. */
    DAILY,
    /** One unit per listing or API page, keyed by page number. */
    PAGINATED
}
