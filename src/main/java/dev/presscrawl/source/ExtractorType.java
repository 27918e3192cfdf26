package dev.presscrawl.source;

/** Archive page parsing strategy selected for a source at startup. */
public enum ExtractorType {
    /** Date-addressed HTML archive page listing that day's articles. */
    ARCHIVE_HTML,
    /** Page-numbered JSON API returning an array of article descriptors. */
    PAGINATED_API,
    /** Page-numbered HTML category listing (newest first). */
    CATEGORY_LISTING
}
