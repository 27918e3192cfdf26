package dev.presscrawl.article;

/**
 * Outcome of one {@link ArticleSink#commit} call.
 *
 * @param written        rows newly inserted
 * @param alreadyPresent persistable records whose URL was already stored (upsert no-ops)
 * @param droppedEmpty   records dropped because they had no words
 */
public record CommitResult(int written, int alreadyPresent, int droppedEmpty) {
}
