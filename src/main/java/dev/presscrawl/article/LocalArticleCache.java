package dev.presscrawl.article;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Append-only JSON Lines copy of committed articles, one {@code <sourceId>.jsonl} file per source.
 *
 * <p>A convenience for offline analysis. The database stays authoritative: the cache may miss
 * records if an append fails, and nothing in the application reads it back.
 */
@Component
public class LocalArticleCache {

    private final Path directory;
    private final boolean enabled;
    private final ObjectMapper objectMapper;

    public LocalArticleCache(
            @Value("${presscrawl.cache.directory:data/cache}") String directory,
            @Value("${presscrawl.cache.enabled:true}") boolean enabled,
            ObjectMapper objectMapper) {
        this.directory = Path.of(directory);
        this.enabled = enabled;
        this.objectMapper = objectMapper;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public synchronized void append(String sourceId, List<ArticleRecord> records) throws IOException {
        if (!enabled || records.isEmpty()) {
            return;
        }
        Files.createDirectories(directory);
        try (BufferedWriter writer = Files.newBufferedWriter(fileOf(sourceId), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            for (ArticleRecord record : records) {
                writer.write(objectMapper.writeValueAsString(record));
                writer.newLine();
            }
        }
    }

    private Path fileOf(String sourceId) {
        return directory.resolve(sourceId + ".jsonl");
    }
}
