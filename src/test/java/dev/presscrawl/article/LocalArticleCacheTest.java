package dev.presscrawl.article;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalArticleCacheTest {

  private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

  @TempDir
  Path directory;

  @Test
  void appendsOneJsonLinePerRecord() throws IOException {
    LocalArticleCache cache = new LocalArticleCache(directory.toString(), true, objectMapper);
    ArticleRecord first = ArticleSinkTest.article("news18", "https://a/1", "first body");
    ArticleRecord second = ArticleSinkTest.article("news18", "https://a/2", "second body");

    cache.append("news18", List.of(first));
    cache.append("news18", List.of(second));

    List<String> lines = Files.readAllLines(directory.resolve("news18.jsonl"));
    assertThat(lines).hasSize(2);
    assertThat(objectMapper.readValue(lines.get(0), ArticleRecord.class)).isEqualTo(first);
    assertThat(objectMapper.readValue(lines.get(1), ArticleRecord.class)).isEqualTo(second);
  }

  @Test
  void disabledCacheWritesNothing() throws IOException {
    LocalArticleCache cache = new LocalArticleCache(directory.toString(), false, objectMapper);

    cache.append("news18", List.of(ArticleSinkTest.article("news18", "https://a/1", "body")));

    assertThat(cache.isEnabled()).isFalse();
    assertThat(directory.resolve("news18.jsonl")).doesNotExist();
  }

  @Test
  void emptyAppendCreatesNoFile() throws IOException {
    LocalArticleCache cache = new LocalArticleCache(directory.toString(), true, objectMapper);

    cache.append("nobody", List.of());

    assertThat(directory.resolve("nobody.jsonl")).doesNotExist();
  }
}
