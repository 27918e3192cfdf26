package dev.presscrawl.article;

import static org.assertj.core.api.Assertions.assertThat;

import dev.presscrawl.BaseIntegrationTest;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class ArticleStoreIT extends BaseIntegrationTest {

  private static final Instant FETCHED_AT = Instant.parse("2024-05-02T06:15:00Z");

  @Autowired
  private ArticleStore articleStore;

  @Autowired
  private ArticleSink articleSink;

  private static ArticleRecord article(String url, String title) {
    String body = "The monsoon reached the Kerala coast two days ahead of schedule this year.";
    return new ArticleRecord(url, "news18", "News18", title, "Staff Reporter", "2024-05-01T09:30:00+05:30", null,
        "india", body, List.of("monsoon", "kerala"), ArticleRecord.countWords(body), "en", "2024-05-01", FETCHED_AT);
  }

  @Test
  void insertIfAbsentWritesEachUrlOnce() {
    ArticleRecord first = article("https://www.news18.com/india/monsoon-8873201.html", "Monsoon arrives");
    ArticleRecord second = article("https://www.news18.com/india/heatwave-8873202.html", "Heatwave warning");

    assertThat(articleStore.insertIfAbsent(List.of(first, second))).containsExactly(first, second);
    assertThat(articleStore.insertIfAbsent(List.of(first, second))).isEmpty();

    Integer rows = jdbcTemplate.queryForObject("SELECT count(*) FROM articles", Integer.class);
    assertThat(rows).isEqualTo(2);
  }

  @Test
  void insertIfAbsentReturnsOnlyTheNewRecords() {
    ArticleRecord stored = article("https://www.news18.com/a-1.html", "A");
    ArticleRecord fresh = article("https://www.news18.com/b-2.html", "B");
    articleStore.insertIfAbsent(List.of(stored));

    assertThat(articleStore.insertIfAbsent(List.of(stored, fresh))).containsExactly(fresh);
  }

  @Test
  void laterVersionOfStoredUrlDoesNotOverwriteIt() {
    String url = "https://www.news18.com/india/monsoon-8873201.html";
    articleStore.insertIfAbsent(List.of(article(url, "Monsoon arrives")));

    articleStore.insertIfAbsent(List.of(article(url, "Monsoon arrives (updated)")));

    String title = jdbcTemplate.queryForObject("SELECT title FROM articles WHERE source_url = ?", String.class, url);
    assertThat(title).isEqualTo("Monsoon arrives");
  }

  @Test
  void findExistingSourceUrlsReturnsOnlyStoredOnes() {
    articleStore.insertIfAbsent(List.of(article("https://www.news18.com/a-1.html", "A")));

    assertThat(articleStore.findExistingSourceUrls(List.of(
        "https://www.news18.com/a-1.html", "https://www.news18.com/b-2.html")))
        .containsExactly("https://www.news18.com/a-1.html");
    assertThat(articleStore.findExistingSourceUrls(List.of())).isEmpty();
  }

  @Test
  void nullableFieldsAndTagsAreStoredAsGiven() {
    String body = "Short but valid body text for the stored article.";
    ArticleRecord record = new ArticleRecord("https://publictv.in/mysuru-dasara/", "publictv", "Public TV",
        "Mysuru Dasara", null, null, null, null, body, List.of(), ArticleRecord.countWords(body), "kn", "3",
        FETCHED_AT);

    articleStore.insertIfAbsent(List.of(record));

    Map<String, Object> row = jdbcTemplate.queryForMap(
        "SELECT author, publish_date, section, cardinality(tags) AS tag_count, word_count, unit_key FROM articles");
    assertThat(row.get("author")).isNull();
    assertThat(row.get("publish_date")).isNull();
    assertThat(row.get("section")).isNull();
    assertThat(row.get("tag_count")).isEqualTo(0);
    assertThat(row.get("word_count")).isEqualTo(record.wordCount());
    assertThat(row.get("unit_key")).isEqualTo("3");
  }

  @Test
  void sinkReportsRowsAlreadyPresent() {
    ArticleRecord stored = article("https://www.news18.com/a-1.html", "A");
    articleStore.insertIfAbsent(List.of(stored));

    CommitResult result = articleSink.commit(List.of(stored, article("https://www.news18.com/b-2.html", "B")));

    assertThat(result).isEqualTo(new CommitResult(1, 1, 0));
  }
}
