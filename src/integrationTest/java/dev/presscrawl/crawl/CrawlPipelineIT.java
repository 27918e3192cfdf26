package dev.presscrawl.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import dev.presscrawl.BaseIntegrationTest;
import dev.presscrawl.checkpoint.CheckpointStore;
import dev.presscrawl.checkpoint.UnitKey;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/**
 * Crawls a small daily archive served in-process and checks what lands in PostgreSQL.
 *
 * <p>2024-05-01 lists three stories: one good article, one that is gone and one without body
 * text. 2024-05-02 has no archive page.
 */
class CrawlPipelineIT extends BaseIntegrationTest {

  private static final String ARTICLE = """
      <html><head>
        <title>Monsoon reaches Kerala | Local Times</title>
        <meta property="og:title" content="Monsoon reaches Kerala">
        <meta name="author" content="Staff Reporter">
        <meta property="article:published_time" content="2024-05-01T09:30:00+05:30">
      </head><body>
        <h1>Monsoon reaches Kerala</h1>
        <div class="article-body">
          <p>The south-west monsoon reached the Kerala coast on Wednesday, two days early.</p>
          <p>Heavy rain was recorded in Thiruvananthapuram and Kollam through the afternoon.</p>
          <p>The weather office expects the rains to cover the rest of the state within a week.</p>
        </div>
      </body></html>
      """;

  private static final String EMPTY_ARTICLE = """
      <html><head><title>Photo gallery</title></head><body><h1>Photo gallery</h1></body></html>
      """;

  private static final Map<String, String> PAGES = Map.of(
      "/archive/2024-05-01", """
          <html><body><ul>
            <li><a href="/story/monsoon-reaches-kerala-1">Monsoon reaches Kerala</a></li>
            <li><a href="/story/removed-story-2">Removed story</a></li>
            <li><a href="/story/photo-gallery-3">Photo gallery</a></li>
          </ul></body></html>
          """,
      "/story/monsoon-reaches-kerala-1", ARTICLE,
      "/story/photo-gallery-3", EMPTY_ARTICLE);

  private static final HttpServer archive = startArchive();

  @Autowired
  private CrawlRunService runService;

  @Autowired
  private CheckpointStore checkpointStore;

  @DynamicPropertySource
  static void localSource(DynamicPropertyRegistry registry) {
    String base = "http://localhost:" + archive.getAddress().getPort();
    registry.add("presscrawl.sources[0].id", () -> "local");
    registry.add("presscrawl.sources[0].media-name", () -> "Local Times");
    registry.add("presscrawl.sources[0].granularity", () -> "DAILY");
    registry.add("presscrawl.sources[0].extractor", () -> "ARCHIVE_HTML");
    registry.add("presscrawl.sources[0].base-url-template", () -> base + "/archive/{date}");
    registry.add("presscrawl.sources[0].start-date", () -> "2024-05-01");
    registry.add("presscrawl.sources[0].end-date", () -> "2024-05-02");
    registry.add("presscrawl.sources[0].min-delay", () -> "0s");
    registry.add("presscrawl.sources[0].max-delay", () -> "0s");
    registry.add("presscrawl.sources[0].max-retries", () -> "0");
    registry.add("presscrawl.sources[0].base-backoff", () -> "10ms");
    registry.add("presscrawl.sources[0].max-backoff", () -> "10ms");
    registry.add("presscrawl.sources[0].pool-size", () -> "2");
    registry.add("presscrawl.sources[0].links.link-pattern", () -> "^http://localhost:\\d+/story/.+$");
  }

  @AfterAll
  static void stopArchive() {
    archive.stop(0);
  }

  @Test
  void crawlStoresGoodArticlesAndCheckpointsEveryDay() {
    SourceRunReport report = runService.run(List.of("local")).sources().get(0);

    assertThat(report.outcome()).isEqualTo(RunOutcome.COMPLETED);
    assertThat(report.counters()).isEqualTo(new CrawlCounters(3, 0, 1, 1, 1, 0, 0, 2));
    assertThat(checkpointStore.load("local").orElseThrow().lastCompletedUnitKey())
        .isEqualTo(UnitKey.ofDate(LocalDate.of(2024, 5, 2)));

    Map<String, Object> row = jdbcTemplate.queryForMap(
        "SELECT source_url, source_id, media_name, title, author, language_code, unit_key FROM articles");
    assertThat((String) row.get("source_url")).endsWith("/story/monsoon-reaches-kerala-1");
    assertThat(row.get("source_id")).isEqualTo("local");
    assertThat(row.get("media_name")).isEqualTo("Local Times");
    assertThat(row.get("title")).isEqualTo("Monsoon reaches Kerala");
    assertThat(row.get("author")).isEqualTo("Staff Reporter");
    assertThat(row.get("language_code")).isEqualTo("en");
    assertThat(row.get("unit_key")).isEqualTo("2024-05-01");
  }

  @Test
  void finishedRangeHasNothingLeftToDo() {
    runService.run(List.of("local"));

    SourceRunReport rerun = runService.run(List.of("local")).sources().get(0);

    assertThat(rerun.outcome()).isEqualTo(RunOutcome.COMPLETED);
    assertThat(rerun.counters()).isEqualTo(CrawlCounters.ZERO);
  }

  @Test
  void recrawlAfterResetSkipsStoredArticles() {
    runService.run(List.of("local"));
    runService.resetCheckpoint("local");

    SourceRunReport recrawl = runService.run(List.of("local")).sources().get(0);

    assertThat(recrawl.counters().candidatesFound()).isEqualTo(3);
    assertThat(recrawl.counters().deduped()).isEqualTo(1);
    assertThat(recrawl.counters().ingested()).isZero();
    Integer rows = jdbcTemplate.queryForObject("SELECT count(*) FROM articles", Integer.class);
    assertThat(rows).isEqualTo(1);
  }

  private static HttpServer startArchive() {
    try {
      HttpServer server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
      server.createContext("/", CrawlPipelineIT::serve);
      server.start();
      return server;
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static void serve(HttpExchange exchange) throws IOException {
    String page = PAGES.get(exchange.getRequestURI().getPath());
    byte[] body = (page == null ? "not found" : page).getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
    exchange.sendResponseHeaders(page == null ? 404 : 200, body.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(body);
    }
  }
}
