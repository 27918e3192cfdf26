package dev.presscrawl.extract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.presscrawl.article.ArticleRecord;
import dev.presscrawl.checkpoint.UnitKey;
import dev.presscrawl.exception.PageParseException;
import dev.presscrawl.fetch.FetchResult;
import dev.presscrawl.fixture.Fixtures;
import dev.presscrawl.fixture.SourceConfigBuilder;
import dev.presscrawl.source.SourceConfig;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ArticlePageParserTest {

  private static final Instant NOW = Instant.parse("2024-05-02T06:00:00Z");

  private final ArticlePageParser parser =
      new ArticlePageParser(new ContentSanitizer(), new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));

  private final SourceConfig news18 = SourceConfigBuilder.daily().id("news18").mediaName("News18").build();
  private final SourceConfig jagran = SourceConfigBuilder.paginated()
      .id("jagran").mediaName("Dainik Jagran").languageCode("hi").build();

  @Test
  void extractsFieldsFromMarkupAndMetaTags() {
    String url = "https://www.news18.com/india/monsoon-arrives-early-in-kerala-8873201.html";
    CandidateLink candidate = new CandidateLink("news18", UnitKey.ofDate(LocalDate.of(2024, 5, 1)), url, Map.of());

    ArticleRecord record = parser.parse(candidate, FetchResult.ok(url, Fixtures.read("news18-article.html"), 200, 1),
        news18);

    assertThat(record.sourceUrl()).isEqualTo(url);
    assertThat(record.sourceId()).isEqualTo("news18");
    assertThat(record.mediaName()).isEqualTo("News18");
    assertThat(record.title()).isEqualTo("Monsoon arrives early in Kerala");
    assertThat(record.author()).isEqualTo("Priya Nair");
    assertThat(record.publishDate()).isEqualTo("2024-05-01");
    assertThat(record.modifiedDate()).isEqualTo("2024-05-02");
    assertThat(record.section()).isEqualTo("India");
    assertThat(record.tags()).containsExactly("monsoon", "Kerala", "IMD");
    assertThat(record.languageCode()).isEqualTo("en");
    assertThat(record.unitKey()).isEqualTo("2024-05-01");
    assertThat(record.fetchedAt()).isEqualTo(NOW);
  }

  @Test
  void bodyKeepsOnlySubstantiveArticleParagraphs() {
    String url = "https://www.news18.com/india/monsoon-arrives-early-in-kerala-8873201.html";
    CandidateLink candidate = new CandidateLink("news18", UnitKey.ofDate(LocalDate.of(2024, 5, 1)), url, Map.of());

    ArticleRecord record = parser.parse(candidate, FetchResult.ok(url, Fixtures.read("news18-article.html"), 200, 1),
        news18);

    assertThat(record.bodyText().split("\n\n")).hasSize(3);
    assertThat(record.bodyText())
        .startsWith("The southwest monsoon reached the Kerala coast")
        .doesNotContain("Advertisement placeholder", "Short line", "Also read", "Trending", "Copyright");
    assertThat(record.wordCount()).isEqualTo(ArticleRecord.countWords(record.bodyText())).isGreaterThan(50);
  }

  @Test
  void fallsBackToJsonLdWhenMarkupIsThin() {
    String url = "https://www.jagran.com/news/national-heatwave-alert-in-delhi-23712345.html";
    CandidateLink candidate = new CandidateLink("jagran", UnitKey.ofPage(1), url,
        Map.of(CandidateLink.HEADLINE, "दिल्ली में लू का अलर्ट", "category", "national"));

    ArticleRecord record = parser.parse(candidate, FetchResult.ok(url, Fixtures.read("ldjson-article.html"), 200, 1),
        jagran);

    assertThat(record.title()).isEqualTo("Heatwave alert issued for Delhi");
    assertThat(record.author()).isEqualTo("Rahul Sharma");
    assertThat(record.publishDate()).isEqualTo("2024-05-01");
    assertThat(record.modifiedDate()).isEqualTo("2024-05-01");
    assertThat(record.section()).isEqualTo("national");
    assertThat(record.bodyText()).startsWith("The India Meteorological Department issued a heatwave alert");
    assertThat(record.languageCode()).isEqualTo("hi");
    assertThat(record.unitKey()).isEqualTo("1");
  }

  @Test
  void listingMetadataFillsWhatThePageLacks() {
    String url = "https://www.jagran.com/news/national-rbi-policy-review-23712346.html";
    CandidateLink candidate = new CandidateLink("jagran", UnitKey.ofPage(2), url,
        Map.of(CandidateLink.HEADLINE, "RBI keeps repo rate unchanged", "modDate", "2024-05-03T10:00:00+05:30"));
    String html = "<html><body><p>The Reserve Bank of India kept the repo rate unchanged at its review.</p></body></html>";

    ArticleRecord record = parser.parse(candidate, FetchResult.ok(url, html, 200, 1), jagran);

    assertThat(record.title()).isEqualTo("RBI keeps repo rate unchanged");
    assertThat(record.modifiedDate()).isEqualTo("2024-05-03");
    assertThat(record.publishDate()).isNull();
    assertThat(record.section()).isEqualTo("news");
    assertThat(record.author()).isNull();
    assertThat(record.tags()).isEmpty();
  }

  @Test
  void dailySourcesFallBackToTheArchiveDate() {
    String url = "https://www.news18.com/india/undated-story-1.html";
    CandidateLink candidate = new CandidateLink("news18", UnitKey.ofDate(LocalDate.of(2024, 5, 7)), url, Map.of());
    String html = "<html><head><title>Undated</title></head><body><p>Body text of an undated story goes here.</p></body></html>";

    ArticleRecord record = parser.parse(candidate, FetchResult.ok(url, html, 200, 1), news18);

    assertThat(record.publishDate()).isEqualTo("2024-05-07");
    assertThat(record.title()).isEqualTo("Undated");
  }

  @Test
  void configuredBodySelectorWins() {
    SourceConfig withSelector = SourceConfigBuilder.daily().id("news18")
        .bodySelectors(List.of("div.story-body")).build();
    String url = "https://www.news18.com/india/selector-story-2.html";
    CandidateLink candidate = new CandidateLink("news18", UnitKey.ofDate(LocalDate.of(2024, 5, 1)), url, Map.of());
    String html = """
        <html><body>
        <article><p>This paragraph sits in the article element but outside the story body.</p></article>
        <div class="story-body"><p>This paragraph is inside the configured story body selector.</p></div>
        </body></html>
        """;

    ArticleRecord record = parser.parse(candidate, FetchResult.ok(url, html, 200, 1), withSelector);

    assertThat(record.bodyText()).isEqualTo("This paragraph is inside the configured story body selector.");
  }

  @Test
  void pageWithoutTextYieldsZeroWords() {
    String url = "https://www.news18.com/india/video-only-3.html";
    CandidateLink candidate = new CandidateLink("news18", UnitKey.ofDate(LocalDate.of(2024, 5, 1)), url, Map.of());

    ArticleRecord record = parser.parse(candidate,
        FetchResult.ok(url, "<html><body><video src=\"clip.mp4\"></video></body></html>", 200, 1), news18);

    assertThat(record.bodyText()).isEmpty();
    assertThat(record.wordCount()).isZero();
  }

  @Test
  void nonHtmlPayloadIsAParseError() {
    String url = "https://www.news18.com/india/api-4.html";
    CandidateLink candidate = new CandidateLink("news18", UnitKey.ofDate(LocalDate.of(2024, 5, 1)), url, Map.of());

    assertThatThrownBy(() -> parser.parse(candidate, FetchResult.ok(url, "{\"ok\":false}", 200, 1), news18))
        .isInstanceOf(PageParseException.class);
  }
}
