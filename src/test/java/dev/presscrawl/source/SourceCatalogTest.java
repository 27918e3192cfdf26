package dev.presscrawl.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.presscrawl.exception.ConfigException;
import dev.presscrawl.fixture.SourceConfigBuilder;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class SourceCatalogTest {

  private static SourceCatalog catalogOf(SourceConfig... sources) {
    return new SourceCatalog(new SourceProperties(List.of(sources)));
  }

  @Test
  void keepsConfigurationOrderAndFiltersDisabledSources() {
    SourceCatalog catalog = catalogOf(
        SourceConfigBuilder.daily().id("news18").build(),
        SourceConfigBuilder.paginated().id("jagran").enabled(false).build(),
        SourceConfigBuilder.paginated().id("publictv").build());

    assertThat(catalog.all()).extracting(SourceConfig::id).containsExactly("news18", "jagran", "publictv");
    assertThat(catalog.enabled()).extracting(SourceConfig::id).containsExactly("news18", "publictv");
  }

  @Test
  void requireRejectsUnknownSource() {
    SourceCatalog catalog = catalogOf(SourceConfigBuilder.daily().build());

    assertThat(catalog.find("missing")).isEmpty();
    assertThatThrownBy(() -> catalog.require("missing"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("missing");
  }

  @Test
  void duplicateIdsAreRejected() {
    assertThatThrownBy(() -> catalogOf(
        SourceConfigBuilder.daily().id("dup").build(),
        SourceConfigBuilder.daily().id("dup").build()))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("dup");
  }

  @Test
  void dailySourceNeedsDatePlaceholderAndStartDate() {
    assertThatThrownBy(() -> SourceCatalog.validate(
        SourceConfigBuilder.daily().baseUrlTemplate("https://news.example.com/archive").build()))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("date placeholder");
    assertThatThrownBy(() -> SourceCatalog.validate(SourceConfigBuilder.daily().startDate(null).build()))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("start-date");
  }

  @Test
  void dailyRangeMustBeOrderedIsoDates() {
    assertThatThrownBy(() -> SourceCatalog.validate(
        SourceConfigBuilder.daily().startDate("2024-06-01").endDate("2024-05-01").build()))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("end-date");
    assertThatThrownBy(() -> SourceCatalog.validate(SourceConfigBuilder.daily().startDate("1st May").build()))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("ISO");
  }

  @Test
  void paginatedSourceNeedsPagePlaceholderAndSaneBounds() {
    assertThatThrownBy(() -> SourceCatalog.validate(
        SourceConfigBuilder.paginated().baseUrlTemplate("https://news.example.com/latest").build()))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("{page}");
    assertThatThrownBy(() -> SourceCatalog.validate(SourceConfigBuilder.paginated().startPage(0).build()))
        .isInstanceOf(ConfigException.class);
    assertThatThrownBy(() -> SourceCatalog.validate(
        SourceConfigBuilder.paginated().startPage(5).endPage(4).build()))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("end-page");
  }

  @Test
  void rejectsInvertedDelayAndBackoffBounds() {
    assertThatThrownBy(() -> SourceCatalog.validate(
        SourceConfigBuilder.daily().delays(Duration.ofSeconds(3), Duration.ofSeconds(1)).build()))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("max-delay");
    assertThatThrownBy(() -> SourceCatalog.validate(
        SourceConfigBuilder.daily().backoff(Duration.ofSeconds(10), Duration.ofSeconds(1)).build()))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("max-backoff");
    assertThatThrownBy(() -> SourceCatalog.validate(SourceConfigBuilder.daily().maxRetries(-1).build()))
        .isInstanceOf(ConfigException.class);
  }

  @Test
  void poolSizeMustBePositiveAndBounded() {
    assertThatThrownBy(() -> SourceCatalog.validate(SourceConfigBuilder.daily().poolSize(0).build()))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("pool-size");
    assertThatThrownBy(() -> SourceCatalog.validate(SourceConfigBuilder.daily().poolSize(500).build()))
        .isInstanceOf(ConfigException.class);
  }

  @Test
  void rejectsRelativeOrInvalidUrls() {
    assertThatThrownBy(() -> SourceCatalog.validate(
        SourceConfigBuilder.daily().baseUrlTemplate("/archive/{date}").build()))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("base-url-template");
    assertThatThrownBy(() -> SourceCatalog.validate(
        SourceConfigBuilder.paginated().firstPageUrl("not a url").build()))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("first-page-url");
  }

  @Test
  void rejectsInvalidLinkRules() {
    LinkRules badRegex = new LinkRules("([unclosed", List.of(), true, null, null, null, List.of());
    assertThatThrownBy(() -> SourceCatalog.validate(SourceConfigBuilder.daily().links(badRegex).build()))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("link-pattern");

    LinkRules noUrl = new LinkRules(null, List.of(), true, "/items", null, null, List.of());
    assertThatThrownBy(() -> SourceCatalog.validate(
        SourceConfigBuilder.paginated().extractor(ExtractorType.PAGINATED_API).links(noUrl).build()))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("url-field");

    LinkRules badPointer = new LinkRules(null, List.of(), true, "items", "url", null, List.of());
    assertThatThrownBy(() -> SourceCatalog.validate(
        SourceConfigBuilder.paginated().extractor(ExtractorType.PAGINATED_API).links(badPointer).build()))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("items-path");
  }

  @Test
  void rejectsMalformedSourceId() {
    assertThatThrownBy(() -> SourceCatalog.validate(SourceConfigBuilder.daily().id("News 18").build()))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("id");
  }
}
