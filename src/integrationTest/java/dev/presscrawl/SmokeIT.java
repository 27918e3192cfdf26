package dev.presscrawl;

import static org.assertj.core.api.Assertions.assertThat;

import dev.presscrawl.checkpoint.CheckpointStore;
import dev.presscrawl.checkpoint.JpaCheckpointStore;
import dev.presscrawl.source.SourceCatalog;
import dev.presscrawl.source.SourceConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class SmokeIT extends BaseIntegrationTest {

  @Autowired
  private SourceCatalog catalog;

  @Autowired
  private CheckpointStore checkpointStore;

  @Test
  void contextLoadsWithConfiguredSourcesAndDatabaseCheckpoints() {
    // Flyway migrated, JPA validated the schema and every configured source passed validation
    assertThat(catalog.all()).extracting(SourceConfig::id).containsExactly("news18", "jagran", "publictv");
    assertThat(checkpointStore).isInstanceOf(JpaCheckpointStore.class);
  }
}
