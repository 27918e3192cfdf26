package dev.presscrawl.checkpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.presscrawl.BaseIntegrationTest;
import dev.presscrawl.exception.ConfigException;
import dev.presscrawl.source.Granularity;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class JpaCheckpointStoreIT extends BaseIntegrationTest {

  @Autowired
  private CheckpointStore checkpointStore;

  @Autowired
  private CheckpointRepository repository;

  private static UnitKey day(int dayOfMonth) {
    return UnitKey.ofDate(LocalDate.of(2024, 5, dayOfMonth));
  }

  @Test
  void advanceCreatesThenMovesTheWatermark() {
    checkpointStore.advance("news18", day(1));
    checkpointStore.advance("news18", day(2));

    assertThat(checkpointStore.load("news18").orElseThrow().lastCompletedUnitKey()).isEqualTo(day(2));
  }

  @Test
  void watermarkNeverMovesBackward() {
    checkpointStore.advance("news18", day(5));

    Checkpoint result = checkpointStore.advance("news18", day(3));

    assertThat(result.lastCompletedUnitKey()).isEqualTo(day(5));
    assertThat(checkpointStore.load("news18").orElseThrow().lastCompletedUnitKey()).isEqualTo(day(5));
  }

  @Test
  void resetForgetsTheWatermark() {
    checkpointStore.advance("publictv", UnitKey.ofPage(12));

    checkpointStore.reset("publictv");
    checkpointStore.reset("publictv");

    assertThat(checkpointStore.load("publictv")).isEmpty();
  }

  @Test
  void findAllIsOrderedBySource() {
    checkpointStore.advance("publictv", UnitKey.ofPage(3));
    checkpointStore.advance("jagran", UnitKey.ofPage(7));
    checkpointStore.advance("news18", day(1));

    assertThat(checkpointStore.findAll()).extracting(Checkpoint::sourceId)
        .containsExactly("jagran", "news18", "publictv");
  }

  @Test
  void granularityChangeIsReportedAsConfigurationError() {
    checkpointStore.advance("jagran", day(1));

    assertThatThrownBy(() -> checkpointStore.advance("jagran", UnitKey.ofPage(2)))
        .isInstanceOf(ConfigException.class);
  }

  @Test
  void checkpointEntityRoundtripsAgainstFlywaySchema() {
    Instant updatedAt = Instant.parse("2024-05-02T00:00:00Z");
    repository.saveAndFlush(new CheckpointEntity("news18", day(2), updatedAt));

    CheckpointEntity found = repository.findById("news18").orElseThrow();

    assertThat(found.getGranularity()).isEqualTo(Granularity.DAILY);
    assertThat(found.getLastCompletedUnitKey()).isEqualTo("2024-05-02");
    assertThat(found.getUpdatedAt()).isEqualTo(updatedAt);
  }
}
