package dev.presscrawl.checkpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.presscrawl.exception.StoreUnavailableException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class JpaCheckpointStoreTest {

  private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

  @Mock
  private CheckpointRepository repository;

  private JpaCheckpointStore store;

  @BeforeEach
  void setUp() {
    store = new JpaCheckpointStore(repository, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void advanceCreatesRowForNewSource() {
    when(repository.findById("news18")).thenReturn(Optional.empty());
    when(repository.save(any(CheckpointEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

    Checkpoint result = store.advance("news18", UnitKey.ofDate(LocalDate.of(2024, 5, 1)));

    assertThat(result.sourceId()).isEqualTo("news18");
    assertThat(result.lastCompletedUnitKey().value()).isEqualTo("2024-05-01");
    assertThat(result.updatedAt()).isEqualTo(NOW);
  }

  @Test
  void advanceMovesExistingRowForward() {
    CheckpointEntity entity = new CheckpointEntity("jagran", UnitKey.ofPage(3), Instant.EPOCH);
    when(repository.findById("jagran")).thenReturn(Optional.of(entity));
    when(repository.save(entity)).thenReturn(entity);

    Checkpoint result = store.advance("jagran", UnitKey.ofPage(4));

    assertThat(result.lastCompletedUnitKey()).isEqualTo(UnitKey.ofPage(4));
    assertThat(entity.getUpdatedAt()).isEqualTo(NOW);
  }

  @Test
  void advanceToEarlierKeyIsIgnored() {
    CheckpointEntity entity = new CheckpointEntity("jagran", UnitKey.ofPage(7), Instant.EPOCH);
    when(repository.findById("jagran")).thenReturn(Optional.of(entity));

    Checkpoint result = store.advance("jagran", UnitKey.ofPage(7));

    assertThat(result.lastCompletedUnitKey()).isEqualTo(UnitKey.ofPage(7));
    verify(repository, never()).save(any());
  }

  @Test
  void databaseFailureBecomesStoreUnavailable() {
    when(repository.findById("news18")).thenThrow(new DataAccessResourceFailureException("down"));

    assertThatThrownBy(() -> store.load("news18")).isInstanceOf(StoreUnavailableException.class);
    assertThatThrownBy(() -> store.advance("news18", UnitKey.ofDate(LocalDate.of(2024, 5, 2))))
        .isInstanceOf(StoreUnavailableException.class);
  }

  @Test
  void resetDeletesOnlyExistingRows() {
    when(repository.existsById("news18")).thenReturn(false);

    store.reset("news18");

    verify(repository, never()).deleteById("news18");
  }
}
