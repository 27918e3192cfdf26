package dev.presscrawl.checkpoint;

import dev.presscrawl.exception.StoreUnavailableException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

/**
 * {@link CheckpointStore} backed by the {@code crawl_checkpoint} table.
 *
 * <p>Each {@link #advance} is a single repository save, so the watermark row is either fully
 * updated or left as it was. Only the crawl driver of a source writes its row.
 */
public class JpaCheckpointStore implements CheckpointStore {

  private static final Logger log = LoggerFactory.getLogger(JpaCheckpointStore.class);

  private final CheckpointRepository repository;
  private final Clock clock;

  public JpaCheckpointStore(CheckpointRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Override
  public Optional<Checkpoint> load(String sourceId) {
    try {
      return repository.findById(sourceId).map(CheckpointEntity::toCheckpoint);
    } catch (DataAccessException | TransactionException e) {
      throw new StoreUnavailableException("Cannot load checkpoint of " + sourceId, e);
    }
  }

  @Override
  public Checkpoint advance(String sourceId, UnitKey unitKey) {
    try {
      Optional<CheckpointEntity> existing = repository.findById(sourceId);
      if (existing.isPresent()) {
        Checkpoint current = existing.get().toCheckpoint();
        if (!current.isAdvancedBy(unitKey)) {
          log.warn("Ignoring checkpoint move of {} to {}: already at {}",
              sourceId, unitKey, current.lastCompletedUnitKey());
          return current;
        }
        existing.get().moveTo(unitKey, clock.instant());
        return repository.save(existing.get()).toCheckpoint();
      }
      return repository.save(new CheckpointEntity(sourceId, unitKey, clock.instant())).toCheckpoint();
    } catch (DataAccessException | TransactionException e) {
      throw new StoreUnavailableException("Cannot advance checkpoint of " + sourceId + " to " + unitKey, e);
    }
  }

  @Override
  public void reset(String sourceId) {
    try {
      if (repository.existsById(sourceId)) {
        repository.deleteById(sourceId);
        log.info("Checkpoint of {} reset", sourceId);
      }
    } catch (DataAccessException | TransactionException e) {
      throw new StoreUnavailableException("Cannot reset checkpoint of " + sourceId, e);
    }
  }

  @Override
  public List<Checkpoint> findAll() {
    try {
      return repository.findAllByOrderBySourceIdAsc().stream().map(CheckpointEntity::toCheckpoint).toList();
    } catch (DataAccessException | TransactionException e) {
      throw new StoreUnavailableException("Cannot list checkpoints", e);
    }
  }
}
