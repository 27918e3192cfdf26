package dev.presscrawl.checkpoint;

import dev.presscrawl.exception.StoreUnavailableException;
import java.util.List;
import java.util.Optional;

/**
 * Durable per-source resume watermarks.
 *
 * <p>The watermark never regresses: {@link #advance} with a key that is not strictly after the
 * stored one leaves the store untouched and returns the stored checkpoint. All operations throw
 * {@link StoreUnavailableException} when the backing store cannot be reached.
 */
public interface CheckpointStore {

  Optional<Checkpoint> load(String sourceId);

  /**
   * Records {@code unitKey} as the last completed unit of {@code sourceId}.
   *
   * @return the checkpoint as stored after the call
   */
  Checkpoint advance(String sourceId, UnitKey unitKey);

  /** Forgets the watermark so the next run starts from the configured range floor. */
  void reset(String sourceId);

  List<Checkpoint> findAll();
}
