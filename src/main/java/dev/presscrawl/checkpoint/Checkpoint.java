package dev.presscrawl.checkpoint;

import dev.presscrawl.exception.ConfigException;
import java.time.Instant;

/**
 * Resume watermark of a source: the last unit whose articles were durably committed.
 *
 * @param sourceId              the source this checkpoint belongs to
 * @param lastCompletedUnitKey  last fully committed unit
 * @param updatedAt             when the watermark last moved
 */
public record Checkpoint(String sourceId, UnitKey lastCompletedUnitKey, Instant updatedAt) {

  /**
   * Whether moving the watermark to {@code candidate} would advance it.
   *
   * @throws ConfigException if the source changed granularity since the checkpoint was written
   */
  public boolean isAdvancedBy(UnitKey candidate) {
    if (candidate.granularity() != lastCompletedUnitKey.granularity()) {
      throw new ConfigException("Checkpoint of source " + sourceId + " is "
          + lastCompletedUnitKey.granularity() + " but the source is now " + candidate.granularity()
          + "; reset the checkpoint before crawling");
    }
    return candidate.isAfter(lastCompletedUnitKey);
  }
}
