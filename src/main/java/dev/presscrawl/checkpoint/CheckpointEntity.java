package dev.presscrawl.checkpoint;

import dev.presscrawl.source.Granularity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Row of the {@code crawl_checkpoint} table: one watermark per source.
 *
 * <p>Maps to the table created by the Flyway migration {@code V1__articles_and_checkpoints.sql}.
 */
@Entity
@Table(name = "crawl_checkpoint")
public class CheckpointEntity {

    @Id
    @Column(name = "source_id", nullable = false, updatable = false)
    private String sourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "granularity", nullable = false)
    private Granularity granularity;

    @Column(name = "last_completed_unit_key", nullable = false)
    private String lastCompletedUnitKey;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected CheckpointEntity() {
        // JPA requires no-arg constructor
    }

    public CheckpointEntity(String sourceId, UnitKey unitKey, Instant updatedAt) {
        this.sourceId = sourceId;
        moveTo(unitKey, updatedAt);
    }

    public void moveTo(UnitKey unitKey, Instant updatedAt) {
        this.granularity = unitKey.granularity();
        this.lastCompletedUnitKey = unitKey.value();
        this.updatedAt = updatedAt;
    }

    public Checkpoint toCheckpoint() {
        return new Checkpoint(sourceId, new UnitKey(granularity, lastCompletedUnitKey), updatedAt);
    }

    public String getSourceId() {
        return sourceId;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public String getLastCompletedUnitKey() {
        return lastCompletedUnitKey;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
