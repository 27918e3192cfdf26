package dev.presscrawl.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.presscrawl.exception.StoreUnavailableException;
import dev.presscrawl.source.Granularity;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CheckpointStore} keeping one JSON file per source, {@code <sourceId>.checkpoint.json}.
 *
 * <p>Writes go to a temporary file in the same directory which is then moved over the target,
 * atomically where the file system supports it, so a crash never leaves a half-written
 * checkpoint behind.
 */
public class FileCheckpointStore implements CheckpointStore {

  private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);

  static final String SUFFIX = ".checkpoint.json";

  private final Path directory;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public FileCheckpointStore(Path directory, ObjectMapper objectMapper, Clock clock) {
    this.directory = directory;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public synchronized Optional<Checkpoint> load(String sourceId) {
    Path file = fileOf(sourceId);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    return Optional.of(read(file));
  }

  @Override
  public synchronized Checkpoint advance(String sourceId, UnitKey unitKey) {
    Optional<Checkpoint> current = load(sourceId);
    if (current.isPresent() && !current.get().isAdvancedBy(unitKey)) {
      log.warn("Ignoring checkpoint move of {} to {}: already at {}",
          sourceId, unitKey, current.get().lastCompletedUnitKey());
      return current.get();
    }
    Checkpoint updated = new Checkpoint(sourceId, unitKey, clock.instant());
    write(updated);
    return updated;
  }

  @Override
  public synchronized void reset(String sourceId) {
    try {
      if (Files.deleteIfExists(fileOf(sourceId))) {
        log.info("Checkpoint of {} reset", sourceId);
      }
    } catch (IOException e) {
      throw new StoreUnavailableException("Cannot reset checkpoint of " + sourceId, e);
    }
  }

  @Override
  public synchronized List<Checkpoint> findAll() {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    List<Checkpoint> checkpoints = new ArrayList<>();
    try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
      for (Path file : files) {
        checkpoints.add(read(file));
      }
    } catch (IOException e) {
      throw new StoreUnavailableException("Cannot list checkpoints in " + directory, e);
    }
    checkpoints.sort(Comparator.comparing(Checkpoint::sourceId));
    return checkpoints;
  }

  private Checkpoint read(Path file) {
    try {
      StoredCheckpoint stored = objectMapper.readValue(file.toFile(), StoredCheckpoint.class);
      return new Checkpoint(
          stored.sourceId(),
          new UnitKey(stored.granularity(), stored.lastCompletedUnitKey()),
          Instant.parse(stored.updatedAt()));
    } catch (IOException e) {
      throw new StoreUnavailableException("Cannot read checkpoint file " + file, e);
    }
  }

  private void write(Checkpoint checkpoint) {
    Path target = fileOf(checkpoint.sourceId());
    StoredCheckpoint stored = new StoredCheckpoint(
        checkpoint.sourceId(),
        checkpoint.lastCompletedUnitKey().granularity(),
        checkpoint.lastCompletedUnitKey().value(),
        checkpoint.updatedAt().toString());
    try {
      Files.createDirectories(directory);
      Path temp = Files.createTempFile(directory, checkpoint.sourceId() + "-", ".tmp");
      try {
        objectMapper.writeValue(temp.toFile(), stored);
        moveIntoPlace(temp, target);
      } finally {
        Files.deleteIfExists(temp);
      }
    } catch (IOException e) {
      throw new StoreUnavailableException("Cannot write checkpoint file " + target, e);
    }
  }

  private static void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported in {}, replacing {}", target.getParent(), target.getFileName());
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private Path fileOf(String sourceId) {
    return directory.resolve(sourceId + SUFFIX);
  }

  record StoredCheckpoint(
      String sourceId, Granularity granularity, String lastCompletedUnitKey, String updatedAt) {}
}
