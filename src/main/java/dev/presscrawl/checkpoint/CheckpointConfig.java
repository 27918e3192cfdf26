package dev.presscrawl.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the {@link CheckpointStore} backend from {@code presscrawl.checkpoint.backend}:
 * {@code jdbc} (default) or {@code file}.
 */
@Configuration
public class CheckpointConfig {

  @Bean
  @ConditionalOnProperty(prefix = "presscrawl.checkpoint", name = "backend", havingValue = "jdbc",
      matchIfMissing = true)
  public CheckpointStore jpaCheckpointStore(CheckpointRepository repository, Clock clock) {
    return new JpaCheckpointStore(repository, clock);
  }

  @Bean
  @ConditionalOnProperty(prefix = "presscrawl.checkpoint", name = "backend", havingValue = "file")
  public CheckpointStore fileCheckpointStore(
      @Value("${presscrawl.checkpoint.directory:data/checkpoints}") String directory,
      ObjectMapper objectMapper,
      Clock clock) {
    return new FileCheckpointStore(Path.of(directory), objectMapper, clock);
  }
}
