package dev.presscrawl.config;

import static org.assertj.core.api.Assertions.assertThat;

import dev.presscrawl.exception.ConfigException;
import dev.presscrawl.exception.StoreUnavailableException;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

class GlobalExceptionHandlerTest {

  private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

  @Test
  void unknownSourceIsBadRequest() {
    ProblemDetail problem = handler.handleIllegalArgument(new IllegalArgumentException("Unknown source: nope"));

    assertThat(problem.getStatus()).isEqualTo(400);
    assertThat(problem.getDetail()).isEqualTo("Unknown source: nope");
  }

  @Test
  void invalidConfigurationIsBadRequest() {
    ProblemDetail problem = handler.handleConfig(new ConfigException("checkpoint granularity changed"));

    assertThat(problem.getStatus()).isEqualTo(400);
  }

  @Test
  void runningCrawlIsConflict() {
    ProblemDetail problem = handler.handleIllegalState(new IllegalStateException("Source news18 is already being crawled"));

    assertThat(problem.getStatus()).isEqualTo(409);
    assertThat(problem.getDetail()).contains("news18");
  }

  @Test
  void unreachableStoreIsServiceUnavailable() {
    ProblemDetail problem = handler.handleStoreUnavailable(
        new StoreUnavailableException("Checkpoint store unavailable", new SQLException("connection refused")));

    assertThat(problem.getStatus()).isEqualTo(503);
  }
}
