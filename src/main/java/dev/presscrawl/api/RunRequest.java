package dev.presscrawl.api;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * Body of {@code POST /api/crawl/runs}.
 *
 * @param sourceIds sources to crawl; null or empty means every enabled source
 */
public record RunRequest(List<@NotBlank String> sourceIds) {

  public RunRequest {
    sourceIds = sourceIds == null ? List.of() : List.copyOf(sourceIds);
  }
}
