package dev.semanticcut.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Scenes to index.
 *
 * @param scenes scenes whose clips become vector points
 * @param recreateCollection drop and recreate the collection before indexing
 */
public record IndexRequest(
    @NotNull @Valid List<Scene> scenes,
    @JsonProperty("recreate_collection") boolean recreateCollection) {

  public IndexRequest {
    scenes = scenes == null ? List.of() : List.copyOf(scenes);
  }
}
