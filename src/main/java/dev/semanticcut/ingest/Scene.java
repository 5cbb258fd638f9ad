package dev.semanticcut.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * A screenplay scene and its clips, as stored in the catalog JSON.
 *
 * @param sceneId scene id, exposed as {@code video_id} in search results
 * @param sceneDescription slug-line metadata
 * @param clips the scene's clips
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Scene(
    @NotBlank String sceneId,
    @NotNull @Valid SceneDescription sceneDescription,
    @Valid List<Clip> clips) {

  public Scene {
    clips = clips == null ? List.of() : List.copyOf(clips);
  }
}
