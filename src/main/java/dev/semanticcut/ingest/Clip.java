package dev.semanticcut.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A short stretch of footage inside a scene; the unit that gets indexed and returned.
 *
 * @param clipId unique clip id
 * @param clipDescription sentences describing what the clip shows
 * @param actorsInvolved actors visible in the clip
 * @param dialogue spoken lines, possibly empty
 * @param estimatedClipStart start in seconds used when there is no dialogue
 * @param estimatedClipEnd end in seconds used when there is no dialogue
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Clip(
    @NotBlank String clipId,
    List<String> clipDescription,
    List<String> actorsInvolved,
    @Valid List<Dialogue> dialogue,
    @JsonDeserialize(using = TimestampDeserializer.class) @Nullable Double estimatedClipStart,
    @JsonDeserialize(using = TimestampDeserializer.class) @Nullable Double estimatedClipEnd) {

  public Clip {
    clipDescription = clipDescription == null ? List.of() : List.copyOf(clipDescription);
    actorsInvolved = actorsInvolved == null ? List.of() : List.copyOf(actorsInvolved);
    dialogue = dialogue == null ? List.of() : List.copyOf(dialogue);
  }
}
