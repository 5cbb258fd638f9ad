package dev.semanticcut.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** Slug-line metadata shared by every clip of a scene. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SceneDescription(
    String intExt, String location, String timeOfDay, List<String> actorsInvolved) {

  public SceneDescription {
    intExt = intExt == null ? "" : intExt;
    location = location == null ? "" : location;
    timeOfDay = timeOfDay == null ? "" : timeOfDay;
    actorsInvolved = actorsInvolved == null ? List.of() : List.copyOf(actorsInvolved);
  }
}
