package dev.semanticcut.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SceneCatalogLoaderTest {

  @TempDir Path tempDir;

  private final SceneCatalogLoader loader =
      new SceneCatalogLoader(new ObjectMapper(), new CatalogProperties(null));

  @Test
  void loadsArrayOfScenesWithStringTimestamps() throws IOException {
    Path file = tempDir.resolve("scenes.json");
    Files.writeString(
        file,
        """
        [{"scene_id": "scene_1",
          "scene_description": {"int_ext": "EXT", "location": "GARDEN", "time_of_day": "DAY",
                                "actors_involved": ["CONNIE"], "mood": "festive"},
          "clips": [{"clip_id": "scene_1_clip_1",
                     "clip_description": ["Guests dance."],
                     "actors_involved": ["CONNIE"],
                     "dialogue": [{"timestamp_start_sec": "00:00:03,200",
                                   "timestamp_end_sec": 6.5,
                                   "actor": "CONNIE", "text": "Papa!",
                                   "actual_dialogs": ["Papa, dance with me!"]}],
                     "estimated_clip_start": null}]}]
        """);

    List<Scene> scenes = loader.load(file);

    assertThat(scenes).hasSize(1);
    Scene scene = scenes.get(0);
    assertThat(scene.sceneDescription().location()).isEqualTo("GARDEN");
    Clip clip = scene.clips().get(0);
    assertThat(clip.dialogue().get(0).timestampStartSec()).isEqualTo(3.2);
    assertThat(clip.dialogue().get(0).timestampEndSec()).isEqualTo(6.5);
    assertThat(clip.dialogue().get(0).actualDialogs()).containsExactly("Papa, dance with me!");
    assertThat(clip.estimatedClipStart()).isZero();
  }

  @Test
  void loadsSingleSceneObject() throws IOException {
    Path file = tempDir.resolve("scene.json");
    Files.writeString(
        file,
        """
        {"scene_id": "scene_9", "scene_description": {"location": "HOSPITAL"}}
        """);

    List<Scene> scenes = loader.load(file);

    assertThat(scenes).hasSize(1);
    assertThat(scenes.get(0).clips()).isEmpty();
    assertThat(scenes.get(0).sceneDescription().timeOfDay()).isEmpty();
  }

  @Test
  void rejectsScalarDocument() throws IOException {
    Path file = tempDir.resolve("bad.json");
    Files.writeString(file, "\"scenes\"");

    assertThatThrownBy(() -> loader.load(file))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("neither a JSON array nor an object");
  }
}
