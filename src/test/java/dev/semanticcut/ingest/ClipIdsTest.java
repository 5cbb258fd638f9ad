package dev.semanticcut.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class ClipIdsTest {

  @Test
  void matchesReferenceNameBasedUuidV5() {
    // Reference value from RFC 4122 implementations: uuid5(NAMESPACE_DNS, "python.org")
    assertThat(ClipIds.nameUuidV5(ClipIds.NAMESPACE_DNS, "python.org"))
        .isEqualTo(UUID.fromString("886313e1-3b8a-5372-9b90-0c9aee199e5d"));
  }

  @Test
  void pointIdIsStableAndVersionFive() {
    String first = ClipIds.pointId("scene_2_clip_1");
    String second = ClipIds.pointId("scene_2_clip_1");

    assertThat(first).isEqualTo(second);
    assertThat(UUID.fromString(first).version()).isEqualTo(5);
    assertThat(UUID.fromString(first).variant()).isEqualTo(2);
  }

  @Test
  void distinctClipsGetDistinctIds() {
    assertThat(ClipIds.pointId("scene_2_clip_1")).isNotEqualTo(ClipIds.pointId("scene_2_clip_2"));
  }
}
