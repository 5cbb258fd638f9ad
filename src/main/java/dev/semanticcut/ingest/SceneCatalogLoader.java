package dev.semanticcut.ingest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads scene catalog files. A file holds either a JSON array of scenes or a single scene object.
 */
@Component
public class SceneCatalogLoader {

  private static final Logger log = LoggerFactory.getLogger(SceneCatalogLoader.class);

  private final ObjectMapper objectMapper;
  private final CatalogProperties properties;

  public SceneCatalogLoader(ObjectMapper objectMapper, CatalogProperties properties) {
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /** The configured catalog path, or null when none is set. */
  public @Nullable Path configuredPath() {
    return properties.scenesPath();
  }

  /**
   * Loads all scenes of a catalog file.
   *
   * @throws IOException if the file cannot be read or is not valid scene JSON
   */
  public List<Scene> load(Path path) throws IOException {
    JsonNode root = objectMapper.readTree(Files.readString(path));
    List<Scene> scenes;
    if (root != null && root.isArray()) {
      scenes = objectMapper.readerFor(new TypeReference<List<Scene>>() {}).readValue(root);
    } else if (root != null && root.isObject()) {
      scenes = List.of(objectMapper.treeToValue(root, Scene.class));
    } else {
      throw new IOException("Scene catalog " + path + " is neither a JSON array nor an object");
    }
    log.info("Loaded {} scenes from {}", scenes.size(), path);
    return scenes;
  }
}
