package dev.semanticcut.query;

import dev.semanticcut.ingest.Clip;
import dev.semanticcut.ingest.Scene;
import dev.semanticcut.ingest.SceneCatalogLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Filter values that exist in the scene catalog, computed once on first use.
 *
 * <p>Collects scene ids, locations, times of day, INT/EXT markers and the actors named on scenes
 * and clips. A missing or unreadable catalog yields {@link FilterVocabulary#DEFAULT}, which is
 * cached as well: the file is never re-read.
 */
@Component
public class CanonicalFilterVocabulary {

  private static final Logger log = LoggerFactory.getLogger(CanonicalFilterVocabulary.class);

  private final SceneCatalogLoader catalogLoader;

  private volatile @Nullable FilterVocabulary vocabulary;

  public CanonicalFilterVocabulary(SceneCatalogLoader catalogLoader) {
    this.catalogLoader = catalogLoader;
  }

  public FilterVocabulary get() {
    FilterVocabulary result = vocabulary;
    if (result == null) {
      synchronized (this) {
        result = vocabulary;
        if (result == null) {
          result = load();
          vocabulary = result;
        }
      }
    }
    return result;
  }

  private FilterVocabulary load() {
    Path path = catalogLoader.configuredPath();
    if (path == null || !Files.isRegularFile(path)) {
      log.info("No scene catalog at {}; using default filter vocabulary", path);
      return FilterVocabulary.DEFAULT;
    }
    List<Scene> scenes;
    try {
      scenes = catalogLoader.load(path);
    } catch (Exception e) {
      log.warn("Could not load filter vocabulary from {}: {}", path, e.getMessage());
      return FilterVocabulary.DEFAULT;
    }

    TreeSet<String> sceneIds = new TreeSet<>();
    TreeSet<String> locations = new TreeSet<>();
    TreeSet<String> timesOfDay = new TreeSet<>();
    TreeSet<String> intExt = new TreeSet<>();
    TreeSet<String> actors = new TreeSet<>();
    for (Scene scene : scenes) {
      addIfPresent(sceneIds, scene.sceneId());
      addIfPresent(locations, scene.sceneDescription().location());
      addIfPresent(timesOfDay, scene.sceneDescription().timeOfDay());
      addIfPresent(intExt, scene.sceneDescription().intExt());
      addAllPresent(actors, scene.sceneDescription().actorsInvolved());
      for (Clip clip : scene.clips()) {
        addAllPresent(actors, clip.actorsInvolved());
      }
    }
    FilterVocabulary loaded =
        new FilterVocabulary(
            List.copyOf(sceneIds),
            List.copyOf(locations),
            List.copyOf(timesOfDay),
            List.copyOf(intExt),
            List.copyOf(actors));
    log.debug(
        "Loaded filter vocabulary: {} locations, {} actors",
        loaded.locations().size(),
        loaded.actors().size());
    return loaded;
  }

  private static void addAllPresent(TreeSet<String> target, Collection<String> values) {
    values.forEach(v -> addIfPresent(target, v));
  }

  private static void addIfPresent(TreeSet<String> target, @Nullable String value) {
    if (value != null && !value.isBlank()) {
      target.add(value);
    }
  }
}
