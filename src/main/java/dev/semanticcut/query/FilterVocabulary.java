package dev.semanticcut.query;

import java.util.List;

/**
 * Allowed filter values, shown to the language model so it emits values that exist in the
 * catalog. Every list is sorted and free of blanks.
 */
public record FilterVocabulary(
    List<String> sceneIds,
    List<String> locations,
    List<String> timesOfDay,
    List<String> intExt,
    List<String> actors) {

  /** Used when no catalog file can be read. */
  public static final FilterVocabulary DEFAULT =
      new FilterVocabulary(
          List.of(), List.of(), List.of("DAY", "NIGHT"), List.of("INT", "EXT"), List.of());

  public FilterVocabulary {
    sceneIds = List.copyOf(sceneIds);
    locations = List.copyOf(locations);
    timesOfDay = List.copyOf(timesOfDay);
    intExt = List.copyOf(intExt);
    actors = List.copyOf(actors);
  }
}
