package dev.semanticcut.filter;

import org.jspecify.annotations.Nullable;

/**
 * Payload fields that can be constrained by a filter clause. Each one carries a keyword payload
 * index in the vector store.
 */
public enum FilterField {
  SCENE_ID("scene_id"),
  LOCATION("location"),
  TIME_OF_DAY("time_of_day"),
  INT_EXT("int_ext"),
  ACTORS("actors");

  private final String key;

  FilterField(String key) {
    this.key = key;
  }

  /** The payload key as stored in the vector index and as used on the wire. */
  public String key() {
    return key;
  }

  /** Actors are always list-valued and get their own combination rules. */
  public boolean isActors() {
    return this == ACTORS;
  }

  /**
   * Resolves a wire key to its field.
   *
   * @param key the payload key, e.g. {@code "time_of_day"}
   * @return the matching field, or null for unknown keys
   */
  public static @Nullable FilterField fromKey(@Nullable String key) {
    for (FilterField field : values()) {
      if (field.key.equals(key)) {
        return field;
      }
    }
    return null;
  }
}
