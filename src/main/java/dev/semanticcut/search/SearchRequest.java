package dev.semanticcut.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A footage search request.
 *
 * <p>The optional filter fields are caller-supplied constraints. They are always applied as
 * required conditions, on top of whatever the query parser infers; {@code actors} matches clips
 * featuring at least one of the listed actors.
 *
 * @param query natural-language query; blank yields no results
 * @param limit number of results, clamped to [1, 20]; null means the configured default
 * @param sceneId optional scene id filter
 * @param location optional location filter
 * @param timeOfDay optional time of day filter
 * @param intExt optional INT/EXT filter
 * @param actors optional actor filter (any of)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchRequest(
    @Nullable String query,
    @Nullable Integer limit,
    @Nullable String sceneId,
    @Nullable String location,
    @Nullable String timeOfDay,
    @Nullable String intExt,
    @Nullable List<String> actors) {

  static final int MAX_LIMIT = 20;

  public SearchRequest {
    if (limit != null) {
      limit = Math.min(Math.max(1, limit), MAX_LIMIT);
    }
  }

  /** Query with default limit and no caller filters. */
  public SearchRequest(String query) {
    this(query, null, null, null, null, null, null);
  }

  /** Query with an explicit limit and no caller filters. */
  public SearchRequest(String query, @Nullable Integer limit) {
    this(query, limit, null, null, null, null, null);
  }

  /** Caller filters in the flat field-to-value shape; absent fields are omitted. */
  public Map<String, Object> filters() {
    Map<String, Object> filters = new LinkedHashMap<>();
    putIfPresent(filters, "scene_id", sceneId);
    putIfPresent(filters, "location", location);
    putIfPresent(filters, "time_of_day", timeOfDay);
    putIfPresent(filters, "int_ext", intExt);
    putIfPresent(filters, "actors", actors);
    return filters;
  }

  private static void putIfPresent(Map<String, Object> filters, String key, @Nullable Object value) {
    if (value != null) {
      filters.put(key, value);
    }
  }
}
