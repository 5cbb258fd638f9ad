package dev.semanticcut.vector;

import dev.semanticcut.filter.ClipPredicate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link ClipPredicate} as a Qdrant REST filter object.
 *
 * <p>{@link ClipPredicate.FieldMatch} becomes {@code {"key": k, "match": {"value": v}}}; {@link
 * ClipPredicate.AnyMatch} becomes a nested {@code {"should": [...]}} filter. Empty sections are
 * omitted.
 */
final class QdrantFilterMapper {

  private QdrantFilterMapper() {}

  static Map<String, Object> toFilter(ClipPredicate predicate) {
    Map<String, Object> filter = new LinkedHashMap<>();
    putIfNotEmpty(filter, "must", predicate.must());
    putIfNotEmpty(filter, "should", predicate.should());
    putIfNotEmpty(filter, "must_not", predicate.mustNot());
    return filter;
  }

  private static void putIfNotEmpty(
      Map<String, Object> filter, String key, List<ClipPredicate.Condition> conditions) {
    if (!conditions.isEmpty()) {
      filter.put(key, conditions.stream().map(QdrantFilterMapper::condition).toList());
    }
  }

  private static Map<String, Object> condition(ClipPredicate.Condition condition) {
    if (condition instanceof ClipPredicate.FieldMatch match) {
      return fieldMatch(match);
    }
    if (condition instanceof ClipPredicate.AnyMatch any) {
      return Map.of("should", any.matches().stream().map(QdrantFilterMapper::fieldMatch).toList());
    }
    throw new IllegalArgumentException("Unsupported condition: " + condition);
  }

  private static Map<String, Object> fieldMatch(ClipPredicate.FieldMatch match) {
    return Map.of("key", match.key(), "match", Map.of("value", match.value()));
  }
}
