package dev.semanticcut.filter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Boundary parser turning loosely-typed filter maps (LLM output, request bodies) into a
 * canonical {@link FilterClauseSet}.
 *
 * <p>Two wire shapes are accepted:
 *
 * <ul>
 *   <li><b>structured</b> - {@code {"must": {...}, "should": {...}, "must_not": {...}}}
 *   <li><b>legacy flat</b> - {@code {"location": "...", "actors": [...]}}, read entirely as
 *       {@code must}
 * </ul>
 *
 * <p>Sanitising: scalars are stringified and trimmed, lists keep only non-blank trimmed
 * entries, actors are always list-valued, unknown keys are ignored and clauses that end up empty
 * are dropped.
 *
 * <p>The shapes differ in how a {@code must} actor list combines. Structured {@code must}
 * requires every listed actor ({@link FilterValue.AllOf}); the legacy shape requires at least one
 * ({@link FilterValue.AnyOf}). Non-actor lists under {@code must} always mean "any of".
 */
public final class FilterClauseParser {

  static final String MUST = "must";
  static final String SHOULD = "should";
  static final String MUST_NOT = "must_not";

  private FilterClauseParser() {}

  /**
   * Parses either wire shape. A map carrying any of {@code must}, {@code should} or {@code
   * must_not} is read as structured, anything else as legacy flat.
   *
   * @param wire the raw filter map (nullable)
   * @return the canonical clause set, {@link FilterClauseSet#EMPTY} when nothing usable remains
   */
  public static FilterClauseSet parse(@Nullable Map<String, ?> wire) {
    if (wire == null || wire.isEmpty()) {
      return FilterClauseSet.EMPTY;
    }
    if (isStructured(wire)) {
      return parseStructured(wire);
    }
    return parseLegacy(wire);
  }

  /** Parses the structured must / should / must_not shape; other top-level keys are ignored. */
  public static FilterClauseSet parseStructured(@Nullable Map<String, ?> wire) {
    if (wire == null) {
      return FilterClauseSet.EMPTY;
    }
    return new FilterClauseSet(
        parseClause(wire.get(MUST), ClauseKind.MUST),
        parseClause(wire.get(SHOULD), ClauseKind.SHOULD),
        parseClause(wire.get(MUST_NOT), ClauseKind.MUST_NOT));
  }

  /** Parses the legacy flat shape into a {@code must}-only clause set. */
  public static FilterClauseSet parseLegacy(@Nullable Map<String, ?> wire) {
    if (wire == null) {
      return FilterClauseSet.EMPTY;
    }
    return new FilterClauseSet(parseClause(wire, ClauseKind.LEGACY), null, null);
  }

  static boolean isStructured(Map<String, ?> wire) {
    return wire.containsKey(MUST) || wire.containsKey(SHOULD) || wire.containsKey(MUST_NOT);
  }

  private static FilterClause parseClause(@Nullable Object raw, ClauseKind kind) {
    if (!(raw instanceof Map<?, ?> clause)) {
      return FilterClause.EMPTY;
    }
    EnumMap<FilterField, FilterValue> entries = new EnumMap<>(FilterField.class);
    for (Map.Entry<?, ?> entry : clause.entrySet()) {
      FilterField field = FilterField.fromKey(String.valueOf(entry.getKey()));
      if (field == null) {
        continue;
      }
      FilterValue value = toValue(field, entry.getValue(), kind);
      if (value != null) {
        entries.put(field, value);
      }
    }
    return entries.isEmpty() ? FilterClause.EMPTY : new FilterClause(entries);
  }

  private static @Nullable FilterValue toValue(
      FilterField field, @Nullable Object raw, ClauseKind kind) {
    if (raw == null || raw instanceof Map<?, ?>) {
      return null;
    }
    if (field.isActors() || raw instanceof Collection<?>) {
      List<String> values = toStringList(raw);
      if (values.isEmpty()) {
        return null;
      }
      if (field.isActors() && kind == ClauseKind.MUST) {
        return new FilterValue.AllOf(values);
      }
      return new FilterValue.AnyOf(values);
    }
    String value = String.valueOf(raw).trim();
    return value.isEmpty() ? null : new FilterValue.Exact(value);
  }

  private static List<String> toStringList(Object raw) {
    List<String> values = new ArrayList<>();
    if (raw instanceof Collection<?> items) {
      for (Object item : items) {
        addIfPresent(values, item);
      }
    } else {
      addIfPresent(values, raw);
    }
    return values;
  }

  private static void addIfPresent(List<String> values, @Nullable Object item) {
    if (item == null || item instanceof Map<?, ?> || item instanceof Collection<?>) {
      return;
    }
    String value = String.valueOf(item).trim();
    if (!value.isEmpty()) {
      values.add(value);
    }
  }

  private enum ClauseKind {
    MUST,
    SHOULD,
    MUST_NOT,
    LEGACY
  }
}
