package dev.semanticcut.filter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One boolean clause (must, should or must_not) of a {@link FilterClauseSet}: a mapping from
 * payload field to value. Entries are kept in {@link FilterField} declaration order.
 *
 * @param entries the field constraints; never contains blank values
 */
public record FilterClause(Map<FilterField, FilterValue> entries) {

  public static final FilterClause EMPTY = new FilterClause(Map.of());

  public FilterClause {
    EnumMap<FilterField, FilterValue> copy = new EnumMap<>(FilterField.class);
    if (entries != null) {
      copy.putAll(entries);
    }
    entries = Collections.unmodifiableMap(copy);
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /**
   * Returns a clause holding this clause's entries overlaid with {@code other}'s. Fields present
   * in both take the value from {@code other}.
   */
  public FilterClause overlay(FilterClause other) {
    EnumMap<FilterField, FilterValue> merged = new EnumMap<>(FilterField.class);
    merged.putAll(entries);
    merged.putAll(other.entries);
    return new FilterClause(merged);
  }

  /** Wire form: payload key to scalar or list. */
  public Map<String, Object> toWire() {
    Map<String, Object> wire = new LinkedHashMap<>();
    entries.forEach((field, value) -> wire.put(field.key(), value.toWire()));
    return wire;
  }
}
