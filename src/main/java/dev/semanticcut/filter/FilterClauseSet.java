package dev.semanticcut.filter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical boolean filter over clip payload fields.
 *
 * <ul>
 *   <li>{@code must} - every condition must hold (AND)
 *   <li>{@code should} - at least one condition must hold (OR)
 *   <li>{@code mustNot} - no condition may hold (NOR)
 * </ul>
 *
 * <p>Both accepted wire shapes are parsed into this form by {@link FilterClauseParser}, so the
 * {@link FilterCompiler} never sees input-format variance. An empty set means "no constraint".
 */
public record FilterClauseSet(FilterClause must, FilterClause should, FilterClause mustNot) {

  public static final FilterClauseSet EMPTY =
      new FilterClauseSet(FilterClause.EMPTY, FilterClause.EMPTY, FilterClause.EMPTY);

  public FilterClauseSet {
    must = Objects.requireNonNullElse(must, FilterClause.EMPTY);
    should = Objects.requireNonNullElse(should, FilterClause.EMPTY);
    mustNot = Objects.requireNonNullElse(mustNot, FilterClause.EMPTY);
  }

  public boolean isEmpty() {
    return must.isEmpty() && should.isEmpty() && mustNot.isEmpty();
  }

  /** Returns a copy whose {@code must} clause is overlaid with {@code additional}. */
  public FilterClauseSet withMust(FilterClause additional) {
    if (additional.isEmpty()) {
      return this;
    }
    return new FilterClauseSet(must.overlay(additional), should, mustNot);
  }

  /**
   * Structured wire form. Empty clauses are omitted, so an empty set serialises to {@code {}}.
   */
  public Map<String, Object> toWire() {
    Map<String, Object> wire = new LinkedHashMap<>();
    if (!must.isEmpty()) {
      wire.put(FilterClauseParser.MUST, must.toWire());
    }
    if (!should.isEmpty()) {
      wire.put(FilterClauseParser.SHOULD, should.toWire());
    }
    if (!mustNot.isEmpty()) {
      wire.put(FilterClauseParser.MUST_NOT, mustNot.toWire());
    }
    return wire;
  }

  @Override
  public String toString() {
    return toWire().toString();
  }
}
