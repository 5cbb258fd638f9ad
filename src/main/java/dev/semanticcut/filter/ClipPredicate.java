package dev.semanticcut.filter;

import java.util.List;

/**
 * Vector-store filter predicate over clip payload fields, shaped after the store's native
 * must / should / must_not filter.
 *
 * <p>Records all the way down, so two predicates compiled from the same clause set are equal.
 *
 * @param must conditions that must all hold
 * @param should conditions of which at least one must hold (ignored when empty)
 * @param mustNot conditions of which none may hold
 */
public record ClipPredicate(
    List<ClipPredicate.Condition> must,
    List<ClipPredicate.Condition> should,
    List<ClipPredicate.Condition> mustNot) {

  public ClipPredicate {
    must = List.copyOf(must);
    should = List.copyOf(should);
    mustNot = List.copyOf(mustNot);
  }

  public boolean isEmpty() {
    return must.isEmpty() && should.isEmpty() && mustNot.isEmpty();
  }

  /** A single predicate condition. */
  public interface Condition {}

  /**
   * Payload field equals value. For list-valued payload fields (actors) the store matches when
   * any element equals the value.
   */
  public record FieldMatch(String key, String value) implements Condition {}

  /** Nested OR group: at least one of the matches must hold. */
  public record AnyMatch(List<FieldMatch> matches) implements Condition {

    public AnyMatch {
      matches = List.copyOf(matches);
    }
  }
}
