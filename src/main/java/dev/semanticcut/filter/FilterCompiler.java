package dev.semanticcut.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Compiles a canonical {@link FilterClauseSet} into the vector store's {@link ClipPredicate}.
 *
 * <p>Translation rules:
 *
 * <ul>
 *   <li>{@code must}: every field becomes a required condition. An {@link FilterValue.AnyOf}
 *       list becomes one nested OR group inside the AND; an {@link FilterValue.AllOf} list (actors)
 *       becomes one required condition per value.
 *   <li>{@code should}: every value of every field joins one shared OR group.
 *   <li>{@code must_not}: every value of every field becomes an independent exclusion.
 * </ul>
 *
 * <p>Stateless; compiling the same clause set twice yields equal predicates.
 */
@Component
public class FilterCompiler {

  /**
   * Compiles the clause set.
   *
   * @param clauses the canonical clause set (nullable)
   * @return the predicate, or null when no condition results (meaning: do not filter)
   */
  public @Nullable ClipPredicate compile(@Nullable FilterClauseSet clauses) {
    if (clauses == null || clauses.isEmpty()) {
      return null;
    }
    ClipPredicate predicate =
        new ClipPredicate(
            mustConditions(clauses.must()),
            flatConditions(clauses.should()),
            flatConditions(clauses.mustNot()));
    return predicate.isEmpty() ? null : predicate;
  }

  /**
   * Parses a raw filter map in either wire shape and compiles it.
   *
   * @see FilterClauseParser#parse(Map)
   */
  public @Nullable ClipPredicate compileWire(@Nullable Map<String, ?> wire) {
    return compile(FilterClauseParser.parse(wire));
  }

  private List<ClipPredicate.Condition> mustConditions(FilterClause clause) {
    List<ClipPredicate.Condition> conditions = new ArrayList<>();
    clause
        .entries()
        .forEach(
            (field, value) -> {
              if (value instanceof FilterValue.AnyOf anyOf) {
                conditions.add(new ClipPredicate.AnyMatch(matches(field, anyOf.values())));
              } else {
                conditions.addAll(matches(field, value.values()));
              }
            });
    return conditions;
  }

  private List<ClipPredicate.Condition> flatConditions(FilterClause clause) {
    List<ClipPredicate.Condition> conditions = new ArrayList<>();
    clause.entries().forEach((field, value) -> conditions.addAll(matches(field, value.values())));
    return conditions;
  }

  private static List<ClipPredicate.FieldMatch> matches(FilterField field, List<String> values) {
    return values.stream().map(v -> new ClipPredicate.FieldMatch(field.key(), v)).toList();
  }
}
