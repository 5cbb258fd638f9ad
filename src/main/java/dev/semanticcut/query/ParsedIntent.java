package dev.semanticcut.query;

import dev.semanticcut.filter.FilterClauseSet;
import java.util.List;

/**
 * Structured interpretation of a raw search query.
 *
 * @param intent search-friendly sentence that gets embedded; empty only for an empty query
 * @param keywords up to five salient phrases, informational
 * @param filters canonical must / should / must_not clauses, {@link FilterClauseSet#EMPTY} when
 *     the query names no constraint
 */
public record ParsedIntent(String intent, List<String> keywords, FilterClauseSet filters) {

  public static final ParsedIntent EMPTY = new ParsedIntent("", List.of(), FilterClauseSet.EMPTY);

  public ParsedIntent {
    keywords = List.copyOf(keywords);
    filters = filters == null ? FilterClauseSet.EMPTY : filters;
  }

  /** The degraded interpretation: the trimmed query itself, no keywords, no filters. */
  public static ParsedIntent fallback(String rawQuery) {
    return new ParsedIntent(rawQuery.trim(), List.of(), FilterClauseSet.EMPTY);
  }
}
