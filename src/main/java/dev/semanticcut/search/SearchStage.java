package dev.semanticcut.search;

/** Pipeline stages reported to a {@link SearchProgressListener}, in execution order. */
public enum SearchStage {
  QUERY_UNDERSTANDING("query_understanding"),
  EMBEDDING("embedding"),
  VECTOR_SEARCH("vector_search"),
  HYBRID("hybrid"),
  RERANK("rerank");

  private final String id;

  SearchStage(String id) {
    this.id = id;
  }

  /** Stable identifier used on the wire. */
  public String id() {
    return id;
  }
}
