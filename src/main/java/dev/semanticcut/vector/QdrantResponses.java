package dev.semanticcut.vector;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;

/** Subset of the Qdrant REST response bodies read by {@link QdrantClipVectorStore}. */
final class QdrantResponses {

  private QdrantResponses() {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Exists(ExistsResult result) {

    boolean exists() {
      return result != null && result.exists();
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ExistsResult(boolean exists) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Query(QueryResult result) {

    List<ScoredPoint> points() {
      return result == null || result.points() == null ? List.of() : result.points();
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record QueryResult(List<ScoredPoint> points) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ScoredPoint(Object id, double score, Map<String, Object> payload) {}
}
