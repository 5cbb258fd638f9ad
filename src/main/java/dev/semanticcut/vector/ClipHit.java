package dev.semanticcut.vector;

import java.util.Map;

/**
 * One nearest-neighbour hit.
 *
 * @param id point id as stored
 * @param score similarity reported by the store (cosine, higher is closer)
 * @param payload the clip payload fields
 */
public record ClipHit(String id, double score, Map<String, Object> payload) {

  public ClipHit {
    payload = payload == null ? Map.of() : payload;
  }
}
