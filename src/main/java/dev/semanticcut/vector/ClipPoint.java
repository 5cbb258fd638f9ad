package dev.semanticcut.vector;

import java.util.List;
import java.util.Map;

/**
 * A point to upsert: id, dense vector and payload.
 *
 * @param id point id (UUID string)
 * @param vector embedding of the clip text
 * @param payload clip fields used for filtering and display
 */
public record ClipPoint(String id, List<Float> vector, Map<String, Object> payload) {}
