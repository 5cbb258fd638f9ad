package dev.semanticcut.search;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

/**
 * A search hit as returned to callers.
 *
 * @param clipId clip id
 * @param sceneId scene id, serialised as {@code video_id}
 * @param start clip start in seconds
 * @param end clip end in seconds
 * @param text display text: the clip description, else the snippet
 * @param score raw reranker score (0.0 for filled-in or fallback results)
 * @param matchScore rank-normalised score in [0, 1]; 1.0 for the top result
 * @param confidence label derived from the raw {@code score}
 * @param metadata the clip payload
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RankedResult(
    String clipId,
    @JsonProperty("video_id") String sceneId,
    double start,
    double end,
    String text,
    double score,
    double matchScore,
    Confidence confidence,
    Map<String, Object> metadata) {}
