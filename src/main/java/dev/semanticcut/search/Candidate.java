package dev.semanticcut.search;

import dev.semanticcut.vector.ClipHit;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A clip returned by retrieval, before reranking.
 *
 * @param clipId stable clip id, the deduplication key across merged runs
 * @param sceneId scene the clip belongs to
 * @param payload stored clip metadata
 * @param text full indexed text, sent to the reranker
 * @param snippet short display text
 * @param score vector similarity, or fused score after a hybrid merge
 */
public record Candidate(
    String clipId,
    String sceneId,
    Map<String, Object> payload,
    String text,
    String snippet,
    double score) {

  static final String NO_TEXT = "(no text)";
  private static final int SNIPPET_FALLBACK_CHARS = 120;

  public static Candidate from(ClipHit hit) {
    Map<String, Object> payload = hit.payload();
    String clipId = stringOr(payload.get("clip_id"), hit.id());
    String text = stringOr(payload.get("text"), "");
    String snippet = stringOr(payload.get("snippet"), "");
    if (snippet.isEmpty()) {
      snippet =
          text.isEmpty()
              ? NO_TEXT
              : text.substring(0, Math.min(SNIPPET_FALLBACK_CHARS, text.length()));
    }
    String sceneId = stringOr(payload.get("scene_id"), "");
    return new Candidate(clipId, sceneId, payload, text, snippet, hit.score());
  }

  /** Text handed to the reranker: the full text, else the snippet. */
  String rerankDocument() {
    return text.isEmpty() ? snippet : text;
  }

  Candidate withScore(double newScore) {
    return new Candidate(clipId, sceneId, payload, text, snippet, newScore);
  }

  private static String stringOr(@Nullable Object value, String fallback) {
    if (value == null) {
      return fallback;
    }
    String s = value.toString();
    return s.isEmpty() ? fallback : s;
  }
}
