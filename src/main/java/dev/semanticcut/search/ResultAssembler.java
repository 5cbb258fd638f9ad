package dev.semanticcut.search;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * Pure static utility turning the candidate pool and the reranker's verdicts into the final,
 * bounded result list.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Keep reranked items whose index points into the pool and whose score is at least {@code
 *       minScore}; an index seen twice is used once
 *   <li>While fewer than {@code returnTop} items remain and unused candidates exist, append the
 *       next unused candidate in pool order with score 0.0
 *   <li>Assign {@code match_score} by position: 1.0 for a single result, otherwise a linear ramp
 *       from 1.0 down to 0.0, rounded to four decimals
 *   <li>Derive {@link Confidence} from the raw score
 * </ol>
 */
public final class ResultAssembler {

  private ResultAssembler() {}

  /**
   * Assembles ranked results.
   *
   * @param candidates the candidate pool, in retrieval order
   * @param reranked reranker output, best first
   * @param returnTop maximum number of results
   * @param minScore reranker scores below this are dropped
   * @return at most {@code min(returnTop, candidates.size())} results, best first
   */
  public static List<RankedResult> assemble(
      List<Candidate> candidates, List<RerankedItem> reranked, int returnTop, double minScore) {
    if (candidates.isEmpty() || returnTop < 1) {
      return List.of();
    }

    List<RerankedItem> items = new ArrayList<>();
    Set<Integer> used = new HashSet<>();
    for (RerankedItem item : reranked) {
      if (items.size() >= returnTop) {
        break;
      }
      int index = item.index();
      if (index < 0 || index >= candidates.size() || item.score() < minScore) {
        continue;
      }
      if (used.add(index)) {
        items.add(item);
      }
    }

    for (int i = 0; i < candidates.size() && items.size() < returnTop; i++) {
      if (used.add(i)) {
        items.add(new RerankedItem(i, 0.0));
      }
    }

    int n = items.size();
    List<RankedResult> results = new ArrayList<>(n);
    for (int position = 0; position < n; position++) {
      RerankedItem item = items.get(position);
      results.add(toResult(candidates.get(item.index()), item.score(), matchScore(position, n)));
    }
    return results;
  }

  /** Linear rank normalisation: 1.0 at the top, 0.0 at the bottom, 1.0 for a single result. */
  static double matchScore(int position, int count) {
    if (count <= 1) {
      return 1.0;
    }
    double raw = 1.0 - (double) position / (count - 1);
    return Math.round(raw * 10_000) / 10_000.0;
  }

  private static RankedResult toResult(Candidate candidate, double score, double matchScore) {
    Map<String, Object> payload = candidate.payload();
    return new RankedResult(
        candidate.clipId(),
        candidate.sceneId(),
        number(payload.get("start")),
        number(payload.get("end")),
        displayText(candidate),
        score,
        matchScore,
        Confidence.forScore(score),
        payload);
  }

  /** The joined clip description, else the snippet. */
  static String displayText(Candidate candidate) {
    Object description = candidate.payload().get("clip_description");
    String text = "";
    if (description instanceof Collection<?> parts) {
      text = parts.stream().map(String::valueOf).collect(Collectors.joining(" ")).strip();
    } else if (description != null) {
      text = description.toString().strip();
    }
    return text.isEmpty() ? candidate.snippet() : text;
  }

  private static double number(@Nullable Object value) {
    return value instanceof Number n ? n.doubleValue() : 0.0;
  }
}
