package dev.semanticcut.search;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure static utility merging ranked candidate lists with Reciprocal Rank Fusion.
 *
 * <p>Each occurrence contributes {@code 1 / (k + rank + 1)} with zero-based {@code rank}.
 * Candidates are keyed by clip id; the record from the first run that contains a clip is kept.
 * Output is sorted by fused score descending; ties keep first-seen order (stable sort over an
 * insertion-ordered map).
 */
public final class ReciprocalRankFusion {

  /** Conventional RRF constant. */
  public static final int DEFAULT_K = 60;

  private ReciprocalRankFusion() {}

  /**
   * Fuses the given runs.
   *
   * @param runs ranked lists, best first
   * @param k the RRF constant
   * @return every distinct candidate once, carrying its fused score
   */
  static List<Candidate> fuse(List<List<Candidate>> runs, int k) {
    Map<String, Fused> fused = new LinkedHashMap<>();
    for (List<Candidate> run : runs) {
      for (int rank = 0; rank < run.size(); rank++) {
        Candidate candidate = run.get(rank);
        double contribution = 1.0 / (k + rank + 1);
        fused.computeIfAbsent(candidate.clipId(), id -> new Fused(candidate)).score += contribution;
      }
    }

    List<Fused> ordered = new ArrayList<>(fused.values());
    ordered.sort((a, b) -> Double.compare(b.score, a.score));
    return ordered.stream().map(f -> f.candidate.withScore(f.score)).toList();
  }

  private static final class Fused {
    private final Candidate candidate;
    private double score;

    private Fused(Candidate candidate) {
      this.candidate = candidate;
    }
  }
}
