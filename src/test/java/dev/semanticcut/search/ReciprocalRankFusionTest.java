package dev.semanticcut.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.semanticcut.fixture.ClipHitBuilder;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReciprocalRankFusionTest {

  private static final int K = ReciprocalRankFusion.DEFAULT_K;

  private static Candidate candidate(String clipId) {
    return Candidate.from(new ClipHitBuilder().clipId(clipId).build());
  }

  private static List<String> ids(List<Candidate> candidates) {
    return candidates.stream().map(Candidate::clipId).toList();
  }

  @Test
  void empty_runs_fuse_to_empty_list() {
    assertThat(ReciprocalRankFusion.fuse(List.of(), K)).isEmpty();
    assertThat(ReciprocalRankFusion.fuse(List.of(List.of(), List.of()), K)).isEmpty();
  }

  @Test
  void single_run_keeps_order_and_scores_by_rank() {
    List<Candidate> fused =
        ReciprocalRankFusion.fuse(List.of(List.of(candidate("a"), candidate("b"))), K);

    assertThat(ids(fused)).containsExactly("a", "b");
    assertThat(fused.get(0).score()).isCloseTo(1.0 / 61, within(1e-12));
    assertThat(fused.get(1).score()).isCloseTo(1.0 / 62, within(1e-12));
  }

  @Test
  void clips_found_by_both_runs_rise_to_the_top() {
    var intentRun = List.of(candidate("a"), candidate("b"), candidate("c"));
    var rawRun = List.of(candidate("c"), candidate("a"), candidate("d"));

    List<Candidate> fused = ReciprocalRankFusion.fuse(List.of(intentRun, rawRun), K);

    // a: 1/61 + 1/62, c: 1/63 + 1/61, b: 1/62, d: 1/63
    assertThat(ids(fused)).containsExactly("a", "c", "b", "d");
    assertThat(fused.get(0).score()).isCloseTo(1.0 / 61 + 1.0 / 62, within(1e-12));
    assertThat(fused.get(1).score()).isCloseTo(1.0 / 61 + 1.0 / 63, within(1e-12));
  }

  @Test
  void equal_scores_keep_first_seen_order() {
    List<Candidate> fused =
        ReciprocalRankFusion.fuse(List.of(List.of(candidate("x")), List.of(candidate("y"))), K);

    assertThat(ids(fused)).containsExactly("x", "y");
  }

  @Test
  void first_occurrence_record_is_kept() {
    Candidate fromIntent =
        Candidate.from(new ClipHitBuilder().clipId("a").text("intent run text").build());
    Candidate fromRaw = Candidate.from(new ClipHitBuilder().clipId("a").text("raw run text").build());

    List<Candidate> fused =
        ReciprocalRankFusion.fuse(List.of(List.of(fromIntent), List.of(fromRaw)), K);

    assertThat(fused).hasSize(1);
    assertThat(fused.get(0).text()).isEqualTo("intent run text");
    assertThat(fused.get(0).score()).isCloseTo(2.0 / 61, within(1e-12));
  }

  @Test
  void smaller_k_weights_top_ranks_more_heavily() {
    List<Candidate> fused =
        ReciprocalRankFusion.fuse(List.of(List.of(candidate("a"), candidate("b"))), 1);

    assertThat(fused.get(0).score()).isCloseTo(0.5, within(1e-12));
    assertThat(fused.get(1).score()).isCloseTo(1.0 / 3, within(1e-12));
  }
}
