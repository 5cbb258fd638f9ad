package dev.semanticcut.search;

import static org.assertj.core.api.Assertions.assertThat;

import dev.semanticcut.fixture.ClipHitBuilder;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based checks for {@link ReciprocalRankFusion}: every clip appears exactly once, nothing
 * is invented, and the output is ordered by fused score.
 */
class ReciprocalRankFusionPropertyTest {

  @Provide
  Arbitrary<List<List<String>>> runs() {
    Arbitrary<List<String>> run =
        Arbitraries.of("a", "b", "c", "d", "e", "f", "g", "h")
            .list()
            .uniqueElements()
            .ofMaxSize(8);
    return run.list().ofMinSize(1).ofMaxSize(3);
  }

  private static List<List<Candidate>> toCandidates(List<List<String>> runs) {
    return runs.stream()
        .map(
            run ->
                run.stream()
                    .map(id -> Candidate.from(new ClipHitBuilder().clipId(id).build()))
                    .toList())
        .toList();
  }

  @Property
  void fused_ids_are_the_distinct_union_of_all_runs(@ForAll("runs") List<List<String>> runs) {
    Set<String> expected = new LinkedHashSet<>();
    runs.forEach(expected::addAll);

    List<Candidate> fused = ReciprocalRankFusion.fuse(toCandidates(runs), 60);

    List<String> ids = fused.stream().map(Candidate::clipId).toList();
    assertThat(ids).doesNotHaveDuplicates();
    assertThat(ids).containsExactlyInAnyOrderElementsOf(expected);
  }

  @Property
  void fused_scores_are_descending_and_bounded(@ForAll("runs") List<List<String>> runs) {
    List<Candidate> fused = ReciprocalRankFusion.fuse(toCandidates(runs), 60);

    double upperBound = runs.size() / 61.0 + 1e-12;
    for (int i = 0; i < fused.size(); i++) {
      assertThat(fused.get(i).score()).isPositive().isLessThanOrEqualTo(upperBound);
      if (i > 0) {
        assertThat(fused.get(i).score()).isLessThanOrEqualTo(fused.get(i - 1).score());
      }
    }
  }
}
