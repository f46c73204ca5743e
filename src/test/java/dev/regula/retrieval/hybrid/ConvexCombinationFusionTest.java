package dev.regula.retrieval.hybrid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.langchain4j.data.segment.TextSegment;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConvexCombinationFusionTest {

  private static final double ALPHA = 0.7;
  private static final double HALF_RANK = 0.1;

  // --- Helper factory methods ---

  private static ScoredCandidate candidate(String id, double score) {
    return new ScoredCandidate(id, TextSegment.from("text of " + id), score);
  }

  // --- Test cases ---

  @Test
  void empty_inputs_return_empty_result() {
    assertThat(ConvexCombinationFusion.fuse(List.of(), List.of(), ALPHA, HALF_RANK, 10)).isEmpty();
  }

  @Test
  void vector_only_candidate_scores_alpha_times_cosine() {
    var result =
        ConvexCombinationFusion.fuse(
            List.of(candidate("p1", 0.8)), List.of(), ALPHA, HALF_RANK, 10);

    assertThat(result).hasSize(1);
    assertThat(result.get(0).combinedScore()).isCloseTo(0.56, within(1e-9));
    assertThat(result.get(0).keywordPart()).isZero();
  }

  @Test
  void keyword_only_candidate_uses_saturated_rank() {
    var result =
        ConvexCombinationFusion.fuse(
            List.of(), List.of(candidate("p1", 0.1)), ALPHA, HALF_RANK, 10);

    // 0.1 / (0.1 + 0.1) = 0.5, weighted by 1 - alpha
    assertThat(result.get(0).combinedScore()).isCloseTo(0.15, within(1e-9));
    assertThat(result.get(0).vectorPart()).isZero();
  }

  @Test
  void candidate_found_by_both_signals_combines_them() {
    var result =
        ConvexCombinationFusion.fuse(
            List.of(candidate("p1", 1.0)), List.of(candidate("p1", 0.3)), ALPHA, HALF_RANK, 10);

    assertThat(result).hasSize(1);
    assertThat(result.get(0).combinedScore()).isCloseTo(0.7 + 0.3 * 0.75, within(1e-9));
    assertThat(result.get(0).breakdown().vector()).isCloseTo(0.7, within(1e-9));
    assertThat(result.get(0).breakdown().keyword()).isCloseTo(0.225, within(1e-9));
  }

  @Test
  void score_of_a_passage_does_not_depend_on_its_neighbours() {
    var alone =
        ConvexCombinationFusion.fuse(
            List.of(candidate("p1", 0.6)), List.of(), ALPHA, HALF_RANK, 10);
    var crowded =
        ConvexCombinationFusion.fuse(
            List.of(candidate("p1", 0.6), candidate("p2", 0.95), candidate("p3", 0.1)),
            List.of(candidate("p3", 2.0)),
            ALPHA,
            HALF_RANK,
            10);

    double crowdedScore =
        crowded.stream()
            .filter(c -> c.passageId().equals("p1"))
            .findFirst()
            .orElseThrow()
            .combinedScore();
    assertThat(crowdedScore).isEqualTo(alone.get(0).combinedScore());
  }

  @Test
  void results_are_sorted_descending_with_ties_broken_by_id() {
    var result =
        ConvexCombinationFusion.fuse(
            List.of(candidate("b", 0.5), candidate("a", 0.5), candidate("c", 0.9)),
            List.of(),
            ALPHA,
            HALF_RANK,
            10);

    assertThat(result)
        .extracting(ConvexCombinationFusion.FusedCandidate::passageId)
        .containsExactly("c", "a", "b");
  }

  @Test
  void max_results_limits_output() {
    var result =
        ConvexCombinationFusion.fuse(
            List.of(candidate("a", 0.9), candidate("b", 0.8), candidate("c", 0.7)),
            List.of(),
            ALPHA,
            HALF_RANK,
            2);

    assertThat(result).hasSize(2);
  }

  @Test
  void negative_and_nan_scores_contribute_nothing() {
    assertThat(ConvexCombinationFusion.clamp(-0.4)).isZero();
    assertThat(ConvexCombinationFusion.clamp(Double.NaN)).isZero();
    assertThat(ConvexCombinationFusion.clamp(1.7)).isEqualTo(1.0);
    assertThat(ConvexCombinationFusion.saturate(Double.NaN, HALF_RANK)).isZero();
  }

  @Test
  void duplicate_vector_hits_keep_the_best_score() {
    var result =
        ConvexCombinationFusion.fuse(
            List.of(candidate("p1", 0.2), candidate("p1", 0.9)),
            List.of(),
            ALPHA,
            HALF_RANK,
            10);

    assertThat(result).hasSize(1);
    assertThat(result.get(0).vectorPart()).isCloseTo(0.63, within(1e-9));
  }
}
