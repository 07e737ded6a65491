package dev.shortlist.search.eval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.shortlist.search.eval.RetrievalMetrics.MetricsResult;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RetrievalMetricsTest {

  private static final Set<String> RELEVANT_ABD = Set.of("a", "b", "d");

  private static final double TOLERANCE = 0.001;

  @Nested
  class ComputeAll {

    @Test
    void two_of_three_relevant_found_in_top_three() {
      MetricsResult result = RetrievalMetrics.computeAll(List.of("a", "x", "b"), RELEVANT_ABD, 3);

      assertThat(result.recallAtK()).isCloseTo(2.0 / 3.0, within(TOLERANCE));
      assertThat(result.precisionAtK()).isCloseTo(2.0 / 3.0, within(TOLERANCE));
      assertThat(result.mrr()).isCloseTo(1.0, within(TOLERANCE));
      assertThat(result.hitRate()).isEqualTo(1.0);
    }

    @Test
    void first_relevant_at_rank_three_gives_reciprocal_rank_one_third() {
      MetricsResult result = RetrievalMetrics.computeAll(List.of("x", "y", "d"), RELEVANT_ABD, 5);

      assertThat(result.mrr()).isCloseTo(1.0 / 3.0, within(TOLERANCE));
    }

    @Test
    void ideal_ranking_has_ndcg_one() {
      MetricsResult result =
          RetrievalMetrics.computeAll(List.of("a", "b", "d", "x"), RELEVANT_ABD, 3);

      assertThat(result.ndcgAtK()).isCloseTo(1.0, within(TOLERANCE));
    }

    @Test
    void ndcg_penalises_late_relevant_results() {
      // dcg = 1 / log2(3); idcg over min(k, |relevant|) = 1 position = 1
      MetricsResult result = RetrievalMetrics.computeAll(List.of("x", "a"), Set.of("a"), 2);

      assertThat(result.ndcgAtK()).isCloseTo(1.0 / (Math.log(3) / Math.log(2)), within(TOLERANCE));
    }

    @Test
    void results_beyond_k_are_ignored() {
      MetricsResult result = RetrievalMetrics.computeAll(List.of("x", "y", "a"), RELEVANT_ABD, 2);

      assertThat(result.hitRate()).isZero();
      assertThat(result.recallAtK()).isZero();
      assertThat(result.mrr()).isZero();
    }

    @Test
    void empty_retrieval_scores_zero_everywhere() {
      MetricsResult result = RetrievalMetrics.computeAll(List.of(), RELEVANT_ABD, 5);

      assertThat(result).isEqualTo(new MetricsResult(0.0, 0.0, 0.0, 0.0, 0.0));
    }

    @Test
    void no_relevant_passages_scores_zero_recall() {
      MetricsResult result = RetrievalMetrics.computeAll(List.of("a"), Set.of(), 5);

      assertThat(result.recallAtK()).isZero();
      assertThat(result.ndcgAtK()).isZero();
    }
  }

  @Nested
  class Average {

    @Test
    void averages_component_wise() {
      MetricsResult mean =
          RetrievalMetrics.average(
              List.of(
                  new MetricsResult(1.0, 0.5, 1.0, 1.0, 1.0),
                  new MetricsResult(0.0, 0.0, 0.0, 0.0, 0.0)));

      assertThat(mean).isEqualTo(new MetricsResult(0.5, 0.25, 0.5, 0.5, 0.5));
    }

    @Test
    void empty_list_averages_to_zero() {
      assertThat(RetrievalMetrics.average(List.of())).isEqualTo(MetricsResult.ZERO);
    }
  }
}
