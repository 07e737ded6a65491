package dev.shortlist.search.eval;

import dev.shortlist.search.SearchMethod;
import java.util.Map;

/**
 * Averaged metrics per retrieval strategy over a golden set.
 *
 * @param queryCount number of evaluated queries
 * @param k evaluation depth
 * @param byMethod mean metrics for each strategy
 */
public record EvaluationSummary(
    int queryCount, int k, Map<SearchMethod, RetrievalMetrics.MetricsResult> byMethod) {

  public EvaluationSummary {
    byMethod = Map.copyOf(byMethod);
  }

  public RetrievalMetrics.MetricsResult metrics(SearchMethod method) {
    return byMethod.get(method);
  }
}
