package dev.shortlist.search.eval;

import java.util.List;
import java.util.Set;

/**
 * Standard Information Retrieval metrics with binary relevance.
 *
 * <p>All methods are pure functions of the retrieved passage keys (best first) and the set of keys
 * judged relevant.
 */
public final class RetrievalMetrics {

  private RetrievalMetrics() {}

  /** All metrics of one ranked list at depth k. */
  public record MetricsResult(
      double recallAtK, double precisionAtK, double mrr, double ndcgAtK, double hitRate) {

    static final MetricsResult ZERO = new MetricsResult(0.0, 0.0, 0.0, 0.0, 0.0);
  }

  /** Computes recall@k, precision@k, MRR, nDCG@k and hit rate in one pass. */
  public static MetricsResult computeAll(
      List<String> retrievedKeys, Set<String> relevantKeys, int k) {
    List<String> topK = retrievedKeys.subList(0, Math.min(k, retrievedKeys.size()));

    int found = 0;
    double reciprocalRank = 0.0;
    double dcg = 0.0;
    for (int i = 0; i < topK.size(); i++) {
      if (relevantKeys.contains(topK.get(i))) {
        found++;
        dcg += 1.0 / log2(i + 2);
        if (reciprocalRank == 0.0) {
          reciprocalRank = 1.0 / (i + 1);
        }
      }
    }

    double idcg = 0.0;
    for (int i = 0; i < Math.min(k, relevantKeys.size()); i++) {
      idcg += 1.0 / log2(i + 2);
    }

    double recall = relevantKeys.isEmpty() ? 0.0 : (double) found / relevantKeys.size();
    double precision = topK.isEmpty() ? 0.0 : (double) found / topK.size();
    double ndcg = idcg == 0.0 ? 0.0 : dcg / idcg;
    double hit = found > 0 ? 1.0 : 0.0;
    return new MetricsResult(recall, precision, reciprocalRank, ndcg, hit);
  }

  /** Component-wise mean; zero for an empty list. */
  public static MetricsResult average(List<MetricsResult> results) {
    if (results.isEmpty()) {
      return MetricsResult.ZERO;
    }
    double recall = 0.0;
    double precision = 0.0;
    double mrr = 0.0;
    double ndcg = 0.0;
    double hit = 0.0;
    for (MetricsResult r : results) {
      recall += r.recallAtK();
      precision += r.precisionAtK();
      mrr += r.mrr();
      ndcg += r.ndcgAtK();
      hit += r.hitRate();
    }
    int n = results.size();
    return new MetricsResult(recall / n, precision / n, mrr / n, ndcg / n, hit / n);
  }

  private static double log2(double x) {
    return Math.log(x) / Math.log(2);
  }
}
