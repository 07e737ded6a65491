package dev.shortlist.search;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines lexical and semantic score vectors into a single ordering.
 *
 * <p>The default method is weighted Reciprocal Rank Fusion:
 *
 * <pre>{@code
 * fused[i] = alpha / (k + semanticRank[i]) + (1 - alpha) / (k + lexicalRank[i])
 * }</pre>
 *
 * <p>Ranks start at 0 and ties in either signal are broken by corpus index, so the fused ordering
 * is fully determined by the inputs. Being rank-based, the formula needs no calibration between
 * BM25 magnitudes and similarity magnitudes.
 */
public final class RankFuser {

  private RankFuser() {}

  /**
   * Fuses two aligned score vectors.
   *
   * @param lexical lexical scores, one per passage
   * @param semantic semantic scores, one per passage
   * @param config fusion parameters
   * @return the {@code min(topK, n)} best passages by fused score, ties by ascending index
   * @throws IllegalArgumentException if the vectors have different lengths
   */
  public static List<ScoredIndex> fuse(
      ScoreVector lexical, ScoreVector semantic, FusionConfig config) {
    if (lexical.size() != semantic.size()) {
      throw new IllegalArgumentException(
          "Score vectors must have the same length, got lexical="
              + lexical.size()
              + " semantic="
              + semantic.size());
    }

    // No evidence from either signal: keep corpus order
    if (lexical.isAllZero() && semantic.isAllZero()) {
      int limit = Math.min(config.topK(), lexical.size());
      List<ScoredIndex> corpusOrder = new ArrayList<>(limit);
      for (int i = 0; i < limit; i++) {
        corpusOrder.add(new ScoredIndex(i, 0.0));
      }
      return corpusOrder;
    }

    double[] fused =
        switch (config.method()) {
          case RECIPROCAL_RANK ->
              reciprocalRankScores(lexical, semantic, config.alpha(), config.k());
          case WEIGHTED_SCORE ->
              ConvexCombinationFusion.combine(lexical, semantic, config.alpha());
        };
    return ScoreVector.of(fused).top(config.topK());
  }

  /**
   * Weighted RRF score of every passage.
   *
   * @return fused score per corpus index
   */
  static double[] reciprocalRankScores(
      ScoreVector lexical, ScoreVector semantic, double alpha, int k) {
    int[] lexicalRanks = lexical.ranks();
    int[] semanticRanks = semantic.ranks();
    double[] fused = new double[lexicalRanks.length];
    for (int i = 0; i < fused.length; i++) {
      fused[i] = alpha / (k + semanticRanks[i]) + (1.0 - alpha) / (k + lexicalRanks[i]);
    }
    return fused;
  }
}
