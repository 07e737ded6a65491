package dev.shortlist.search;

/**
 * Score-based alternative to reciprocal rank fusion.
 *
 * <p>Applies min-max normalisation to each signal independently, then combines them with {@code
 * combined = alpha * normSemantic + (1 - alpha) * normLexical}. A constant signal (max == min)
 * normalises to 1.0 everywhere and therefore does not affect the ordering.
 *
 * <p>Stateless; selected through {@link FusionMethod#WEIGHTED_SCORE}.
 */
final class ConvexCombinationFusion {

  private ConvexCombinationFusion() {}

  /**
   * Combines two aligned score vectors.
   *
   * @param lexical lexical scores
   * @param semantic semantic scores
   * @param alpha weight of the semantic signal
   * @return combined score per corpus index
   */
  static double[] combine(ScoreVector lexical, ScoreVector semantic, double alpha) {
    double lexicalMin = lexical.min();
    double lexicalMax = lexical.max();
    double semanticMin = semantic.min();
    double semanticMax = semantic.max();

    double[] combined = new double[lexical.size()];
    for (int i = 0; i < combined.length; i++) {
      combined[i] =
          alpha * normalise(semantic.get(i), semanticMin, semanticMax)
              + (1.0 - alpha) * normalise(lexical.get(i), lexicalMin, lexicalMax);
    }
    return combined;
  }

  /**
   * Min-max normalises a score to [0, 1]. If max == min (all scores identical), returns 1.0.
   *
   * @param score the raw score to normalise
   * @param min the minimum score in the signal
   * @param max the maximum score in the signal
   * @return normalised score in [0, 1]
   */
  private static double normalise(double score, double min, double max) {
    if (max == min) {
      return 1.0;
    }
    return (score - min) / (max - min);
  }
}
