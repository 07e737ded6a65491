package dev.shortlist.search;

/**
 * Validated fusion parameters.
 *
 * @param alpha semantic weight in [0, 1]; {@code 1 - alpha} weights the lexical signal
 * @param k rank-damping constant of reciprocal rank fusion (must be positive)
 * @param topK number of fused candidates kept before reranking (must be positive)
 * @param method how the two signals are combined
 */
public record FusionConfig(double alpha, int k, int topK, FusionMethod method) {

  /** RRF constant from the original reciprocal rank fusion paper. */
  public static final int DEFAULT_K = 60;

  public FusionConfig {
    if (Double.isNaN(alpha) || alpha < 0.0 || alpha > 1.0) {
      throw new InvalidConfigException("alpha must be in [0.0, 1.0], got: " + alpha);
    }
    if (k <= 0) {
      throw new InvalidConfigException("k must be positive, got: " + k);
    }
    if (topK <= 0) {
      throw new InvalidConfigException("topK must be positive, got: " + topK);
    }
    if (method == null) {
      throw new InvalidConfigException("fusion method must not be null");
    }
  }

  /** Reciprocal rank fusion with the given parameters. */
  public FusionConfig(double alpha, int k, int topK) {
    this(alpha, k, topK, FusionMethod.RECIPROCAL_RANK);
  }

  public FusionConfig withTopK(int newTopK) {
    return new FusionConfig(alpha, k, newTopK, method);
  }
}
