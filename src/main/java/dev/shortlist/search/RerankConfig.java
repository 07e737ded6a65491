package dev.shortlist.search;

import org.jspecify.annotations.Nullable;

/**
 * Validated reranking parameters.
 *
 * @param enabled whether the fused shortlist is reranked with the relevance model
 * @param finalTopK default number of results when the caller does not ask for a count (null means
 *     the pipeline default)
 * @param onError behaviour when the relevance model fails for a passage
 */
public record RerankConfig(
    boolean enabled, @Nullable Integer finalTopK, RerankErrorPolicy onError) {

  public RerankConfig {
    if (finalTopK != null && finalTopK <= 0) {
      throw new InvalidConfigException("finalTopK must be positive, got: " + finalTopK);
    }
    if (onError == null) {
      throw new InvalidConfigException("rerank error policy must not be null");
    }
  }

  /** Reranking on, pipeline default result count, failing on model errors. */
  public static RerankConfig withReranking() {
    return new RerankConfig(true, null, RerankErrorPolicy.FAIL);
  }

  /** Fused shortlist truncated without calling the relevance model. */
  public static RerankConfig withoutReranking() {
    return new RerankConfig(false, null, RerankErrorPolicy.FAIL);
  }
}
