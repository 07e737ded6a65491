package dev.shortlist.search;

/** What the reranker does when the relevance model fails for a passage. */
public enum RerankErrorPolicy {
  /** Fail the whole rerank call. */
  FAIL,
  /** Keep the failed passage at its fused position and flag it as degraded. */
  FALLBACK_TO_FUSED_ORDER
}
