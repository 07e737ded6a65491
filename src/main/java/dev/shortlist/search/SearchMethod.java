package dev.shortlist.search;

/** Retrieval strategies reported side by side by {@link RetrievalPipeline#compareSearchMethods}. */
public enum SearchMethod {
  LEXICAL_ONLY,
  SEMANTIC_ONLY,
  HYBRID_RERANKED
}
