package dev.shortlist.search;

import java.util.List;

/**
 * Results of the three retrieval strategies for one query.
 *
 * @param query the query text
 * @param lexicalOnly top passages by BM25 score
 * @param semanticOnly top passages by embedding similarity
 * @param hybridReranked fused (and reranked, if enabled) passages
 */
public record SearchComparison(
    String query,
    List<RankedPassage> lexicalOnly,
    List<RankedPassage> semanticOnly,
    List<RankedPassage> hybridReranked) {

  public SearchComparison {
    lexicalOnly = List.copyOf(lexicalOnly);
    semanticOnly = List.copyOf(semanticOnly);
    hybridReranked = List.copyOf(hybridReranked);
  }

  public List<RankedPassage> results(SearchMethod method) {
    return switch (method) {
      case LEXICAL_ONLY -> lexicalOnly;
      case SEMANTIC_ONLY -> semanticOnly;
      case HYBRID_RERANKED -> hybridReranked;
    };
  }
}
