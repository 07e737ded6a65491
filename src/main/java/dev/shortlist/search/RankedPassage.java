package dev.shortlist.search;

import dev.shortlist.corpus.Passage;
import org.jspecify.annotations.Nullable;

/**
 * A passage in a ranked result list.
 *
 * @param passage the corpus passage
 * @param score score of the stage that produced the list (BM25, similarity or fused score)
 * @param rerankScore relevance model score (null if the passage was not reranked)
 * @param degraded true if the relevance model failed for this passage and it kept its fused
 *     position
 */
public record RankedPassage(
    Passage passage, double score, @Nullable Double rerankScore, boolean degraded) {

  public RankedPassage(Passage passage, double score) {
    this(passage, score, null, false);
  }

  RankedPassage withRerankScore(double relevance) {
    return new RankedPassage(passage, score, relevance, false);
  }

  RankedPassage asDegraded() {
    return new RankedPassage(passage, score, null, true);
  }
}
