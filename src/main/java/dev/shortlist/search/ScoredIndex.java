package dev.shortlist.search;

/**
 * A corpus index paired with the score that ranked it.
 *
 * @param index position of the passage in the corpus
 * @param score the score of the producing stage (BM25, similarity or fused)
 */
public record ScoredIndex(int index, double score) {}
