package dev.shortlist.search;

/** How lexical and semantic scores are combined. */
public enum FusionMethod {
  /** Weighted reciprocal rank fusion; insensitive to score scales. */
  RECIPROCAL_RANK,
  /** Convex combination of min-max normalised scores. */
  WEIGHTED_SCORE
}
