package dev.shortlist.search;

import dev.shortlist.corpus.DocumentStore;
import dev.shortlist.corpus.NeighborMatch;
import java.util.List;
import java.util.OptionalInt;

/**
 * Adapts the document store's nearest-neighbour search into a full, corpus-aligned score vector.
 *
 * <p>Every passage is requested so that fusion sees a score for the whole corpus. Distances are
 * mapped to similarities with {@code 1 / (1 + distance)}; results are placed by their stable key
 * and the vector is scaled to a maximum of 1.
 */
public final class SemanticScorer {

  private final Corpus corpus;
  private final DocumentStore documentStore;

  public SemanticScorer(Corpus corpus, DocumentStore documentStore) {
    this.corpus = corpus;
    this.documentStore = documentStore;
  }

  /**
   * Scores every passage by embedding similarity to the query.
   *
   * @param query the query text
   * @return similarities in [0, 1] aligned with corpus order; passages the store did not return
   *     score 0
   * @throws ExternalServiceException if the document store call fails
   * @throws AlignmentFailureException if the store returns a passage unknown to the corpus
   */
  public ScoreVector score(String query) {
    List<NeighborMatch> matches;
    try {
      matches = documentStore.nearestNeighbors(corpus.corpusId(), query, corpus.size());
    } catch (RuntimeException e) {
      throw new ExternalServiceException(
          "Nearest-neighbour search failed for corpus '" + corpus.corpusId() + "'", e);
    }
    if (matches == null) {
      throw new ExternalServiceException(
          "Document store returned no result for corpus '" + corpus.corpusId() + "'");
    }

    double[] similarities = new double[corpus.size()];
    for (NeighborMatch match : matches) {
      OptionalInt index = corpus.indexOf(match.key());
      if (index.isEmpty()) {
        throw new AlignmentFailureException(
            "Document store returned passage '"
                + match.key()
                + "' which is not part of corpus '"
                + corpus.corpusId()
                + "'");
      }
      if (Double.isNaN(match.distance())) {
        throw new ExternalServiceException(
            "Document store returned no distance for passage '" + match.key() + "'");
      }
      double similarity = 1.0 / (1.0 + Math.max(0.0, match.distance()));
      int i = index.getAsInt();
      similarities[i] = Math.max(similarities[i], similarity);
    }
    return ScoreVector.of(similarities).normalizedToMax();
  }
}
