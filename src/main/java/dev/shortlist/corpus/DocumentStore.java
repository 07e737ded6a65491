package dev.shortlist.corpus;

import java.util.List;

/**
 * Port to the external document store holding the embedded corpus.
 *
 * <p>Implementations must return a stable passage identity with every nearest-neighbour hit so
 * that results can be aligned to the corpus without comparing text.
 */
public interface DocumentStore {

  /**
   * Returns the ordered passages of a corpus. Passage ids must equal their list position.
   *
   * @param corpusId the corpus identifier
   * @return the passages in corpus order, empty if the corpus is unknown
   */
  List<Passage> passages(String corpusId);

  /**
   * Returns the {@code count} passages closest to the query by embedding distance, closest first.
   *
   * @param corpusId the corpus identifier
   * @param query the query text
   * @param count the number of neighbours requested (may equal the corpus size)
   * @return nearest neighbours with their keys and distances
   */
  List<NeighborMatch> nearestNeighbors(String corpusId, String query, int count);
}
