package dev.shortlist.search;

/**
 * Raised when a document store result cannot be mapped back to a passage of the session's corpus.
 * Indicates drift between the store and the frozen corpus view.
 */
public class AlignmentFailureException extends RetrievalException {

  public AlignmentFailureException(String message) {
    super(message);
  }
}
