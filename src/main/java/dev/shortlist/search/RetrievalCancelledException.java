package dev.shortlist.search;

/**
 * Raised when a retrieval call exceeds its deadline or its thread is interrupted. Outstanding
 * external calls are cancelled first; no partial result is returned.
 */
public class RetrievalCancelledException extends RetrievalException {

  public RetrievalCancelledException(String message) {
    super(message);
  }

  public RetrievalCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
