package dev.shortlist.search;

/** Raised when the document store or the relevance model fails. Never retried by the engine. */
public class ExternalServiceException extends RetrievalException {

  public ExternalServiceException(String message) {
    super(message);
  }

  public ExternalServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
