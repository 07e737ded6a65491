package dev.shortlist.search;

/**
 * Base type of all failures raised by the retrieval engine. Every subtype is surfaced to the
 * immediate caller; the engine never degrades to a different strategy on its own.
 */
public abstract class RetrievalException extends RuntimeException {

  protected RetrievalException(String message) {
    super(message);
  }

  protected RetrievalException(String message, Throwable cause) {
    super(message, cause);
  }
}
