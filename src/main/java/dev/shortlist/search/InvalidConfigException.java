package dev.shortlist.search;

/** Raised for out-of-range fusion, reranking or request parameters. */
public class InvalidConfigException extends RetrievalException {

  public InvalidConfigException(String message) {
    super(message);
  }
}
