package dev.shortlist.search;

/** Raised when a retrieval session is opened over a corpus with zero passages. */
public class CorpusEmptyException extends RetrievalException {

  public CorpusEmptyException(String corpusId) {
    super("Corpus '" + corpusId + "' has no passages; retrieval is not possible");
  }
}
