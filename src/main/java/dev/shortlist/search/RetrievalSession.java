package dev.shortlist.search;

import dev.shortlist.corpus.DocumentStore;
import dev.shortlist.corpus.Passage;
import java.util.List;

/**
 * Everything a retrieval call reads: the frozen corpus, its BM25 index, the semantic scorer bound
 * to the corpus, and the fusion and reranking configuration.
 *
 * <p>A session is built once and is immutable afterwards, so one instance serves concurrent
 * queries. Per-query state lives only inside {@link RetrievalPipeline} calls.
 */
public final class RetrievalSession {

  private final Corpus corpus;
  private final LexicalScorer lexicalScorer;
  private final SemanticScorer semanticScorer;
  private final FusionConfig fusionConfig;
  private final RerankConfig rerankConfig;

  private RetrievalSession(
      Corpus corpus,
      LexicalScorer lexicalScorer,
      SemanticScorer semanticScorer,
      FusionConfig fusionConfig,
      RerankConfig rerankConfig) {
    this.corpus = corpus;
    this.lexicalScorer = lexicalScorer;
    this.semanticScorer = semanticScorer;
    this.fusionConfig = fusionConfig;
    this.rerankConfig = rerankConfig;
  }

  /** Opens a session with default BM25 parameters. */
  public static RetrievalSession open(
      String corpusId,
      List<Passage> passages,
      DocumentStore documentStore,
      FusionConfig fusionConfig,
      RerankConfig rerankConfig) {
    return open(
        corpusId,
        passages,
        documentStore,
        fusionConfig,
        rerankConfig,
        LexicalScorer.DEFAULT_K1,
        LexicalScorer.DEFAULT_B);
  }

  /**
   * Freezes the passages and builds the BM25 index.
   *
   * @throws CorpusEmptyException if there are no passages
   */
  public static RetrievalSession open(
      String corpusId,
      List<Passage> passages,
      DocumentStore documentStore,
      FusionConfig fusionConfig,
      RerankConfig rerankConfig,
      double bm25K1,
      double bm25B) {
    Corpus corpus = Corpus.of(corpusId, passages);
    return new RetrievalSession(
        corpus,
        new LexicalScorer(corpus, bm25K1, bm25B),
        new SemanticScorer(corpus, documentStore),
        fusionConfig,
        rerankConfig);
  }

  public Corpus corpus() {
    return corpus;
  }

  public LexicalScorer lexicalScorer() {
    return lexicalScorer;
  }

  public SemanticScorer semanticScorer() {
    return semanticScorer;
  }

  public FusionConfig fusionConfig() {
    return fusionConfig;
  }

  public RerankConfig rerankConfig() {
    return rerankConfig;
  }
}
