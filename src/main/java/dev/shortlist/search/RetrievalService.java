package dev.shortlist.search;

import dev.langchain4j.model.scoring.ScoringModel;
import dev.shortlist.corpus.DocumentStore;
import dev.shortlist.corpus.Passage;
import java.util.List;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Opens retrieval sessions over corpora held by the configured {@link DocumentStore}.
 *
 * <p>Each call loads and freezes the corpus, builds its BM25 index and returns a {@link
 * RetrievalPipeline} bound to it. Sessions share the relevance model and the retrieval executor
 * but nothing else; callers keep the returned pipeline for as long as the corpus is in use.
 */
@Service
public class RetrievalService {

  private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

  private final DocumentStore documentStore;
  private final ScoringModel scoringModel;
  private final ExecutorService retrievalExecutor;
  private final RetrievalProperties properties;

  public RetrievalService(
      DocumentStore documentStore,
      ScoringModel scoringModel,
      ExecutorService retrievalExecutor,
      RetrievalProperties properties) {
    this.documentStore = documentStore;
    this.scoringModel = scoringModel;
    this.retrievalExecutor = retrievalExecutor;
    this.properties = properties;
  }

  /**
   * Opens a session over the given corpus.
   *
   * @param corpusId the corpus identifier known to the document store
   * @return a pipeline bound to the frozen corpus
   * @throws CorpusEmptyException if the store holds no passages for the corpus
   * @throws ExternalServiceException if the store cannot be read
   */
  public RetrievalPipeline open(String corpusId) {
    List<Passage> passages;
    try {
      passages = documentStore.passages(corpusId);
    } catch (RuntimeException e) {
      throw new ExternalServiceException("Failed to load corpus '" + corpusId + "'", e);
    }

    FusionConfig fusionConfig = properties.toFusionConfig();
    RerankConfig rerankConfig = properties.toRerankConfig();
    RetrievalSession session =
        RetrievalSession.open(
            corpusId,
            passages,
            documentStore,
            fusionConfig,
            rerankConfig,
            properties.getBm25K1(),
            properties.getBm25B());

    log.info(
        "Opened retrieval session for corpus '{}': {} passages, alpha={}, k={}, method={}, "
            + "rerank={}",
        corpusId,
        session.corpus().size(),
        fusionConfig.alpha(),
        fusionConfig.k(),
        fusionConfig.method(),
        rerankConfig.enabled());

    Reranker reranker = new Reranker(scoringModel, retrievalExecutor, rerankConfig.onError());
    return new RetrievalPipeline(
        session,
        reranker,
        retrievalExecutor,
        properties.getShortlistMultiplier(),
        properties.getTimeout());
  }
}
