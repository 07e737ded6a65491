package dev.shortlist.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding model, the relevance model and the vector store beans.
 *
 * <p>Both models run in-process on ONNX Runtime: bge-small-en-v1.5 quantized (384 dimensions) for
 * embeddings and ms-marco-MiniLM-L-6-v2 as the cross-encoder. Corpora live in an in-memory
 * LangChain4j store for the lifetime of the application.
 *
 * @see dev.shortlist.corpus.EmbeddingStoreDocumentStore
 */
@Configuration
public class EmbeddingConfig {

    /**
     * Provides the in-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions).
     *
     * @return a ready-to-use embedding model requiring no external API
     */
    @Bean
    public EmbeddingModel embeddingModel() {
        return new BgeSmallEnV15QuantizedEmbeddingModel();
    }

    /**
     * Provides the in-process ONNX cross-encoder used as the reranker's relevance model.
     *
     * @param modelPath     path to the ONNX model file
     * @param tokenizerPath path to the tokenizer JSON file
     * @return a scoring model returning one relevance score per (query, passage) pair
     */
    @Bean
    public ScoringModel scoringModel(
            @Value("${shortlist.reranker.model-path}") String modelPath,
            @Value("${shortlist.reranker.tokenizer-path}") String tokenizerPath) {
        return new OnnxScoringModel(modelPath, tokenizerPath);
    }

    /**
     * In-memory embedding store; every corpus is tagged with a {@code corpus_id} metadata entry.
     *
     * @return an empty store
     */
    @Bean
    public EmbeddingStore<TextSegment> embeddingStore() {
        return new InMemoryEmbeddingStore<>();
    }
}
