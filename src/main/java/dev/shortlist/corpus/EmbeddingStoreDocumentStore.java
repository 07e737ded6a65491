package dev.shortlist.corpus;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link DocumentStore} backed by a LangChain4j {@link EmbeddingStore} and {@link EmbeddingModel}.
 *
 * <p>Corpora are registered through {@link #index(String, List)}, which embeds the segments, stores
 * them tagged with a {@code corpus_id} metadata entry and remembers their order. Nearest-neighbour
 * queries are scoped to one corpus with a metadata filter. The store reports cosine relevance
 * scores in [0, 1]; they are converted back to cosine distance ({@code 1 - cos}).
 */
@Component
public class EmbeddingStoreDocumentStore implements DocumentStore {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingStoreDocumentStore.class);

  static final String CORPUS_ID_KEY = "corpus_id";

  /**
   * BGE query prefix recommended by the bge-small-en-v1.5 model documentation. Prepended to queries
   * only, never to indexed passages.
   */
  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final EmbeddingModel embeddingModel;
  private final Map<String, List<Passage>> corpora = new ConcurrentHashMap<>();
  private final Set<String> claimedCorpusIds = ConcurrentHashMap.newKeySet();

  public EmbeddingStoreDocumentStore(
      EmbeddingStore<TextSegment> embeddingStore, EmbeddingModel embeddingModel) {
    this.embeddingStore = embeddingStore;
    this.embeddingModel = embeddingModel;
  }

  /**
   * Embeds and stores the segments as a new corpus. Registering an id twice is rejected; corpora
   * are immutable once indexed. The id is claimed before anything is written; a failed
   * registration removes its embeddings and releases the id.
   *
   * @param corpusId the corpus identifier
   * @param segments the passages in corpus order
   * @return the registered passages, ids equal to their position
   * @throws IllegalArgumentException if the corpus id is already indexed or being indexed
   */
  public List<Passage> index(String corpusId, List<TextSegment> segments) {
    if (!claimedCorpusIds.add(corpusId)) {
      throw new IllegalArgumentException("Corpus already indexed: " + corpusId);
    }

    List<TextSegment> tagged = new ArrayList<>(segments.size());
    List<String> ids = new ArrayList<>(segments.size());
    List<Passage> passages = new ArrayList<>(segments.size());
    boolean storing = false;
    try {
      for (int i = 0; i < segments.size(); i++) {
        TextSegment segment = segments.get(i);
        String key = UUID.randomUUID().toString();
        Metadata metadata = segment.metadata().copy().put(CORPUS_ID_KEY, corpusId);
        tagged.add(TextSegment.from(segment.text(), metadata));
        ids.add(key);
        passages.add(new Passage(i, key, segment.text(), segment.metadata().toMap()));
      }

      if (!tagged.isEmpty()) {
        List<Embedding> embeddings = embeddingModel.embedAll(tagged).content();
        storing = true;
        embeddingStore.addAll(ids, embeddings, tagged);
      }
    } catch (RuntimeException e) {
      if (storing) {
        removeAfterFailure(ids, e);
      }
      claimedCorpusIds.remove(corpusId);
      throw e;
    }

    List<Passage> frozen = List.copyOf(passages);
    corpora.put(corpusId, frozen);
    log.info("Indexed corpus '{}' with {} passages", corpusId, frozen.size());
    return frozen;
  }

  private void removeAfterFailure(List<String> ids, RuntimeException failure) {
    try {
      embeddingStore.removeAll(ids);
    } catch (RuntimeException cleanup) {
      failure.addSuppressed(cleanup);
    }
  }

  @Override
  public List<Passage> passages(String corpusId) {
    return corpora.getOrDefault(corpusId, List.of());
  }

  @Override
  public List<NeighborMatch> nearestNeighbors(String corpusId, String query, int count) {
    Embedding queryEmbedding = embeddingModel.embed(BGE_QUERY_PREFIX + query).content();
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .maxResults(count)
            .minScore(0.0)
            .filter(metadataKey(CORPUS_ID_KEY).isEqualTo(corpusId))
            .build();

    List<EmbeddingMatch<TextSegment>> matches = embeddingStore.search(request).matches();
    return matches.stream().map(EmbeddingStoreDocumentStore::toNeighborMatch).toList();
  }

  private static NeighborMatch toNeighborMatch(EmbeddingMatch<TextSegment> match) {
    double cosine = CosineSimilarity.fromRelevanceScore(match.score());
    return new NeighborMatch(match.embeddingId(), match.embedded().text(), 1.0 - cosine);
  }
}
