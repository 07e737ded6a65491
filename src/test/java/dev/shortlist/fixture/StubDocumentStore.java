package dev.shortlist.fixture;

import dev.shortlist.corpus.DocumentStore;
import dev.shortlist.corpus.NeighborMatch;
import dev.shortlist.corpus.Passage;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.ToDoubleBiFunction;

/**
 * In-memory {@link DocumentStore} for tests.
 *
 * <p>By default the distance of a passage is the fraction of distinct query words it does not
 * contain, so passages sharing more words with the query are closer. Tests can replace the distance
 * function to model any embedding geometry.
 */
public final class StubDocumentStore implements DocumentStore {

  private final Map<String, List<Passage>> corpora = new ConcurrentHashMap<>();
  private final AtomicInteger nearestNeighborCalls = new AtomicInteger();
  private volatile ToDoubleBiFunction<String, Passage> distance = StubDocumentStore::missingWords;

  public StubDocumentStore corpus(String corpusId, List<Passage> passages) {
    corpora.put(corpusId, List.copyOf(passages));
    return this;
  }

  public StubDocumentStore distance(ToDoubleBiFunction<String, Passage> distance) {
    this.distance = distance;
    return this;
  }

  /** Fixed distance per passage key, regardless of the query; unknown keys are at distance 10. */
  public StubDocumentStore distances(Map<String, Double> distanceByKey) {
    Map<String, Double> copy = new HashMap<>(distanceByKey);
    return distance((query, passage) -> copy.getOrDefault(passage.key(), 10.0));
  }

  public int nearestNeighborCalls() {
    return nearestNeighborCalls.get();
  }

  @Override
  public List<Passage> passages(String corpusId) {
    return corpora.getOrDefault(corpusId, List.of());
  }

  @Override
  public List<NeighborMatch> nearestNeighbors(String corpusId, String query, int count) {
    nearestNeighborCalls.incrementAndGet();
    ToDoubleBiFunction<String, Passage> current = distance;
    return passages(corpusId).stream()
        .map(p -> new NeighborMatch(p.key(), p.content(), current.applyAsDouble(query, p)))
        // stable sort: equal distances keep corpus order
        .sorted(Comparator.comparingDouble(NeighborMatch::distance))
        .limit(count)
        .toList();
  }

  private static double missingWords(String query, Passage passage) {
    Set<String> queryWords = words(query);
    if (queryWords.isEmpty()) {
      return 1.0;
    }
    Set<String> passageWords = words(passage.content());
    long missing = queryWords.stream().filter(w -> !passageWords.contains(w)).count();
    return (double) missing / queryWords.size();
  }

  private static Set<String> words(String text) {
    Set<String> words = new HashSet<>();
    for (String word : text.toLowerCase(Locale.ROOT).split("\\W+")) {
      if (!word.isEmpty()) {
        words.add(word);
      }
    }
    return words;
  }
}
