package dev.shortlist.search;

import dev.shortlist.corpus.Passage;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Frozen, ordered view of a corpus for the lifetime of a {@link RetrievalSession}.
 *
 * <p>Passage position is the canonical index used by every {@link ScoreVector}; the passage key is
 * the identity used to align document store results.
 */
public final class Corpus {

  private final String corpusId;
  private final List<Passage> passages;
  private final Map<String, Integer> indexByKey;

  private Corpus(String corpusId, List<Passage> passages, Map<String, Integer> indexByKey) {
    this.corpusId = corpusId;
    this.passages = passages;
    this.indexByKey = indexByKey;
  }

  /**
   * Freezes the passages into a corpus.
   *
   * @throws CorpusEmptyException if there are no passages
   * @throws IllegalArgumentException if a passage id differs from its position or a key repeats
   */
  public static Corpus of(String corpusId, List<Passage> passages) {
    if (passages.isEmpty()) {
      throw new CorpusEmptyException(corpusId);
    }
    Map<String, Integer> indexByKey = new HashMap<>(passages.size() * 2);
    for (int i = 0; i < passages.size(); i++) {
      Passage passage = passages.get(i);
      if (passage.id() != i) {
        throw new IllegalArgumentException(
            "Passage at position " + i + " has id " + passage.id() + " in corpus " + corpusId);
      }
      if (indexByKey.putIfAbsent(passage.key(), i) != null) {
        throw new IllegalArgumentException(
            "Duplicate passage key '" + passage.key() + "' in corpus " + corpusId);
      }
    }
    return new Corpus(corpusId, List.copyOf(passages), Map.copyOf(indexByKey));
  }

  public String corpusId() {
    return corpusId;
  }

  public int size() {
    return passages.size();
  }

  public Passage get(int index) {
    return passages.get(index);
  }

  public List<Passage> passages() {
    return passages;
  }

  /** Index of the passage with the given store key, empty if the key is not in this corpus. */
  public OptionalInt indexOf(String key) {
    Integer index = indexByKey.get(key);
    return index == null ? OptionalInt.empty() : OptionalInt.of(index);
  }
}
