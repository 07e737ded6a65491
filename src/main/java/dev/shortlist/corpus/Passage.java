package dev.shortlist.corpus;

import java.util.Map;

/**
 * A text passage of a frozen corpus.
 *
 * @param id position of the passage in its corpus; the canonical index used to align scores
 * @param key stable identity assigned by the document store, used to map store results back onto
 *     the corpus
 * @param content the passage text
 * @param metadata immutable key-value metadata (e.g. source file, page)
 */
public record Passage(int id, String key, String content, Map<String, Object> metadata) {

  public Passage {
    if (id < 0) {
      throw new IllegalArgumentException("Passage id must not be negative, got: " + id);
    }
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Passage key must not be blank");
    }
    if (content == null) {
      throw new IllegalArgumentException("Passage content must not be null");
    }
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /** Convenience constructor for passages without metadata. */
  public Passage(int id, String key, String content) {
    this(id, key, content, Map.of());
  }
}
