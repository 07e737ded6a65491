package dev.shortlist.search;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * BM25 term-overlap scorer over a frozen {@link Corpus}.
 *
 * <p>The index (term frequencies, document frequencies and lengths) is built once at construction
 * and never mutated, so a single instance can score concurrent queries. Inverse document frequency
 * uses the Lucene form {@code ln(1 + (N - df + 0.5) / (df + 0.5))}, which stays positive for terms
 * present in most passages.
 */
public final class LexicalScorer {

  private static final Logger log = LoggerFactory.getLogger(LexicalScorer.class);

  public static final double DEFAULT_K1 = 1.2;
  public static final double DEFAULT_B = 0.75;

  private final double k1;
  private final double b;
  private final List<Map<String, Integer>> termFrequencies;
  private final int[] lengths;
  private final double averageLength;
  private final Map<String, Double> idf;

  public LexicalScorer(Corpus corpus) {
    this(corpus, DEFAULT_K1, DEFAULT_B);
  }

  /**
   * Builds the index.
   *
   * @param corpus the frozen corpus
   * @param k1 term-frequency saturation (must be non-negative)
   * @param b length normalisation in [0, 1]
   */
  public LexicalScorer(Corpus corpus, double k1, double b) {
    if (k1 < 0.0 || Double.isNaN(k1)) {
      throw new InvalidConfigException("BM25 k1 must be non-negative, got: " + k1);
    }
    if (b < 0.0 || b > 1.0 || Double.isNaN(b)) {
      throw new InvalidConfigException("BM25 b must be in [0.0, 1.0], got: " + b);
    }
    if (corpus.size() == 0) {
      throw new CorpusEmptyException(corpus.corpusId());
    }
    this.k1 = k1;
    this.b = b;

    int n = corpus.size();
    List<Map<String, Integer>> frequencies = new ArrayList<>(n);
    this.lengths = new int[n];
    Map<String, Integer> documentFrequencies = new HashMap<>();
    long totalLength = 0;

    for (int i = 0; i < n; i++) {
      List<String> tokens = Tokenizer.tokenize(corpus.get(i).content());
      Map<String, Integer> tf = new HashMap<>();
      for (String token : tokens) {
        tf.merge(token, 1, Integer::sum);
      }
      for (String term : tf.keySet()) {
        documentFrequencies.merge(term, 1, Integer::sum);
      }
      frequencies.add(Map.copyOf(tf));
      lengths[i] = tokens.size();
      totalLength += tokens.size();
    }

    this.termFrequencies = List.copyOf(frequencies);
    this.averageLength = (double) totalLength / n;

    Map<String, Double> idfByTerm = new HashMap<>(documentFrequencies.size() * 2);
    for (Map.Entry<String, Integer> entry : documentFrequencies.entrySet()) {
      double df = entry.getValue();
      idfByTerm.put(entry.getKey(), Math.log(1.0 + (n - df + 0.5) / (df + 0.5)));
    }
    this.idf = Map.copyOf(idfByTerm);

    log.debug(
        "BM25 index built for corpus '{}': {} passages, {} terms, avg length {}",
        corpus.corpusId(),
        n,
        idf.size(),
        averageLength);
  }

  /**
   * Scores every passage against the query. A query without tokens yields an all-zero vector.
   *
   * @param query the query text
   * @return BM25 scores aligned with corpus order
   */
  public ScoreVector score(String query) {
    List<String> queryTokens = Tokenizer.tokenize(query);
    int n = lengths.length;
    if (queryTokens.isEmpty()) {
      return ScoreVector.zeros(n);
    }

    double[] scores = new double[n];
    for (int i = 0; i < n; i++) {
      Map<String, Integer> tf = termFrequencies.get(i);
      double lengthNorm =
          averageLength == 0.0 ? 1.0 : 1.0 - b + b * lengths[i] / averageLength;
      double score = 0.0;
      for (String token : queryTokens) {
        Integer frequency = tf.get(token);
        if (frequency == null) {
          continue;
        }
        score += idf.get(token) * frequency * (k1 + 1.0) / (frequency + k1 * lengthNorm);
      }
      scores[i] = score;
    }
    return ScoreVector.of(scores);
  }
}
