package dev.shortlist.search;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable per-passage scores for one query, aligned with corpus order.
 *
 * <p>Ordering helpers sort by descending score and break ties by ascending corpus index, so every
 * ranking derived from a vector is deterministic.
 */
public final class ScoreVector {

  private final double[] scores;

  private ScoreVector(double[] scores) {
    this.scores = scores;
  }

  public static ScoreVector of(double... scores) {
    return new ScoreVector(scores.clone());
  }

  public static ScoreVector zeros(int size) {
    return new ScoreVector(new double[size]);
  }

  public int size() {
    return scores.length;
  }

  public double get(int index) {
    return scores[index];
  }

  public double max() {
    return Arrays.stream(scores).max().orElse(0.0);
  }

  public double min() {
    return Arrays.stream(scores).min().orElse(0.0);
  }

  public boolean isAllZero() {
    return Arrays.stream(scores).allMatch(s -> s == 0.0);
  }

  /** Returns a copy scaled to a maximum of 1; unchanged if the maximum is not positive. */
  public ScoreVector normalizedToMax() {
    double max = max();
    if (max <= 0.0) {
      return this;
    }
    double[] scaled = new double[scores.length];
    for (int i = 0; i < scores.length; i++) {
      scaled[i] = scores[i] / max;
    }
    return new ScoreVector(scaled);
  }

  /** Rank of every passage (0 = best), indexed by corpus position. */
  public int[] ranks() {
    List<Integer> order = order(scores);
    int[] ranks = new int[scores.length];
    for (int rank = 0; rank < order.size(); rank++) {
      ranks[order.get(rank)] = rank;
    }
    return ranks;
  }

  /** The {@code k} best passages, best first. */
  public List<ScoredIndex> top(int k) {
    List<Integer> order = order(scores);
    int limit = Math.min(k, order.size());
    List<ScoredIndex> top = new ArrayList<>(limit);
    for (int i = 0; i < limit; i++) {
      int index = order.get(i);
      top.add(new ScoredIndex(index, scores[index]));
    }
    return top;
  }

  public double[] toArray() {
    return scores.clone();
  }

  /** Indices sorted by descending value, ties by ascending index. */
  static List<Integer> order(double[] values) {
    List<Integer> indices = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      indices.add(i);
    }
    indices.sort(
        Comparator.comparingDouble((Integer i) -> values[i])
            .reversed()
            .thenComparingInt(Integer::intValue));
    return indices;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ScoreVector other && Arrays.equals(scores, other.scores);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(scores);
  }

  @Override
  public String toString() {
    return "ScoreVector" + Arrays.toString(scores);
  }
}
