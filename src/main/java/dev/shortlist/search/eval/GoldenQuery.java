package dev.shortlist.search.eval;

import java.util.List;

/**
 * An annotated evaluation query.
 *
 * @param query the natural language query
 * @param relevantKeys keys of the passages judged relevant (absence means not relevant)
 */
public record GoldenQuery(String query, List<String> relevantKeys) {
  public GoldenQuery {
    if (query == null) {
      throw new IllegalArgumentException("Golden query text must not be null");
    }
    relevantKeys = relevantKeys == null ? List.of() : List.copyOf(relevantKeys);
  }
}
