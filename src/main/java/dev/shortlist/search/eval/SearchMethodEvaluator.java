package dev.shortlist.search.eval;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.shortlist.search.RankedPassage;
import dev.shortlist.search.RetrievalPipeline;
import dev.shortlist.search.SearchComparison;
import dev.shortlist.search.SearchMethod;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

/**
 * Offline comparison of lexical, semantic and hybrid retrieval against a golden set.
 *
 * <p>Each golden query is run through {@link RetrievalPipeline#compareSearchMethods}; the three
 * result lists are scored with {@link RetrievalMetrics} and averaged per strategy.
 */
@Service
public class SearchMethodEvaluator {

  private static final Logger log = LoggerFactory.getLogger(SearchMethodEvaluator.class);

  private final ObjectMapper objectMapper;

  public SearchMethodEvaluator(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Loads a golden set from the classpath. Format: {@code [{"query": "...", "relevantKeys":
   * ["..."]}]}.
   *
   * @param location classpath location of the JSON file
   * @throws IOException if the file is missing or malformed
   */
  public List<GoldenQuery> loadGoldenSet(String location) throws IOException {
    ClassPathResource resource = new ClassPathResource(location);
    try (InputStream is = resource.getInputStream()) {
      return objectMapper.readValue(is, new TypeReference<List<GoldenQuery>>() {});
    }
  }

  /**
   * Evaluates the three strategies of a pipeline at depth k.
   *
   * @param pipeline the session to evaluate
   * @param goldenSet annotated queries
   * @param k evaluation depth, also the number of results requested per strategy
   * @return mean metrics per strategy
   */
  public EvaluationSummary evaluate(
      RetrievalPipeline pipeline, List<GoldenQuery> goldenSet, int k) {
    Map<SearchMethod, List<RetrievalMetrics.MetricsResult>> perQuery =
        new EnumMap<>(SearchMethod.class);
    for (SearchMethod method : SearchMethod.values()) {
      perQuery.put(method, new ArrayList<>(goldenSet.size()));
    }

    for (GoldenQuery golden : goldenSet) {
      SearchComparison comparison = pipeline.compareSearchMethods(golden.query(), k);
      Set<String> relevant = new HashSet<>(golden.relevantKeys());
      for (SearchMethod method : SearchMethod.values()) {
        List<String> keys = keys(comparison.results(method));
        perQuery.get(method).add(RetrievalMetrics.computeAll(keys, relevant, k));
      }
    }

    Map<SearchMethod, RetrievalMetrics.MetricsResult> byMethod = new EnumMap<>(SearchMethod.class);
    for (Map.Entry<SearchMethod, List<RetrievalMetrics.MetricsResult>> entry :
        perQuery.entrySet()) {
      RetrievalMetrics.MetricsResult mean = RetrievalMetrics.average(entry.getValue());
      byMethod.put(entry.getKey(), mean);
      log.info(
          "Evaluation {}@{} over {} queries: recall={}, precision={}, mrr={}, ndcg={}, hitRate={}",
          entry.getKey(),
          k,
          goldenSet.size(),
          mean.recallAtK(),
          mean.precisionAtK(),
          mean.mrr(),
          mean.ndcgAtK(),
          mean.hitRate());
    }
    return new EvaluationSummary(goldenSet.size(), k, byMethod);
  }

  private static List<String> keys(List<RankedPassage> results) {
    return results.stream().map(r -> r.passage().key()).toList();
  }
}
