package dev.shortlist.search;

import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.shortlist.corpus.Passage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cross-encoder reranking of a fused shortlist.
 *
 * <p>Each (query, passage) pair is scored by the relevance model in its own call, all calls running
 * on the shared retrieval executor. The shortlist is then sorted by relevance score descending;
 * ties keep their shortlist order.
 *
 * <p>Model failures follow the configured {@link RerankErrorPolicy}: either the call fails, or the
 * affected passages keep their fused position and are flagged as degraded. A failed pair is never
 * silently scored as 0. Deadline expiry and interruption always cancel the outstanding calls and
 * raise {@link RetrievalCancelledException}.
 *
 * @see dev.langchain4j.model.scoring.ScoringModel
 */
public class Reranker {

  private static final Logger log = LoggerFactory.getLogger(Reranker.class);

  private final ScoringModel scoringModel;
  private final ExecutorService executor;
  private final RerankErrorPolicy errorPolicy;

  public Reranker(
      ScoringModel scoringModel, ExecutorService executor, RerankErrorPolicy errorPolicy) {
    this.scoringModel = scoringModel;
    this.executor = executor;
    this.errorPolicy = errorPolicy;
  }

  /** Reranks without a time limit. */
  public List<RankedPassage> rerank(
      String query, List<RankedPassage> shortlist, @Nullable Integer finalTopK) {
    return rerank(query, shortlist, finalTopK, Deadline.none());
  }

  /**
   * Reranks the shortlist with the relevance model.
   *
   * @param query the original query text
   * @param shortlist fused candidates, best first
   * @param finalTopK maximum number of results (null means the whole shortlist)
   * @param deadline time budget for all relevance model calls
   * @return the shortlist members sorted by relevance score descending, truncated to finalTopK
   * @throws ExternalServiceException if the model fails and the policy is {@link
   *     RerankErrorPolicy#FAIL}
   * @throws RetrievalCancelledException if the deadline expires or the thread is interrupted
   */
  public List<RankedPassage> rerank(
      String query,
      List<RankedPassage> shortlist,
      @Nullable Integer finalTopK,
      Deadline deadline) {
    if (finalTopK != null && finalTopK <= 0) {
      throw new InvalidConfigException("finalTopK must be positive, got: " + finalTopK);
    }
    if (shortlist.isEmpty()) {
      return List.of();
    }

    List<Future<Double>> futures = invokeAll(query, shortlist, deadline);

    int n = shortlist.size();
    double[] relevance = new double[n];
    Throwable[] failures = new Throwable[n];
    int failureCount = 0;
    for (int i = 0; i < n; i++) {
      try {
        relevance[i] = futures.get(i).get();
      } catch (CancellationException e) {
        cancelAll(futures);
        throw new RetrievalCancelledException(
            "Reranking exceeded its deadline with pairs still outstanding", e);
      } catch (InterruptedException e) {
        cancelAll(futures);
        Thread.currentThread().interrupt();
        throw new RetrievalCancelledException("Reranking was interrupted", e);
      } catch (ExecutionException e) {
        failures[i] = e.getCause() != null ? e.getCause() : e;
        failureCount++;
      }
    }

    if (failureCount > 0) {
      if (errorPolicy == RerankErrorPolicy.FAIL) {
        int first = firstFailure(failures);
        throw new ExternalServiceException(
            "Relevance model failed for passage '"
                + shortlist.get(first).passage().key()
                + "' ("
                + failureCount
                + " of "
                + n
                + " pairs failed)",
            failures[first]);
      }
      log.warn(
          "Relevance model failed for {} of {} passages; keeping their fused positions",
          failureCount,
          n);
    }

    List<RankedPassage> reranked = assemble(shortlist, relevance, failures);
    int limit = finalTopK == null ? n : Math.min(finalTopK, n);
    return List.copyOf(reranked.subList(0, limit));
  }

  private List<Future<Double>> invokeAll(
      String query, List<RankedPassage> shortlist, Deadline deadline) {
    List<Callable<Double>> calls = new ArrayList<>(shortlist.size());
    for (RankedPassage candidate : shortlist) {
      Passage passage = candidate.passage();
      calls.add(() -> scorePair(query, passage));
    }
    try {
      if (deadline.isUnbounded()) {
        return executor.invokeAll(calls);
      }
      return executor.invokeAll(calls, deadline.remainingNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RetrievalCancelledException("Reranking was interrupted", e);
    }
  }

  private double scorePair(String query, Passage passage) {
    Response<Double> response = scoringModel.score(passage.content(), query);
    Double score = response == null ? null : response.content();
    if (score == null || score.isNaN()) {
      throw new ExternalServiceException(
          "Relevance model returned no score for passage '" + passage.key() + "'");
    }
    return score;
  }

  /**
   * Places degraded passages at their shortlist position and fills the remaining positions with the
   * scored passages in relevance order.
   */
  private static List<RankedPassage> assemble(
      List<RankedPassage> shortlist, double[] relevance, Throwable[] failures) {
    List<Integer> scored = new ArrayList<>(shortlist.size());
    for (int i = 0; i < shortlist.size(); i++) {
      if (failures[i] == null) {
        scored.add(i);
      }
    }
    // List.sort is stable: equal relevance keeps shortlist order
    scored.sort(Comparator.comparingDouble((Integer i) -> relevance[i]).reversed());

    List<RankedPassage> result = new ArrayList<>(shortlist.size());
    Iterator<Integer> next = scored.iterator();
    for (int position = 0; position < shortlist.size(); position++) {
      if (failures[position] != null) {
        result.add(shortlist.get(position).asDegraded());
      } else {
        int i = next.next();
        result.add(shortlist.get(i).withRerankScore(relevance[i]));
      }
    }
    return result;
  }

  private static int firstFailure(Throwable[] failures) {
    for (int i = 0; i < failures.length; i++) {
      if (failures[i] != null) {
        return i;
      }
    }
    throw new IllegalStateException("No failure recorded");
  }

  private static void cancelAll(List<Future<Double>> futures) {
    for (Future<Double> future : futures) {
      future.cancel(true);
    }
  }
}
