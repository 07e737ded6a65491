package dev.shortlist.search;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of a retrieval session: hybrid retrieval with optional cross-encoder reranking, and
 * a side-by-side comparison of lexical, semantic and hybrid results.
 *
 * <p>Pipeline: semantic scoring is submitted to the retrieval executor while BM25 scoring runs on
 * the calling thread -> both vectors are fused -> the fused shortlist (wider than the requested
 * count) is reranked if enabled, otherwise truncated.
 */
public class RetrievalPipeline {

  private static final Logger log = LoggerFactory.getLogger(RetrievalPipeline.class);

  /** Result count when neither the caller nor the rerank configuration asks for one. */
  static final int DEFAULT_FINAL_TOP_K = 5;

  /** Shortlist width relative to the requested result count. */
  static final int DEFAULT_SHORTLIST_MULTIPLIER = 2;

  private final RetrievalSession session;
  private final Reranker reranker;
  private final ExecutorService executor;
  private final int shortlistMultiplier;
  private final @Nullable Duration timeout;

  public RetrievalPipeline(RetrievalSession session, Reranker reranker, ExecutorService executor) {
    this(session, reranker, executor, DEFAULT_SHORTLIST_MULTIPLIER, null);
  }

  /**
   * @param shortlistMultiplier fused shortlist width as a multiple of the requested count
   * @param timeout default time budget per call (null means unbounded)
   */
  public RetrievalPipeline(
      RetrievalSession session,
      Reranker reranker,
      ExecutorService executor,
      int shortlistMultiplier,
      @Nullable Duration timeout) {
    if (shortlistMultiplier < 1) {
      throw new InvalidConfigException(
          "shortlistMultiplier must be at least 1, got: " + shortlistMultiplier);
    }
    this.session = session;
    this.reranker = reranker;
    this.executor = executor;
    this.shortlistMultiplier = shortlistMultiplier;
    this.timeout = timeout;
  }

  public RetrievalSession session() {
    return session;
  }

  /** Retrieves the configured default number of passages. */
  public List<RankedPassage> retrieveAndRank(String query) {
    Integer configured = session.rerankConfig().finalTopK();
    return retrieveAndRank(query, configured != null ? configured : DEFAULT_FINAL_TOP_K);
  }

  /**
   * Retrieves the most relevant passages within the default time budget.
   *
   * @param query the query text
   * @param finalTopK number of passages to return (must be positive)
   * @return passages best first
   */
  public List<RankedPassage> retrieveAndRank(String query, int finalTopK) {
    return retrieveAndRank(query, finalTopK, defaultDeadline());
  }

  /**
   * Retrieves the most relevant passages within the given time budget.
   *
   * @throws RetrievalCancelledException if the budget is exhausted before the result is complete
   */
  public List<RankedPassage> retrieveAndRank(String query, int finalTopK, Duration callTimeout) {
    return retrieveAndRank(query, finalTopK, Deadline.after(callTimeout));
  }

  private List<RankedPassage> retrieveAndRank(String query, int finalTopK, Deadline deadline) {
    requirePositive(finalTopK);
    long started = System.nanoTime();

    Future<ScoreVector> semanticFuture =
        executor.submit(() -> session.semanticScorer().score(query));
    ScoreVector lexical;
    try {
      lexical = session.lexicalScorer().score(query);
    } catch (RuntimeException e) {
      semanticFuture.cancel(true);
      throw e;
    }
    ScoreVector semantic = await(semanticFuture, deadline);

    FusionConfig fusion = session.fusionConfig().withTopK(shortlistSize(finalTopK));
    List<RankedPassage> shortlist = toRanked(RankFuser.fuse(lexical, semantic, fusion));

    List<RankedPassage> results;
    if (session.rerankConfig().enabled()) {
      results = reranker.rerank(query, shortlist, finalTopK, deadline);
    } else {
      results = List.copyOf(shortlist.subList(0, Math.min(finalTopK, shortlist.size())));
    }

    log.debug(
        "Retrieved {} of {} shortlisted passages from corpus '{}' in {} ms (rerank={})",
        results.size(),
        shortlist.size(),
        session.corpus().corpusId(),
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started),
        session.rerankConfig().enabled());
    return results;
  }

  /**
   * Runs lexical-only, semantic-only and hybrid retrieval independently for the same query, all
   * three within one default time budget.
   *
   * @param query the query text
   * @param topK number of passages per strategy (must be positive)
   * @return the three result lists
   * @throws RetrievalCancelledException if the budget is exhausted before all three are complete
   */
  public SearchComparison compareSearchMethods(String query, int topK) {
    requirePositive(topK);
    Deadline deadline = defaultDeadline();

    Future<ScoreVector> semanticFuture =
        executor.submit(() -> session.semanticScorer().score(query));
    List<RankedPassage> lexicalOnly;
    try {
      lexicalOnly = toRanked(session.lexicalScorer().score(query).top(topK));
    } catch (RuntimeException e) {
      semanticFuture.cancel(true);
      throw e;
    }
    List<RankedPassage> semanticOnly = toRanked(await(semanticFuture, deadline).top(topK));
    List<RankedPassage> hybrid = retrieveAndRank(query, topK, deadline);
    return new SearchComparison(query, lexicalOnly, semanticOnly, hybrid);
  }

  int shortlistSize(int finalTopK) {
    long widened = (long) finalTopK * shortlistMultiplier;
    return (int) Math.max(session.fusionConfig().topK(), Math.min(widened, Integer.MAX_VALUE));
  }

  private ScoreVector await(Future<ScoreVector> future, Deadline deadline) {
    try {
      if (deadline.isUnbounded()) {
        return future.get();
      }
      return future.get(deadline.remainingNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new RetrievalCancelledException("Semantic scoring exceeded its deadline", e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new RetrievalCancelledException("Semantic scoring was interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RetrievalException retrievalException) {
        throw retrievalException;
      }
      throw new ExternalServiceException("Semantic scoring failed", cause != null ? cause : e);
    }
  }

  private List<RankedPassage> toRanked(List<ScoredIndex> ranking) {
    List<RankedPassage> ranked = new ArrayList<>(ranking.size());
    for (ScoredIndex scored : ranking) {
      ranked.add(new RankedPassage(session.corpus().get(scored.index()), scored.score()));
    }
    return ranked;
  }

  private Deadline defaultDeadline() {
    return timeout == null ? Deadline.none() : Deadline.after(timeout);
  }

  private static void requirePositive(int count) {
    if (count <= 0) {
      throw new InvalidConfigException("finalTopK must be positive, got: " + count);
    }
  }
}
