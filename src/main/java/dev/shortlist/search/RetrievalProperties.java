package dev.shortlist.search;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for retrieval sessions.
 *
 * <p>Properties are bound from {@code shortlist.retrieval.*} in application.yml /
 * application.properties.
 *
 * <ul>
 *   <li>{@code alpha} - semantic weight in fusion (0.0 = lexical only, 1.0 = semantic only;
 *       default 0.5)
 *   <li>{@code rrf-k} - reciprocal rank fusion constant (default 60)
 *   <li>{@code fusion-top-k} - minimum fused shortlist size (default 10)
 *   <li>{@code fusion-method} - RECIPROCAL_RANK (default) or WEIGHTED_SCORE
 *   <li>{@code shortlist-multiplier} - shortlist width as a multiple of the requested count
 *       (default 2)
 *   <li>{@code rerank-enabled}, {@code rerank-final-top-k}, {@code rerank-on-error} - reranking
 *       switch, default result count and failure policy (default FAIL)
 *   <li>{@code timeout} - time budget per retrieval call (default 30s)
 *   <li>{@code bm25-k1}, {@code bm25-b} - BM25 parameters (defaults 1.2 and 0.75)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "shortlist.retrieval")
public class RetrievalProperties {

  private double alpha = 0.5;
  private int rrfK = FusionConfig.DEFAULT_K;
  private int fusionTopK = 10;
  private FusionMethod fusionMethod = FusionMethod.RECIPROCAL_RANK;
  private int shortlistMultiplier = RetrievalPipeline.DEFAULT_SHORTLIST_MULTIPLIER;
  private boolean rerankEnabled = true;
  private @Nullable Integer rerankFinalTopK;
  private RerankErrorPolicy rerankOnError = RerankErrorPolicy.FAIL;
  private Duration timeout = Duration.ofSeconds(30);
  private double bm25K1 = LexicalScorer.DEFAULT_K1;
  private double bm25B = LexicalScorer.DEFAULT_B;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    try {
      toFusionConfig();
      toRerankConfig();
    } catch (InvalidConfigException e) {
      throw new IllegalStateException(
          "Invalid shortlist.retrieval configuration: " + e.getMessage(), e);
    }
    if (shortlistMultiplier < 1) {
      throw new IllegalStateException(
          "shortlist.retrieval.shortlist-multiplier must be at least 1, got: "
              + shortlistMultiplier);
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalStateException(
          "shortlist.retrieval.timeout must be positive, got: " + timeout);
    }
    if (bm25K1 < 0.0) {
      throw new IllegalStateException("shortlist.retrieval.bm25-k1 must be >= 0, got: " + bm25K1);
    }
    if (bm25B < 0.0 || bm25B > 1.0) {
      throw new IllegalStateException(
          "shortlist.retrieval.bm25-b must be in [0.0, 1.0], got: " + bm25B);
    }
  }

  public FusionConfig toFusionConfig() {
    return new FusionConfig(alpha, rrfK, fusionTopK, fusionMethod);
  }

  public RerankConfig toRerankConfig() {
    return new RerankConfig(rerankEnabled, rerankFinalTopK, rerankOnError);
  }

  public double getAlpha() {
    return alpha;
  }

  public void setAlpha(double alpha) {
    this.alpha = alpha;
  }

  public int getRrfK() {
    return rrfK;
  }

  public void setRrfK(int rrfK) {
    this.rrfK = rrfK;
  }

  public int getFusionTopK() {
    return fusionTopK;
  }

  public void setFusionTopK(int fusionTopK) {
    this.fusionTopK = fusionTopK;
  }

  public FusionMethod getFusionMethod() {
    return fusionMethod;
  }

  public void setFusionMethod(FusionMethod fusionMethod) {
    this.fusionMethod = fusionMethod;
  }

  public int getShortlistMultiplier() {
    return shortlistMultiplier;
  }

  public void setShortlistMultiplier(int shortlistMultiplier) {
    this.shortlistMultiplier = shortlistMultiplier;
  }

  public boolean isRerankEnabled() {
    return rerankEnabled;
  }

  public void setRerankEnabled(boolean rerankEnabled) {
    this.rerankEnabled = rerankEnabled;
  }

  public @Nullable Integer getRerankFinalTopK() {
    return rerankFinalTopK;
  }

  public void setRerankFinalTopK(@Nullable Integer rerankFinalTopK) {
    this.rerankFinalTopK = rerankFinalTopK;
  }

  public RerankErrorPolicy getRerankOnError() {
    return rerankOnError;
  }

  public void setRerankOnError(RerankErrorPolicy rerankOnError) {
    this.rerankOnError = rerankOnError;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public double getBm25K1() {
    return bm25K1;
  }

  public void setBm25K1(double bm25K1) {
    this.bm25K1 = bm25K1;
  }

  public double getBm25B() {
    return bm25B;
  }

  public void setBm25B(double bm25B) {
    this.bm25B = bm25B;
  }
}
