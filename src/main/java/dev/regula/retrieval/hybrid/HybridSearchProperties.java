package dev.regula.retrieval.hybrid;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the hybrid backend, bound from {@code regula.hybrid.*}.
 *
 * <ul>
 *   <li>{@code alpha} - weight of the vector signal in the convex combination (default 0.7)
 *   <li>{@code candidates} - candidates fetched from each signal before fusion (default 30,
 *       bounded [10, 200])
 *   <li>{@code keyword-half-rank} - {@code ts_rank} that calibrates to 0.5 (default 0.1)
 *   <li>{@code min-vector-score} - minimum cosine relevance kept from the vector store (default
 *       0.0)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "regula.hybrid")
public class HybridSearchProperties {

  private double alpha = 0.7;
  private int candidates = 30;
  private double keywordHalfRank = 0.1;
  private double minVectorScore = 0.0;

  @PostConstruct
  void validate() {
    if (alpha < 0.0 || alpha > 1.0) {
      throw new IllegalStateException("regula.hybrid.alpha must be in [0.0, 1.0], got: " + alpha);
    }
    if (candidates < 10 || candidates > 200) {
      throw new IllegalStateException(
          "regula.hybrid.candidates must be in [10, 200], got: " + candidates);
    }
    if (keywordHalfRank <= 0.0) {
      throw new IllegalStateException(
          "regula.hybrid.keyword-half-rank must be > 0, got: " + keywordHalfRank);
    }
    if (minVectorScore < 0.0 || minVectorScore > 1.0) {
      throw new IllegalStateException(
          "regula.hybrid.min-vector-score must be in [0.0, 1.0], got: " + minVectorScore);
    }
  }

  public double getAlpha() {
    return alpha;
  }

  public void setAlpha(double alpha) {
    this.alpha = alpha;
  }

  public int getCandidates() {
    return candidates;
  }

  public void setCandidates(int candidates) {
    this.candidates = candidates;
  }

  public double getKeywordHalfRank() {
    return keywordHalfRank;
  }

  public void setKeywordHalfRank(double keywordHalfRank) {
    this.keywordHalfRank = keywordHalfRank;
  }

  public double getMinVectorScore() {
    return minVectorScore;
  }

  public void setMinVectorScore(double minVectorScore) {
    this.minVectorScore = minVectorScore;
  }
}
