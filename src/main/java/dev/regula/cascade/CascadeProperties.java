package dev.regula.cascade;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Escalation policy of the tier cascade, bound from {@code regula.cascade.*}.
 *
 * <ul>
 *   <li>{@code acceptance-threshold} - result quality at which escalation stops (default 0.6)
 *   <li>{@code minimum-sufficient-count} - relevant passages at which escalation stops (default 3)
 *   <li>{@code relevance-floor} - calibrated score a passage needs to count as relevant (default
 *       0.35)
 *   <li>{@code result-limit} - hits requested from each tier (default 10)
 *   <li>{@code ambiguity-breadth-factor} - multiplier on the result limit for ambiguous questions
 *       (default 1.5)
 *   <li>{@code tier-timeout} - per-call timeout (default 5s)
 *   <li>{@code parallel-fallback} - issue tiers 3 and 4 concurrently (default false)
 *   <li>{@code fail-closed-on-low-evidence} - refuse to answer when no tier met the stop
 *       condition (default true)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "regula.cascade")
public class CascadeProperties {

  private double acceptanceThreshold = 0.6;
  private int minimumSufficientCount = 3;
  private double relevanceFloor = 0.35;
  private int resultLimit = 10;
  private double ambiguityBreadthFactor = 1.5;
  private Duration tierTimeout = Duration.ofSeconds(5);
  private boolean parallelFallback = false;
  private boolean failClosedOnLowEvidence = true;

  @PostConstruct
  void validate() {
    if (acceptanceThreshold < 0.0 || acceptanceThreshold > 1.0) {
      throw new IllegalStateException(
          "regula.cascade.acceptance-threshold must be in [0.0, 1.0], got: "
              + acceptanceThreshold);
    }
    if (minimumSufficientCount < 1) {
      throw new IllegalStateException(
          "regula.cascade.minimum-sufficient-count must be >= 1, got: " + minimumSufficientCount);
    }
    if (relevanceFloor < 0.0 || relevanceFloor > 1.0) {
      throw new IllegalStateException(
          "regula.cascade.relevance-floor must be in [0.0, 1.0], got: " + relevanceFloor);
    }
    if (resultLimit < 1 || resultLimit > 100) {
      throw new IllegalStateException(
          "regula.cascade.result-limit must be in [1, 100], got: " + resultLimit);
    }
    if (ambiguityBreadthFactor < 1.0 || ambiguityBreadthFactor > 5.0) {
      throw new IllegalStateException(
          "regula.cascade.ambiguity-breadth-factor must be in [1.0, 5.0], got: "
              + ambiguityBreadthFactor);
    }
    if (tierTimeout.isNegative() || tierTimeout.isZero()) {
      throw new IllegalStateException(
          "regula.cascade.tier-timeout must be positive, got: " + tierTimeout);
    }
  }

  public double getAcceptanceThreshold() {
    return acceptanceThreshold;
  }

  public void setAcceptanceThreshold(double acceptanceThreshold) {
    this.acceptanceThreshold = acceptanceThreshold;
  }

  public int getMinimumSufficientCount() {
    return minimumSufficientCount;
  }

  public void setMinimumSufficientCount(int minimumSufficientCount) {
    this.minimumSufficientCount = minimumSufficientCount;
  }

  public double getRelevanceFloor() {
    return relevanceFloor;
  }

  public void setRelevanceFloor(double relevanceFloor) {
    this.relevanceFloor = relevanceFloor;
  }

  public int getResultLimit() {
    return resultLimit;
  }

  public void setResultLimit(int resultLimit) {
    this.resultLimit = resultLimit;
  }

  public double getAmbiguityBreadthFactor() {
    return ambiguityBreadthFactor;
  }

  public void setAmbiguityBreadthFactor(double ambiguityBreadthFactor) {
    this.ambiguityBreadthFactor = ambiguityBreadthFactor;
  }

  public Duration getTierTimeout() {
    return tierTimeout;
  }

  public void setTierTimeout(Duration tierTimeout) {
    this.tierTimeout = tierTimeout;
  }

  public boolean isParallelFallback() {
    return parallelFallback;
  }

  public void setParallelFallback(boolean parallelFallback) {
    this.parallelFallback = parallelFallback;
  }

  public boolean isFailClosedOnLowEvidence() {
    return failClosedOnLowEvidence;
  }

  public void setFailClosedOnLowEvidence(boolean failClosedOnLowEvidence) {
    this.failClosedOnLowEvidence = failClosedOnLowEvidence;
  }
}
