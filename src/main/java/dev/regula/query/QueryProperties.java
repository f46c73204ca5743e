package dev.regula.query;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Question analysis settings bound from {@code regula.query.*}.
 *
 * <ul>
 *   <li>{@code max-length} - longest accepted question in characters (default 2000)
 *   <li>{@code ambiguity-threshold} - intent confidence below which a question is treated as
 *       ambiguous (default 0.5)
 *   <li>{@code max-expanded-terms} - cap on keyword list after synonym expansion (default 24)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "regula.query")
public class QueryProperties {

  private int maxLength = 2000;
  private double ambiguityThreshold = 0.5;
  private int maxExpandedTerms = 24;

  @PostConstruct
  void validate() {
    if (maxLength < 10) {
      throw new IllegalStateException("regula.query.max-length must be >= 10, got: " + maxLength);
    }
    if (ambiguityThreshold < 0.0 || ambiguityThreshold > 1.0) {
      throw new IllegalStateException(
          "regula.query.ambiguity-threshold must be in [0.0, 1.0], got: " + ambiguityThreshold);
    }
    if (maxExpandedTerms < 1) {
      throw new IllegalStateException(
          "regula.query.max-expanded-terms must be >= 1, got: " + maxExpandedTerms);
    }
  }

  public int getMaxLength() {
    return maxLength;
  }

  public void setMaxLength(int maxLength) {
    this.maxLength = maxLength;
  }

  public double getAmbiguityThreshold() {
    return ambiguityThreshold;
  }

  public void setAmbiguityThreshold(double ambiguityThreshold) {
    this.ambiguityThreshold = ambiguityThreshold;
  }

  public int getMaxExpandedTerms() {
    return maxExpandedTerms;
  }

  public void setMaxExpandedTerms(int maxExpandedTerms) {
    this.maxExpandedTerms = maxExpandedTerms;
  }
}
