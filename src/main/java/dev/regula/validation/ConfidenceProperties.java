package dev.regula.validation;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Thresholds mapping the computed confidence score to a level, bound from {@code
 * regula.confidence.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "regula.confidence")
public class ConfidenceProperties {

  private double highScore = 0.75;
  private double mediumScore = 0.45;
  private double highRetrievalScore = 0.75;

  @PostConstruct
  void validate() {
    if (mediumScore < 0.0 || mediumScore > 1.0) {
      throw new IllegalStateException(
          "regula.confidence.medium-score must be in [0.0, 1.0], got: " + mediumScore);
    }
    if (highScore < mediumScore || highScore > 1.0) {
      throw new IllegalStateException(
          "regula.confidence.high-score must be in [medium-score, 1.0], got: " + highScore);
    }
    if (highRetrievalScore < 0.0 || highRetrievalScore > 1.0) {
      throw new IllegalStateException(
          "regula.confidence.high-retrieval-score must be in [0.0, 1.0], got: "
              + highRetrievalScore);
    }
  }

  public double getHighScore() {
    return highScore;
  }

  public void setHighScore(double highScore) {
    this.highScore = highScore;
  }

  public double getMediumScore() {
    return mediumScore;
  }

  public void setMediumScore(double mediumScore) {
    this.mediumScore = mediumScore;
  }

  public double getHighRetrievalScore() {
    return highRetrievalScore;
  }

  public void setHighRetrievalScore(double highRetrievalScore) {
    this.highRetrievalScore = highRetrievalScore;
  }
}
