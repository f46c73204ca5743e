package dev.regula.retrieval;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Saturation constants that map unbounded backend scores onto [0, 1], bound from {@code
 * regula.calibration.*}. A raw score equal to the half-score calibrates to 0.5.
 */
@Configuration
@ConfigurationProperties(prefix = "regula.calibration")
public class CalibrationProperties {

  private double graphHalfScore = 1.0;
  private double fulltextHalfScore = 0.1;

  @PostConstruct
  void validate() {
    if (graphHalfScore <= 0.0) {
      throw new IllegalStateException(
          "regula.calibration.graph-half-score must be > 0, got: " + graphHalfScore);
    }
    if (fulltextHalfScore <= 0.0) {
      throw new IllegalStateException(
          "regula.calibration.fulltext-half-score must be > 0, got: " + fulltextHalfScore);
    }
  }

  public double getGraphHalfScore() {
    return graphHalfScore;
  }

  public void setGraphHalfScore(double graphHalfScore) {
    this.graphHalfScore = graphHalfScore;
  }

  public double getFulltextHalfScore() {
    return fulltextHalfScore;
  }

  public void setFulltextHalfScore(double fulltextHalfScore) {
    this.fulltextHalfScore = fulltextHalfScore;
  }
}
