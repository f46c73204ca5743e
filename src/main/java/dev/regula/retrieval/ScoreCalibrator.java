package dev.regula.retrieval;

import org.springframework.stereotype.Component;

/**
 * Maps each tier's native score onto a shared [0, 1] relevance scale.
 *
 * <ul>
 *   <li>Tiers 1 and 2 produce a convex combination of calibrated signals already in [0, 1]; the
 *       score is clamped.
 *   <li>Tier 3 produces Lucene scores divided by hop distance, unbounded above: {@code s / (s +
 *       graphHalfScore)}.
 *   <li>Tier 4 produces small positive {@code ts_rank} values: {@code r / (r + fulltextHalfScore)}.
 * </ul>
 *
 * <p>All mappings are monotonic, and negative or NaN inputs map to 0.
 */
@Component
public class ScoreCalibrator {

  private final CalibrationProperties properties;

  public ScoreCalibrator(CalibrationProperties properties) {
    this.properties = properties;
  }

  public double calibrate(Tier tier, double rawScore) {
    if (Double.isNaN(rawScore) || rawScore <= 0.0) {
      return 0.0;
    }
    if (tier == Tier.GRAPH) {
      return saturate(rawScore, properties.getGraphHalfScore());
    }
    if (tier == Tier.FULL_TEXT) {
      return saturate(rawScore, properties.getFulltextHalfScore());
    }
    return Math.min(1.0, rawScore);
  }

  public RetrievalHit calibrate(RetrievalHit hit) {
    return hit.withNormalizedScore(calibrate(hit.tier(), hit.rawScore()));
  }

  private static double saturate(double score, double halfScore) {
    if (Double.isInfinite(score)) {
      return 1.0;
    }
    return score / (score + halfScore);
  }
}
