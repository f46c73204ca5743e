package dev.regula.cascade;

import dev.regula.retrieval.RetrievalHit;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Quality of the evidence gathered so far:
 * {@code 0.7 * maxNormalizedScore + 0.3 * min(1, relevantCount / minimumSufficientCount)}.
 *
 * @param maxNormalizedScore best calibrated score among accumulated hits
 * @param relevantCount distinct passages whose calibrated score reaches the relevance floor
 * @param score the combined quality in [0, 1]
 */
public record ResultQuality(double maxNormalizedScore, int relevantCount, double score) {

  static final ResultQuality NONE = new ResultQuality(0.0, 0, 0.0);

  static ResultQuality assess(List<RetrievalHit> calibratedHits, CascadeProperties properties) {
    double max = 0.0;
    Set<String> relevant = new HashSet<>();
    for (RetrievalHit hit : calibratedHits) {
      max = Math.max(max, hit.normalizedScore());
      if (hit.normalizedScore() >= properties.getRelevanceFloor()) {
        relevant.add(hit.passageKey());
      }
    }
    double coverage =
        Math.min(1.0, relevant.size() / (double) properties.getMinimumSufficientCount());
    return new ResultQuality(max, relevant.size(), 0.7 * max + 0.3 * coverage);
  }

  /** The cascade stops once quality is acceptable or enough relevant passages are in hand. */
  boolean meetsStopCondition(CascadeProperties properties) {
    return score >= properties.getAcceptanceThreshold()
        || relevantCount >= properties.getMinimumSufficientCount();
  }
}
