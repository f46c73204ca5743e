package dev.regula.retrieval.hybrid;

import dev.langchain4j.data.segment.TextSegment;
import dev.regula.retrieval.ScoreBreakdown;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure static utility that fuses the vector and keyword signals of the hybrid backend into one
 * score: {@code combined = alpha * vector + (1 - alpha) * keyword}.
 *
 * <p>Each signal is first mapped onto [0, 1] with an absolute calibration, so a passage's score
 * does not depend on which other passages happened to be retrieved alongside it:
 *
 * <ul>
 *   <li>vector: cosine relevance, clamped to [0, 1]
 *   <li>keyword: {@code ts_rank} saturated as {@code r / (r + keywordHalfRank)}
 * </ul>
 *
 * <p>A passage found by only one signal gets 0 for the other.
 */
public final class ConvexCombinationFusion {

  private ConvexCombinationFusion() {}

  /**
   * Fuses both candidate lists.
   *
   * @param vectorResults candidates from the embedding store
   * @param keywordResults candidates from PostgreSQL full-text search
   * @param alpha weight of the vector signal (0.0 = keyword only, 1.0 = vector only)
   * @param keywordHalfRank {@code ts_rank} value that calibrates to 0.5
   * @param maxResults maximum number of results to return
   * @return fused candidates sorted by combined score descending, ties by passage id
   */
  static List<FusedCandidate> fuse(
      List<ScoredCandidate> vectorResults,
      List<ScoredCandidate> keywordResults,
      double alpha,
      double keywordHalfRank,
      int maxResults) {
    if (vectorResults.isEmpty() && keywordResults.isEmpty()) {
      return List.of();
    }

    // LinkedHashMap keeps first-seen order for equal scores before the final sort
    Map<String, FusedCandidate> fused = new LinkedHashMap<>();

    for (ScoredCandidate vc : vectorResults) {
      double vectorPart = alpha * clamp(vc.score());
      FusedCandidate existing = fused.get(vc.passageId());
      if (existing == null || vectorPart > existing.vectorPart()) {
        fused.put(
            vc.passageId(), new FusedCandidate(vc.passageId(), vc.segment(), 0.0, vectorPart));
      }
    }

    for (ScoredCandidate kc : keywordResults) {
      double keywordPart = (1.0 - alpha) * saturate(kc.score(), keywordHalfRank);
      FusedCandidate existing = fused.get(kc.passageId());
      if (existing != null) {
        fused.put(
            kc.passageId(),
            new FusedCandidate(
                existing.passageId(),
                existing.segment(),
                Math.max(existing.keywordPart(), keywordPart),
                existing.vectorPart()));
      } else {
        fused.put(
            kc.passageId(), new FusedCandidate(kc.passageId(), kc.segment(), keywordPart, 0.0));
      }
    }

    return fused.values().stream()
        .sorted(
            Comparator.comparingDouble(FusedCandidate::combinedScore)
                .reversed()
                .thenComparing(FusedCandidate::passageId))
        .limit(maxResults)
        .toList();
  }

  static double clamp(double score) {
    if (Double.isNaN(score) || score <= 0.0) {
      return 0.0;
    }
    return Math.min(1.0, score);
  }

  static double saturate(double rank, double halfRank) {
    if (Double.isNaN(rank) || rank <= 0.0) {
      return 0.0;
    }
    return rank / (rank + halfRank);
  }

  /** A passage with the weighted contribution of each signal. */
  record FusedCandidate(
      String passageId, TextSegment segment, double keywordPart, double vectorPart) {

    double combinedScore() {
      return keywordPart + vectorPart;
    }

    ScoreBreakdown breakdown() {
      return new ScoreBreakdown(keywordPart, vectorPart);
    }
  }
}
