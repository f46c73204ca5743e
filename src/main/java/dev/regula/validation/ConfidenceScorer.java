package dev.regula.validation;

import dev.regula.conflict.ConflictFinding;
import dev.regula.fusion.FusedContext;
import dev.regula.synthesis.ConfidenceLevel;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Computes the final confidence from citation pass ratio, retrieval strength and the generator's
 * self-report: {@code 0.4 * passRatio + 0.4 * maxNormalizedScore + 0.2 * selfReported}.
 *
 * <p>HIGH additionally requires strong retrieval, no removed statements and a self-report above
 * LOW. Any detected conflict caps the result at MEDIUM.
 */
@Component
public class ConfidenceScorer {

  static final double PASS_WEIGHT = 0.4;
  static final double RETRIEVAL_WEIGHT = 0.4;
  static final double SELF_REPORT_WEIGHT = 0.2;

  private final ConfidenceProperties properties;

  public ConfidenceScorer(ConfidenceProperties properties) {
    this.properties = properties;
  }

  public ConfidenceAssessment assess(
      ValidationReport report, FusedContext context, List<ConflictFinding> conflicts) {
    double retrieval = context.maxNormalizedScore();
    ConfidenceLevel self = report.answer().selfReported().level();
    double score =
        PASS_WEIGHT * report.passRatio()
            + RETRIEVAL_WEIGHT * retrieval
            + SELF_REPORT_WEIGHT * self.weight();

    List<String> reasons = new ArrayList<>();
    reasons.add(
        "%d of %d cited statements verified against the sources"
            .formatted(report.passed(), report.checked()));
    reasons.add("strongest source relevance " + format(retrieval));
    reasons.add("generator self-reported " + self);

    ConfidenceLevel level;
    if (score >= properties.getHighScore()
        && retrieval >= properties.getHighRetrievalScore()
        && report.removals() == 0
        && self != ConfidenceLevel.LOW) {
      level = ConfidenceLevel.HIGH;
    } else if (score >= properties.getMediumScore()) {
      level = ConfidenceLevel.MEDIUM;
    } else {
      level = ConfidenceLevel.LOW;
    }
    if (report.removals() > 0) {
      reasons.add(report.removals() + " unsupported statement(s) removed");
    }

    if (!conflicts.isEmpty() && level == ConfidenceLevel.HIGH) {
      level = level.atMost(ConfidenceLevel.MEDIUM);
      reasons.add("capped at MEDIUM: sources contain unresolved conflicts");
    }
    return new ConfidenceAssessment(level, round(score), reasons);
  }

  /** Confidence for an answer that failed closed: always LOW. */
  public ConfidenceAssessment failClosed(String reason) {
    return new ConfidenceAssessment(ConfidenceLevel.LOW, 0.0, List.of(reason));
  }

  private static double round(double value) {
    return Math.round(value * 1000.0) / 1000.0;
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }
}
