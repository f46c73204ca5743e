package dev.regula.validation;

import dev.regula.synthesis.ConfidenceLevel;
import java.util.List;
import java.util.Objects;

/**
 * Computed answer confidence.
 *
 * @param level the final band
 * @param score the weighted score in [0, 1]
 * @param reasons short explanations of the factors that set or capped the level
 */
public record ConfidenceAssessment(ConfidenceLevel level, double score, List<String> reasons) {

  public ConfidenceAssessment {
    Objects.requireNonNull(level, "level");
    reasons = List.copyOf(reasons);
  }
}
