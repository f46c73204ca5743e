package dev.regula.synthesis;

import java.util.Objects;

/** The generator's own confidence statement. Informational; the final level is computed. */
public record SelfReportedConfidence(ConfidenceLevel level, String justification) {

  public SelfReportedConfidence {
    Objects.requireNonNull(level, "level");
    justification = justification == null ? "" : justification;
  }
}
