package dev.regula.synthesis;

import java.util.Locale;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/** Confidence band, used both for the generator's self-report and the computed confidence. */
public enum ConfidenceLevel {
  HIGH(1.0),
  MEDIUM(0.6),
  LOW(0.2);

  private final double weight;

  ConfidenceLevel(double weight) {
    this.weight = weight;
  }

  /** Numeric value of a self-reported level in the confidence formula. */
  public double weight() {
    return weight;
  }

  public static Optional<ConfidenceLevel> parse(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.strip().toUpperCase(Locale.ROOT);
    for (ConfidenceLevel level : values()) {
      if (level.name().equals(normalized)) {
        return Optional.of(level);
      }
    }
    return Optional.empty();
  }

  /** The lower of this level and {@code cap}. */
  public ConfidenceLevel atMost(ConfidenceLevel cap) {
    return ordinal() < cap.ordinal() ? cap : this;
  }
}
