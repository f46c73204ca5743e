package dev.regula.synthesis;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/** Whether the generator says a claim is backed by the context. */
public enum ClaimStatus {
  SUPPORTED,
  NOT_FOUND;

  /**
   * Parses a status label. Anything other than an explicit not-found marker is treated as {@link
   * #SUPPORTED}, which subjects the claim to citation checks.
   */
  public static ClaimStatus parse(@Nullable String value) {
    if (value == null) {
      return SUPPORTED;
    }
    String normalized = value.strip().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    return normalized.equals("NOT_FOUND") || normalized.equals("UNSUPPORTED")
        ? NOT_FOUND
        : SUPPORTED;
  }
}
