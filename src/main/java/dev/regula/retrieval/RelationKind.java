package dev.regula.retrieval;

import java.util.Locale;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/** Document-to-document relationship types carried by retrieval hits. */
public enum RelationKind {
  SUPERSEDES,
  AMENDS,
  REFERENCES,
  HAS_SECTION;

  /**
   * Parses a relationship name case-insensitively. Unknown names yield an empty result rather than
   * an error, since backends may carry relationship types this core does not interpret.
   */
  public static Optional<RelationKind> parse(@Nullable String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    String key = name.strip().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    for (RelationKind kind : values()) {
      if (kind.name().equals(key)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
