package dev.regula.synthesis;

import java.util.List;
import java.util.Objects;

/**
 * A statement from the generated answer together with the citations the generator gave for it.
 * Requirement bullets use the same shape and are always {@link ClaimStatus#SUPPORTED}.
 *
 * @param text the statement
 * @param citations reference ids or citation labels, as written by the generator
 * @param status whether the generator claims context support
 */
public record Claim(String text, List<String> citations, ClaimStatus status) {

  public Claim {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(status, "status");
    citations = citations == null ? List.of() : List.copyOf(citations);
  }

  public Claim withCitations(List<String> resolved) {
    return new Claim(text, resolved, status);
  }
}
