package dev.regula.conflict;

import java.util.Objects;

/**
 * A conflict between two context entries, identified by their reference ids.
 *
 * @param referenceA reference id of the first entry (the acting document for directed kinds)
 * @param referenceB reference id of the second entry
 * @param kind what kind of conflict was detected
 * @param description human-readable explanation included in the prompt and the response
 */
public record ConflictFinding(
    String referenceA, String referenceB, ConflictKind kind, String description) {

  public ConflictFinding {
    Objects.requireNonNull(referenceA, "referenceA");
    Objects.requireNonNull(referenceB, "referenceB");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(description, "description");
  }

  public boolean involves(String referenceId) {
    return referenceA.equals(referenceId) || referenceB.equals(referenceId);
  }
}
