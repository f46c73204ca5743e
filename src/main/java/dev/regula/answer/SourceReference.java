package dev.regula.answer;

import dev.regula.fusion.ContextEntry;
import org.jspecify.annotations.Nullable;

/**
 * A context passage as listed in the response.
 *
 * @param referenceId id the answer cites, e.g. {@code R1}
 * @param label citation label, e.g. "Employment Insurance Act, Section 7"
 * @param tier tier number that produced the passage
 * @param documentId statute or regulation identifier
 * @param sectionId section number, if any
 * @param score calibrated relevance in [0, 1]
 */
public record SourceReference(
    String referenceId,
    String label,
    int tier,
    String documentId,
    @Nullable String sectionId,
    double score) {

  static SourceReference of(ContextEntry entry) {
    return new SourceReference(
        entry.referenceId(),
        entry.label(),
        entry.hit().tier().number(),
        entry.hit().documentId(),
        entry.hit().citation().sectionId(),
        entry.hit().normalizedScore());
  }
}
