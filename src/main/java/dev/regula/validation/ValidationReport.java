package dev.regula.validation;

import dev.regula.synthesis.StructuredAnswer;
import java.util.List;

/**
 * Result of checking an answer's citations against the context.
 *
 * @param answer the answer with unsupported entries removed and citations normalized to reference
 *     ids
 * @param checked SUPPORTED claims plus requirement bullets inspected
 * @param passed inspected entries that kept at least one resolvable citation
 * @param mismatches claims, requirements and prose sentences removed for unresolvable citations
 * @param droppedCitations individual citations that did not resolve
 * @param droppedConflictNotes conflict notes removed for referencing unknown ids
 */
public record ValidationReport(
    StructuredAnswer answer,
    int checked,
    int passed,
    List<CitationMismatch> mismatches,
    int droppedCitations,
    int droppedConflictNotes) {

  public ValidationReport {
    mismatches = List.copyOf(mismatches);
  }

  public double passRatio() {
    return checked == 0 ? 0.0 : (double) passed / checked;
  }

  public int removals() {
    return mismatches.size();
  }
}
