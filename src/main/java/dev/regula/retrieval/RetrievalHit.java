package dev.regula.retrieval;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One passage returned by a retrieval backend.
 *
 * <p>{@code rawScore} is on the backend's own scale; {@code normalizedScore} is on the common
 * [0, 1] scale produced by {@link ScoreCalibrator} and is 0 until calibrated.
 *
 * @param id backend identifier of the passage
 * @param tier the tier that produced the hit
 * @param rawScore backend-native relevance score
 * @param normalizedScore calibrated relevance in [0, 1]
 * @param title passage title (section heading or document title)
 * @param content passage text or snippet
 * @param citation structured citation
 * @param documentType {@code "act"}, {@code "regulation"}, {@code "section"}, or {@code null}
 * @param effectiveFrom start of the period the passage is in force, if known
 * @param effectiveTo end of the period the passage is in force, if known
 * @param relationships relationships from this hit's document to other documents
 * @param breakdown keyword/vector split of the raw score (hybrid hits only)
 */
public record RetrievalHit(
    String id,
    Tier tier,
    double rawScore,
    double normalizedScore,
    String title,
    String content,
    HitCitation citation,
    @Nullable String documentType,
    @Nullable LocalDate effectiveFrom,
    @Nullable LocalDate effectiveTo,
    List<Relationship> relationships,
    @Nullable ScoreBreakdown breakdown) {

  public RetrievalHit {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(tier, "tier");
    Objects.requireNonNull(citation, "citation");
    title = title == null ? citation.documentTitle() : title;
    content = content == null ? "" : content;
    relationships = relationships == null ? List.of() : List.copyOf(relationships);
    if (Double.isNaN(normalizedScore)) {
      normalizedScore = 0.0;
    }
  }

  public RetrievalHit withNormalizedScore(double score) {
    return new RetrievalHit(
        id,
        tier,
        rawScore,
        score,
        title,
        content,
        citation,
        documentType,
        effectiveFrom,
        effectiveTo,
        relationships,
        breakdown);
  }

  /** De-duplication key: document id plus section id. */
  public String passageKey() {
    return citation.passageKey();
  }

  public String documentId() {
    return citation.documentId();
  }

  public boolean relatesTo(RelationKind kind, String documentId) {
    return relationships.stream()
        .anyMatch(r -> r.kind() == kind && r.targetDocumentId().equals(documentId));
  }
}
