package dev.regula.fixture;

import dev.regula.retrieval.HitCitation;
import dev.regula.retrieval.RelationKind;
import dev.regula.retrieval.Relationship;
import dev.regula.retrieval.RetrievalHit;
import dev.regula.retrieval.ScoreBreakdown;
import dev.regula.retrieval.Tier;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Test builder for {@link RetrievalHit} with defaults for every field, so tests only override what
 * they care about.
 *
 * <pre>{@code
 * RetrievalHit hit = new RetrievalHitBuilder().document("ei-act").section("7").score(0.8).build();
 * }</pre>
 */
public final class RetrievalHitBuilder {

  private String id = "hit-1";
  private Tier tier = Tier.HYBRID_NARROW;
  private double rawScore = 0.8;
  private double normalizedScore = 0.0;
  private String documentId = "ei-act";
  private String documentTitle = "Employment Insurance Act";
  private String sectionId = "7";
  private String content = "An insured person qualifies if the person has had an interruption of"
      + " earnings from employment.";
  private String documentType = "act";
  private LocalDate effectiveFrom;
  private LocalDate effectiveTo;
  private final List<Relationship> relationships = new ArrayList<>();
  private ScoreBreakdown breakdown;

  public RetrievalHitBuilder id(String id) {
    this.id = id;
    return this;
  }

  public RetrievalHitBuilder tier(Tier tier) {
    this.tier = tier;
    return this;
  }

  /** Sets the raw score; the normalized score stays unset until calibration. */
  public RetrievalHitBuilder score(double rawScore) {
    this.rawScore = rawScore;
    return this;
  }

  public RetrievalHitBuilder normalizedScore(double normalizedScore) {
    this.normalizedScore = normalizedScore;
    return this;
  }

  public RetrievalHitBuilder document(String documentId) {
    this.documentId = documentId;
    return this;
  }

  public RetrievalHitBuilder title(String documentTitle) {
    this.documentTitle = documentTitle;
    return this;
  }

  public RetrievalHitBuilder section(String sectionId) {
    this.sectionId = sectionId;
    return this;
  }

  public RetrievalHitBuilder content(String content) {
    this.content = content;
    return this;
  }

  public RetrievalHitBuilder documentType(String documentType) {
    this.documentType = documentType;
    return this;
  }

  public RetrievalHitBuilder inForce(LocalDate from, LocalDate to) {
    this.effectiveFrom = from;
    this.effectiveTo = to;
    return this;
  }

  public RetrievalHitBuilder relatesTo(RelationKind kind, String targetDocumentId) {
    this.relationships.add(new Relationship(kind, targetDocumentId));
    return this;
  }

  public RetrievalHitBuilder breakdown(double keyword, double vector) {
    this.breakdown = new ScoreBreakdown(keyword, vector);
    return this;
  }

  public RetrievalHit build() {
    return new RetrievalHit(
        id,
        tier,
        rawScore,
        normalizedScore,
        documentTitle,
        content,
        new HitCitation(documentId, documentTitle, sectionId),
        documentType,
        effectiveFrom,
        effectiveTo,
        relationships,
        breakdown);
  }
}
