package dev.regula.synthesis;

import java.util.List;
import java.util.Objects;

/**
 * The generator's answer, as parsed, and later as pruned by citation validation.
 *
 * @param directAnswer one or two sentence answer to the question
 * @param explanation supporting explanation in plain language
 * @param claims factual statements with their citations
 * @param requirements requirement bullets; each must carry a citation
 * @param conflicts conflicts the generator reported
 * @param selfReported the generator's own confidence
 * @param limitations caveats, including notes about removed claims
 */
public record StructuredAnswer(
    String directAnswer,
    String explanation,
    List<Claim> claims,
    List<Claim> requirements,
    List<ConflictNote> conflicts,
    SelfReportedConfidence selfReported,
    String limitations) {

  public StructuredAnswer {
    Objects.requireNonNull(directAnswer, "directAnswer");
    Objects.requireNonNull(selfReported, "selfReported");
    explanation = explanation == null ? "" : explanation;
    claims = claims == null ? List.of() : List.copyOf(claims);
    requirements = requirements == null ? List.of() : List.copyOf(requirements);
    conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    limitations = limitations == null ? "" : limitations;
  }

  /** An answer that states only the fail-closed sentence. */
  public static StructuredAnswer failClosed(String sentence, String limitations) {
    return new StructuredAnswer(
        sentence,
        "",
        List.of(),
        List.of(),
        List.of(),
        new SelfReportedConfidence(ConfidenceLevel.LOW, "No supporting evidence"),
        limitations);
  }

  public StructuredAnswer withValidated(
      String keptDirectAnswer,
      String keptExplanation,
      List<Claim> keptClaims,
      List<Claim> keptRequirements,
      List<ConflictNote> keptConflicts,
      String updatedLimitations) {
    return new StructuredAnswer(
        keptDirectAnswer,
        keptExplanation,
        keptClaims,
        keptRequirements,
        keptConflicts,
        selfReported,
        updatedLimitations);
  }

  /** A blank direct answer means validation removed every sentence of it. */
  public boolean hasSupportedContent() {
    if (directAnswer.isBlank()) {
      return false;
    }
    return !requirements.isEmpty()
        || claims.stream().anyMatch(c -> c.status() == ClaimStatus.SUPPORTED);
  }
}
