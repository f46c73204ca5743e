package dev.regula.answer;

import dev.regula.conflict.ConflictFinding;
import dev.regula.query.QueryIntent;
import dev.regula.synthesis.StructuredAnswer;
import dev.regula.validation.ConfidenceAssessment;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The only artifact returned to callers.
 *
 * @param question the question as normalized by the analyzer
 * @param intent classified intent
 * @param answer the validated answer, or the fail-closed answer
 * @param confidence computed confidence; always LOW when failing closed
 * @param tiersUsed tier numbers invoked, in execution order
 * @param tierReports per-tier execution details
 * @param conflicts conflicts detected among the context passages
 * @param sources context passages offered to the generator
 * @param lowEvidence whether no tier met the stop condition
 * @param failClosedReason why the answer failed closed, or {@code null}
 */
public record FinalResponse(
    String question,
    QueryIntent intent,
    StructuredAnswer answer,
    ConfidenceAssessment confidence,
    List<Integer> tiersUsed,
    List<TierReport> tierReports,
    List<ConflictFinding> conflicts,
    List<SourceReference> sources,
    boolean lowEvidence,
    @Nullable FailClosedReason failClosedReason) {

  public FinalResponse {
    Objects.requireNonNull(question, "question");
    Objects.requireNonNull(answer, "answer");
    Objects.requireNonNull(confidence, "confidence");
    tiersUsed = List.copyOf(tiersUsed);
    tierReports = List.copyOf(tierReports);
    conflicts = List.copyOf(conflicts);
    sources = List.copyOf(sources);
  }

  public boolean failedClosed() {
    return failClosedReason != null;
  }
}
