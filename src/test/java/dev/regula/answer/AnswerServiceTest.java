package dev.regula.answer;

import static dev.regula.fixture.Answers.answer;
import static dev.regula.fixture.Answers.supported;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.regula.cascade.CascadeProperties;
import dev.regula.cascade.CascadeResult;
import dev.regula.cascade.ResultQuality;
import dev.regula.cascade.TierCascadeController;
import dev.regula.cascade.TierOutcome;
import dev.regula.cascade.TierStatus;
import dev.regula.conflict.ConflictDetector;
import dev.regula.fixture.Questions;
import dev.regula.fixture.RetrievalHitBuilder;
import dev.regula.fusion.ContextAssembler;
import dev.regula.fusion.FusionProperties;
import dev.regula.query.InvalidQuestionException;
import dev.regula.query.QueryAnalyzer;
import dev.regula.query.QueryIntent;
import dev.regula.query.QueryProperties;
import dev.regula.retrieval.CalibrationProperties;
import dev.regula.retrieval.RetrievalHit;
import dev.regula.retrieval.ScoreCalibrator;
import dev.regula.retrieval.Tier;
import dev.regula.synthesis.AnswerSynthesizer;
import dev.regula.synthesis.ConfidenceLevel;
import dev.regula.synthesis.SynthesisFailure;
import dev.regula.synthesis.SynthesisResult;
import dev.regula.validation.CitationValidator;
import dev.regula.validation.ConfidenceProperties;
import dev.regula.validation.ConfidenceScorer;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class AnswerServiceTest {

  private static final String FAIL_CLOSED_SENTENCE =
      "The provided documents do not contain information about "
          + "temporary residents and employment insurance.";

  @Mock private TierCascadeController cascade;
  @Mock private AnswerSynthesizer synthesizer;

  private CascadeProperties cascadeProperties;
  private AnswerService service;

  @BeforeEach
  void setUp() {
    cascadeProperties = new CascadeProperties();
    service =
        new AnswerService(
            new QueryAnalyzer(new QueryProperties()),
            cascade,
            new ContextAssembler(
                new ScoreCalibrator(new CalibrationProperties()), new FusionProperties()),
            new ConflictDetector(),
            synthesizer,
            new CitationValidator(),
            new ConfidenceScorer(new ConfidenceProperties()),
            cascadeProperties);
  }

  // --- Helpers ---

  private static List<RetrievalHit> strongHits() {
    return List.of(
        new RetrievalHitBuilder().id("ei-7").score(0.9).build(),
        new RetrievalHitBuilder().id("ei-12").section("12").score(0.85).build());
  }

  private static CascadeResult accepted(List<RetrievalHit> hits) {
    return new CascadeResult(
        hits,
        List.of(new TierOutcome(Tier.HYBRID_NARROW, TierStatus.SUCCEEDED, hits, 40, null)),
        new ResultQuality(0.9, hits.size(), 0.83),
        true,
        false);
  }

  private static CascadeResult exhausted(List<RetrievalHit> hits, boolean interrupted) {
    List<TierOutcome> outcomes = new ArrayList<>();
    for (Tier tier : Tier.values()) {
      TierStatus status = hits.isEmpty() ? TierStatus.EMPTY : TierStatus.SUCCEEDED;
      List<RetrievalHit> tierHits = tier == Tier.HYBRID_NARROW ? hits : List.of();
      outcomes.add(new TierOutcome(tier, status, tierHits, 10, null));
    }
    return new CascadeResult(hits, outcomes, new ResultQuality(0.2, 0, 0.14), false, interrupted);
  }

  private static SynthesisResult groundedAnswer() {
    return SynthesisResult.succeeded(
        answer(
            List.of(
                supported("Insurable employment is required.", "R1"),
                supported("Claimants need enough insurable hours.", "[R2]")),
            List.of(supported("Hold a valid work permit", "Employment Insurance Act, Section 7")),
            ConfidenceLevel.HIGH),
        1);
  }

  // --- Test cases ---

  @Test
  void grounded_answer_carries_sources_and_computed_confidence() {
    when(cascade.run(any())).thenReturn(accepted(strongHits()));
    when(synthesizer.synthesize(any(), any(), anyList())).thenReturn(groundedAnswer());

    FinalResponse response = service.answer(Questions.TEMPORARY_RESIDENTS_EI);

    assertThat(response.failedClosed()).isFalse();
    assertThat(response.intent()).isEqualTo(QueryIntent.ELIGIBILITY);
    assertThat(response.question())
        .isEqualTo("Can temporary residents apply for employment insurance");
    assertThat(response.tiersUsed()).containsExactly(1);
    assertThat(response.sources())
        .extracting(SourceReference::referenceId, SourceReference::label)
        .containsExactly(
            tuple("R1", "Employment Insurance Act, Section 7"),
            tuple("R2", "Employment Insurance Act, Section 12"));
    assertThat(response.answer().requirements().get(0).citations()).containsExactly("R1");
    assertThat(response.confidence().level()).isEqualTo(ConfidenceLevel.HIGH);
    assertThat(response.lowEvidence()).isFalse();
  }

  @Test
  void no_evidence_fails_closed_without_calling_the_generator() {
    when(cascade.run(any())).thenReturn(exhausted(List.of(), false));

    FinalResponse response = service.answer(Questions.TEMPORARY_RESIDENTS_EI);

    assertThat(response.failClosedReason()).isEqualTo(FailClosedReason.EMPTY_EVIDENCE);
    assertThat(response.answer().directAnswer()).isEqualTo(FAIL_CLOSED_SENTENCE);
    assertThat(response.confidence().level()).isEqualTo(ConfidenceLevel.LOW);
    assertThat(response.confidence().score()).isZero();
    assertThat(response.tiersUsed()).containsExactly(1, 2, 3, 4);
    assertThat(response.sources()).isEmpty();
    assertThat(response.lowEvidence()).isTrue();
    verifyNoInteractions(synthesizer);
  }

  @Test
  void low_evidence_fails_closed_when_configured() {
    when(cascade.run(any())).thenReturn(exhausted(strongHits(), false));

    FinalResponse response = service.answer(Questions.TEMPORARY_RESIDENTS_EI);

    assertThat(response.failClosedReason()).isEqualTo(FailClosedReason.LOW_EVIDENCE);
    verify(synthesizer, never()).synthesize(any(), any(), anyList());
  }

  @Test
  void low_evidence_is_flagged_but_answered_when_fail_closed_is_disabled() {
    cascadeProperties.setFailClosedOnLowEvidence(false);
    when(cascade.run(any())).thenReturn(exhausted(strongHits(), false));
    when(synthesizer.synthesize(any(), any(), anyList())).thenReturn(groundedAnswer());

    FinalResponse response = service.answer(Questions.TEMPORARY_RESIDENTS_EI);

    assertThat(response.failedClosed()).isFalse();
    assertThat(response.lowEvidence()).isTrue();
  }

  @Test
  void unreadable_generator_output_fails_closed() {
    when(cascade.run(any())).thenReturn(accepted(strongHits()));
    when(synthesizer.synthesize(any(), any(), anyList()))
        .thenReturn(SynthesisResult.failed(SynthesisFailure.PARSE_ERROR, 2, "no JSON object"));

    FinalResponse response = service.answer(Questions.TEMPORARY_RESIDENTS_EI);

    assertThat(response.failClosedReason()).isEqualTo(FailClosedReason.SYNTHESIS_FAILED);
    assertThat(response.answer().directAnswer()).isEqualTo(FAIL_CLOSED_SENTENCE);
    assertThat(response.answer().claims()).isEmpty();
    assertThat(response.confidence().level()).isEqualTo(ConfidenceLevel.LOW);
  }

  @Test
  void generator_timeout_fails_closed_as_unavailable() {
    when(cascade.run(any())).thenReturn(accepted(strongHits()));
    when(synthesizer.synthesize(any(), any(), anyList()))
        .thenReturn(SynthesisResult.failed(SynthesisFailure.TIMED_OUT, 1, "timed out"));

    FinalResponse response = service.answer(Questions.TEMPORARY_RESIDENTS_EI);

    assertThat(response.failClosedReason()).isEqualTo(FailClosedReason.GENERATOR_UNAVAILABLE);
  }

  @Test
  void answer_with_only_unverifiable_claims_fails_closed() {
    when(cascade.run(any())).thenReturn(accepted(strongHits()));
    when(synthesizer.synthesize(any(), any(), anyList()))
        .thenReturn(
            SynthesisResult.succeeded(
                answer(
                    List.of(supported("Visitors qualify after one week.", "R9")),
                    List.of(),
                    ConfidenceLevel.HIGH),
                1));

    FinalResponse response = service.answer(Questions.TEMPORARY_RESIDENTS_EI);

    assertThat(response.failClosedReason()).isEqualTo(FailClosedReason.UNSUPPORTED_CLAIMS);
    assertThat(response.answer().directAnswer()).isEqualTo(FAIL_CLOSED_SENTENCE);
    assertThat(response.answer().limitations())
        .startsWith(FailClosedReason.UNSUPPORTED_CLAIMS.description())
        .contains("Removed 1 statement(s)");
  }

  @Test
  void interrupted_cascade_fails_closed_as_cancelled() {
    when(cascade.run(any())).thenReturn(exhausted(List.of(), true));

    FinalResponse response = service.answer(Questions.TEMPORARY_RESIDENTS_EI);

    assertThat(response.failClosedReason()).isEqualTo(FailClosedReason.CANCELLED);
    verifyNoInteractions(synthesizer);
  }

  @Test
  void unexpected_failure_fails_closed_as_internal_error() {
    when(cascade.run(any())).thenThrow(new IllegalStateException("boom"));

    FinalResponse response = service.answer(Questions.TEMPORARY_RESIDENTS_EI);

    assertThat(response.failClosedReason()).isEqualTo(FailClosedReason.INTERNAL_ERROR);
    assertThat(response.tiersUsed()).isEmpty();
    assertThat(response.lowEvidence()).isTrue();
  }

  @Test
  void invalid_question_is_rejected_before_retrieval() {
    assertThatThrownBy(() -> service.answer("   ")).isInstanceOf(InvalidQuestionException.class);
    verifyNoInteractions(cascade, synthesizer);
  }

  @Test
  void same_inputs_give_the_same_response() {
    when(cascade.run(any())).thenReturn(accepted(strongHits()));
    when(synthesizer.synthesize(any(), any(), anyList())).thenReturn(groundedAnswer());

    FinalResponse first = service.answer(Questions.TEMPORARY_RESIDENTS_EI);
    FinalResponse second = service.answer(Questions.TEMPORARY_RESIDENTS_EI);

    assertThat(second).isEqualTo(first);
  }
}
