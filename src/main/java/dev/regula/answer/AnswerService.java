package dev.regula.answer;

import dev.regula.cascade.CascadeProperties;
import dev.regula.cascade.CascadeResult;
import dev.regula.cascade.TierCascadeController;
import dev.regula.conflict.ConflictDetector;
import dev.regula.conflict.ConflictFinding;
import dev.regula.fusion.ContextAssembler;
import dev.regula.fusion.FusedContext;
import dev.regula.query.InvalidQuestionException;
import dev.regula.query.QueryAnalyzer;
import dev.regula.query.Question;
import dev.regula.retrieval.Tier;
import dev.regula.synthesis.AnswerSynthesizer;
import dev.regula.synthesis.StructuredAnswer;
import dev.regula.synthesis.SynthesisFailure;
import dev.regula.synthesis.SynthesisResult;
import dev.regula.validation.CitationValidator;
import dev.regula.validation.ConfidenceAssessment;
import dev.regula.validation.ConfidenceScorer;
import dev.regula.validation.ValidationReport;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Answers one question end to end: analysis, tier cascade, context assembly, conflict detection,
 * grounded synthesis and citation validation.
 *
 * <p>The only exception that escapes {@link #answer(String)} is {@link InvalidQuestionException}.
 * Every other failure produces a fail-closed {@link FinalResponse} carrying the canonical sentence,
 * LOW confidence and a {@link FailClosedReason}.
 */
@Service
public class AnswerService {

  private static final Logger log = LoggerFactory.getLogger(AnswerService.class);

  private static final int LOGGED_QUESTION_CHARS = 80;

  private final QueryAnalyzer analyzer;
  private final TierCascadeController cascade;
  private final ContextAssembler assembler;
  private final ConflictDetector conflictDetector;
  private final AnswerSynthesizer synthesizer;
  private final CitationValidator validator;
  private final ConfidenceScorer scorer;
  private final CascadeProperties cascadeProperties;

  public AnswerService(
      QueryAnalyzer analyzer,
      TierCascadeController cascade,
      ContextAssembler assembler,
      ConflictDetector conflictDetector,
      AnswerSynthesizer synthesizer,
      CitationValidator validator,
      ConfidenceScorer scorer,
      CascadeProperties cascadeProperties) {
    this.analyzer = analyzer;
    this.cascade = cascade;
    this.assembler = assembler;
    this.conflictDetector = conflictDetector;
    this.synthesizer = synthesizer;
    this.validator = validator;
    this.scorer = scorer;
    this.cascadeProperties = cascadeProperties;
  }

  /**
   * Answers a natural-language question about Canadian statutes and regulations.
   *
   * @param rawQuestion the question as typed by the user
   * @return the validated answer or a fail-closed answer, never {@code null}
   * @throws InvalidQuestionException if the question is empty, too long or has no content
   */
  public FinalResponse answer(@Nullable String rawQuestion) {
    Question question = analyzer.analyze(rawQuestion);
    log.info(
        "Answering '{}' (intent={}, language={})",
        truncate(question.normalized()),
        question.intent(),
        question.language());

    CascadeResult retrieval = null;
    try {
      retrieval = cascade.run(question);
      return answer(question, retrieval);
    } catch (RuntimeException e) {
      log.error(
          "Answer pipeline failed for '{}': {}",
          truncate(question.normalized()),
          e.getMessage(),
          e);
      return failClosed(question, retrieval, FailClosedReason.INTERNAL_ERROR, List.of(), "");
    }
  }

  private FinalResponse answer(Question question, CascadeResult retrieval) {
    if (retrieval.interrupted() || Thread.currentThread().isInterrupted()) {
      return failClosed(question, retrieval, FailClosedReason.CANCELLED, List.of(), "");
    }

    FusedContext context = assembler.assemble(retrieval.hits());
    if (context.isEmpty()) {
      return failClosed(question, retrieval, FailClosedReason.EMPTY_EVIDENCE, List.of(), "");
    }
    if (retrieval.lowEvidence() && cascadeProperties.isFailClosedOnLowEvidence()) {
      return failClosed(question, retrieval, FailClosedReason.LOW_EVIDENCE, List.of(), "");
    }

    List<ConflictFinding> conflicts = conflictDetector.detect(context);
    SynthesisResult synthesis = synthesizer.synthesize(question, context, conflicts);
    if (!synthesis.isSuccess()) {
      return failClosed(
          question, retrieval, reasonFor(synthesis.failure()), conflicts, synthesis.detail());
    }

    ValidationReport report = validator.validate(synthesis.answer(), context);
    if (!report.answer().hasSupportedContent()) {
      return failClosed(
          question,
          retrieval,
          FailClosedReason.UNSUPPORTED_CLAIMS,
          conflicts,
          report.answer().limitations());
    }

    ConfidenceAssessment confidence = scorer.assess(report, context, conflicts);
    log.info(
        "Answered with confidence {} ({}) from {} sources, tiers {}",
        confidence.level(),
        confidence.score(),
        context.size(),
        tierNumbers(retrieval));
    return new FinalResponse(
        question.normalized(),
        question.intent(),
        report.answer(),
        confidence,
        tierNumbers(retrieval),
        tierReports(retrieval),
        conflicts,
        context.entries().stream().map(SourceReference::of).toList(),
        retrieval.lowEvidence(),
        null);
  }

  private FinalResponse failClosed(
      Question question,
      @Nullable CascadeResult retrieval,
      FailClosedReason reason,
      List<ConflictFinding> conflicts,
      String limitations) {
    log.info("Failing closed for '{}': {}", truncate(question.normalized()), reason);
    StructuredAnswer answer =
        reason == FailClosedReason.UNSUPPORTED_CLAIMS
            ? FailClosedAnswers.answer(question.topic(), reason, limitations)
            : FailClosedAnswers.answer(question.topic(), reason);
    return new FinalResponse(
        question.normalized(),
        question.intent(),
        answer,
        scorer.failClosed(reason.description()),
        retrieval == null ? List.of() : tierNumbers(retrieval),
        retrieval == null ? List.of() : tierReports(retrieval),
        conflicts,
        List.of(),
        retrieval == null || retrieval.lowEvidence(),
        reason);
  }

  private static FailClosedReason reasonFor(@Nullable SynthesisFailure failure) {
    if (failure == SynthesisFailure.PARSE_ERROR) {
      return FailClosedReason.SYNTHESIS_FAILED;
    }
    if (failure == SynthesisFailure.INTERRUPTED) {
      return FailClosedReason.CANCELLED;
    }
    return FailClosedReason.GENERATOR_UNAVAILABLE;
  }

  private static List<Integer> tierNumbers(CascadeResult retrieval) {
    return retrieval.tiersUsed().stream().map(Tier::number).toList();
  }

  private static List<TierReport> tierReports(CascadeResult retrieval) {
    return retrieval.outcomes().stream().map(TierReport::of).toList();
  }

  private static String truncate(String text) {
    return text.length() <= LOGGED_QUESTION_CHARS
        ? text
        : text.substring(0, LOGGED_QUESTION_CHARS) + "...";
  }
}
