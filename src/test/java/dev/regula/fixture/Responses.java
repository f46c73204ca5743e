package dev.regula.fixture;

import static dev.regula.fixture.Answers.answer;
import static dev.regula.fixture.Answers.notFound;
import static dev.regula.fixture.Answers.supported;

import dev.regula.answer.FailClosedAnswers;
import dev.regula.answer.FailClosedReason;
import dev.regula.answer.FinalResponse;
import dev.regula.answer.SourceReference;
import dev.regula.answer.TierReport;
import dev.regula.cascade.TierStatus;
import dev.regula.conflict.ConflictFinding;
import dev.regula.conflict.ConflictKind;
import dev.regula.query.QueryIntent;
import dev.regula.retrieval.Backend;
import dev.regula.synthesis.ConfidenceLevel;
import dev.regula.validation.ConfidenceAssessment;
import java.util.List;

/** Ready-made {@link FinalResponse} values for adapter tests. */
public final class Responses {

  public static final String QUESTION = "Can temporary residents apply for employment insurance";
  public static final String TOPIC = "temporary residents and employment insurance";

  private Responses() {}

  public static FinalResponse grounded() {
    return new FinalResponse(
        QUESTION,
        QueryIntent.ELIGIBILITY,
        answer(
            List.of(
                supported("Insurable employment is required.", "R1"),
                notFound("Processing times are not stated.")),
            List.of(supported("Hold a valid work permit", "R2")),
            ConfidenceLevel.HIGH),
        new ConfidenceAssessment(
            ConfidenceLevel.MEDIUM, 0.82, List.of("2 of 2 cited statements verified")),
        List.of(1, 2),
        List.of(
            new TierReport(1, Backend.HYBRID, TierStatus.EMPTY, 0, 35, null),
            new TierReport(2, Backend.HYBRID, TierStatus.SUCCEEDED, 2, 41, null)),
        List.of(
            new ConflictFinding(
                "R1", "R2", ConflictKind.SUPERSESSION, "R1 supersedes R2 from 2022-01-01")),
        List.of(
            new SourceReference("R1", "Employment Insurance Act, Section 7", 2, "ei-act", "7", 0.8),
            new SourceReference(
                "R2",
                "Immigration and Refugee Protection Regulations, Section 200",
                2,
                "irpr",
                "200",
                0.71)),
        false,
        null);
  }

  public static FinalResponse failedClosed(FailClosedReason reason) {
    return new FinalResponse(
        QUESTION,
        QueryIntent.ELIGIBILITY,
        FailClosedAnswers.answer(TOPIC, reason),
        new ConfidenceAssessment(ConfidenceLevel.LOW, 0.0, List.of(reason.description())),
        List.of(1, 2, 3, 4),
        List.of(),
        List.of(),
        List.of(),
        true,
        reason);
  }
}
