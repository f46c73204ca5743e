package dev.regula.synthesis;

import static org.assertj.core.api.Assertions.assertThat;

import dev.regula.conflict.ConflictFinding;
import dev.regula.conflict.ConflictKind;
import dev.regula.fixture.Contexts;
import dev.regula.fixture.Questions;
import dev.regula.fixture.RetrievalHitBuilder;
import dev.regula.fusion.FusedContext;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class GroundedPromptBuilderTest {

  private final GroundedPromptBuilder builder = new GroundedPromptBuilder();

  private static final FusedContext CONTEXT =
      Contexts.of(
          new RetrievalHitBuilder()
              .content("An insured person qualifies if ...")
              .inForce(LocalDate.of(1996, 6, 30), null)
              .build(),
          new RetrievalHitBuilder()
              .id("irpr-200")
              .document("irpr")
              .title("Immigration and Refugee Protection Regulations")
              .section("200")
              .content("An officer shall issue a work permit ...")
              .build());

  @Test
  void user_message_numbers_every_context_passage() {
    GenerationRequest request =
        builder.build(Questions.temporaryResidentsEi(), CONTEXT, List.of());

    assertThat(request.userMessage())
        .startsWith("Question: Can temporary residents apply for employment insurance\n")
        .contains("[R1] Employment Insurance Act, Section 7 (in force 1996-06-30 to present)\n")
        .contains("An insured person qualifies if ...")
        .contains("[R2] Immigration and Refugee Protection Regulations, Section 200\n")
        .endsWith("Answer in JSON now.");
    assertThat(request.userMessage()).doesNotContain("Detected conflicts");
  }

  @Test
  void system_instructions_carry_rules_schema_and_not_found_sentence() {
    GenerationRequest request =
        builder.build(Questions.temporaryResidentsEi(), CONTEXT, List.of());

    assertThat(request.systemInstructions())
        .contains("Use ONLY the numbered context passages")
        .contains(
            "The provided documents do not contain information about "
                + "temporary residents and employment insurance.")
        .contains("\"direct_answer\"")
        .contains("in English");
  }

  @Test
  void detected_conflicts_are_listed_for_the_generator() {
    ConflictFinding finding =
        new ConflictFinding("R2", "R1", ConflictKind.SUPERSESSION, "[R2] x supersedes [R1] y");

    GenerationRequest request =
        builder.build(Questions.temporaryResidentsEi(), CONTEXT, List.of(finding));

    assertThat(request.userMessage())
        .contains("Detected conflicts between passages (unresolved):")
        .contains("- SUPERSESSION [R2, R1]: [R2] x supersedes [R1] y");
  }

  @Test
  void french_question_asks_for_a_french_answer() {
    GenerationRequest request =
        builder.build(
            Questions.of("Quelles sont les conditions pour la pension de vieillesse?"),
            CONTEXT,
            List.of());

    assertThat(request.systemInstructions()).contains("in French");
  }

  @Test
  void request_size_counts_both_messages() {
    GenerationRequest request =
        builder.build(Questions.temporaryResidentsEi(), CONTEXT, List.of());

    assertThat(request.size())
        .isEqualTo(request.systemInstructions().length() + request.userMessage().length());
  }
}
