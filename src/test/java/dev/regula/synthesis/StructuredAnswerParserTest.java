package dev.regula.synthesis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class StructuredAnswerParserTest {

  private final StructuredAnswerParser parser = new StructuredAnswerParser(new ObjectMapper());

  private static final String FULL_ANSWER =
      """
      {
        "direct_answer": "Generally yes, if they hold a valid work permit.",
        "explanation": "Insured persons qualify when they meet the hours requirement.",
        "claims": [
          {"text": "Insured persons must have insurable hours.", "citations": ["R1"],
           "status": "SUPPORTED"},
          {"text": "Processing times are not stated.", "citations": [], "status": "NOT_FOUND"}
        ],
        "requirements": [
          {"text": "Hold a valid work permit", "citations": "R2"},
          "Have a social insurance number"
        ],
        "conflicts": [{"references": ["R1", "R3"], "description": "R3 amends R1"}],
        "confidence": {"level": "medium", "justification": "Two relevant sections"},
        "limitations": ["Not legal advice.", "Provincial rules may differ."]
      }
      """;

  @Test
  void complete_answer_is_parsed() {
    StructuredAnswer answer = parser.parse(FULL_ANSWER);

    assertThat(answer.directAnswer())
        .isEqualTo("Generally yes, if they hold a valid work permit.");
    assertThat(answer.claims()).hasSize(2);
    assertThat(answer.claims().get(0).citations()).containsExactly("R1");
    assertThat(answer.claims().get(1).status()).isEqualTo(ClaimStatus.NOT_FOUND);
    assertThat(answer.requirements())
        .extracting(Claim::text)
        .containsExactly("Hold a valid work permit", "Have a social insurance number");
    assertThat(answer.requirements().get(0).citations()).containsExactly("R2");
    assertThat(answer.requirements()).allMatch(r -> r.status() == ClaimStatus.SUPPORTED);
    assertThat(answer.conflicts()).hasSize(1);
    assertThat(answer.conflicts().get(0).references()).containsExactly("R1", "R3");
    assertThat(answer.selfReported().level()).isEqualTo(ConfidenceLevel.MEDIUM);
    assertThat(answer.limitations()).isEqualTo("Not legal advice. Provincial rules may differ.");
  }

  @Test
  void code_fences_and_surrounding_prose_are_ignored() {
    String output =
        "Here is the answer:\n```json\n"
            + "{\"direct_answer\": \"No.\", \"confidence\": {\"level\": \"LOW\"}}\n"
            + "```\nHope this helps!";

    StructuredAnswer answer = parser.parse(output);

    assertThat(answer.directAnswer()).isEqualTo("No.");
    assertThat(answer.claims()).isEmpty();
    assertThat(answer.selfReported().level()).isEqualTo(ConfidenceLevel.LOW);
  }

  @Test
  void object_embedded_in_prose_without_fences_is_extracted() {
    StructuredAnswer answer =
        parser.parse(
            "Sure! {\"direct_answer\": \"Yes.\", \"confidence\": {\"level\": \"HIGH\"}} Done.");

    assertThat(answer.directAnswer()).isEqualTo("Yes.");
  }

  @Test
  void unknown_claim_status_is_checked_as_supported() {
    StructuredAnswer answer =
        parser.parse(
            "{\"direct_answer\": \"Yes.\", \"confidence\": {\"level\": \"HIGH\"},"
                + " \"claims\": [{\"text\": \"A\", \"citations\": [\"R1\"], \"status\": \"maybe\"},"
                + " {\"text\": \"B\", \"status\": \"unsupported\"}]}");

    assertThat(answer.claims())
        .extracting(Claim::status)
        .containsExactly(ClaimStatus.SUPPORTED, ClaimStatus.NOT_FOUND);
  }

  @Test
  void mistyped_optional_fields_are_read_as_empty() {
    StructuredAnswer answer =
        parser.parse(
            "{\"direct_answer\": \"Yes.\", \"confidence\": {\"level\": \"HIGH\"},"
                + " \"claims\": \"none\", \"requirements\": {}, \"explanation\": {\"x\": 1}}");

    assertThat(answer.claims()).isEmpty();
    assertThat(answer.requirements()).isEmpty();
    assertThat(answer.explanation()).isEmpty();
  }

  @Test
  void empty_output_is_rejected() {
    assertThatThrownBy(() -> parser.parse("  ")).isInstanceOf(SynthesisParseException.class);
    assertThatThrownBy(() -> parser.parse(null)).isInstanceOf(SynthesisParseException.class);
  }

  @Test
  void output_without_json_object_is_rejected() {
    assertThatThrownBy(() -> parser.parse("I cannot answer that."))
        .isInstanceOf(SynthesisParseException.class)
        .hasMessageContaining("No JSON object");
  }

  @Test
  void malformed_json_is_rejected() {
    assertThatThrownBy(() -> parser.parse("{\"direct_answer\": \"Yes.\", }"))
        .isInstanceOf(SynthesisParseException.class)
        .hasMessageContaining("not valid JSON");
  }

  @Test
  void missing_direct_answer_is_rejected() {
    assertThatThrownBy(() -> parser.parse("{\"confidence\": {\"level\": \"HIGH\"}}"))
        .isInstanceOf(SynthesisParseException.class)
        .hasMessageContaining("direct_answer");
  }

  @Test
  void missing_or_invalid_confidence_level_is_rejected() {
    assertThatThrownBy(() -> parser.parse("{\"direct_answer\": \"Yes.\"}"))
        .isInstanceOf(SynthesisParseException.class)
        .hasMessageContaining("confidence.level");
    assertThatThrownBy(
            () ->
                parser.parse(
                    "{\"direct_answer\": \"Yes.\", \"confidence\": {\"level\": \"certain\"}}"))
        .isInstanceOf(SynthesisParseException.class);
  }

  @Test
  void fence_stripping_keeps_the_inner_text() {
    assertThat(StructuredAnswerParser.stripFences("```\n{}\n```")).isEqualTo("{}\n");
    assertThat(StructuredAnswerParser.stripFences("{}")).isEqualTo("{}");
  }
}
