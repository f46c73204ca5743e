package dev.regula.answer;

import dev.regula.synthesis.GroundedPromptBuilder;
import dev.regula.synthesis.StructuredAnswer;

/** Builds the canonical fail-closed answer. */
public final class FailClosedAnswers {

  private FailClosedAnswers() {
    // static utility
  }

  public static String sentence(String topic) {
    return GroundedPromptBuilder.NOT_FOUND_TEMPLATE.formatted(topic);
  }

  public static StructuredAnswer answer(String topic, FailClosedReason reason) {
    return StructuredAnswer.failClosed(sentence(topic), reason.description());
  }

  /** Fail-closed answer that keeps limitations already collected during validation. */
  public static StructuredAnswer answer(String topic, FailClosedReason reason, String limitations) {
    String combined =
        limitations.isBlank() ? reason.description() : reason.description() + " " + limitations;
    return StructuredAnswer.failClosed(sentence(topic), combined);
  }
}
