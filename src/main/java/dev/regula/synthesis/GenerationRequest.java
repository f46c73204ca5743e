package dev.regula.synthesis;

import java.util.Objects;

/**
 * The two messages sent to the generator.
 *
 * @param systemInstructions grounding rules and output schema
 * @param userMessage question, context blocks and conflict findings
 */
public record GenerationRequest(String systemInstructions, String userMessage) {

  public GenerationRequest {
    Objects.requireNonNull(systemInstructions, "systemInstructions");
    Objects.requireNonNull(userMessage, "userMessage");
  }

  public int size() {
    return systemInstructions.length() + userMessage.length();
  }
}
