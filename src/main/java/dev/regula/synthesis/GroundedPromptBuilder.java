package dev.regula.synthesis;

import dev.regula.conflict.ConflictFinding;
import dev.regula.fusion.ContextEntry;
import dev.regula.fusion.FusedContext;
import dev.regula.query.Question;
import dev.regula.query.QuestionLanguage;
import dev.regula.retrieval.RetrievalHit;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Builds the grounded generation request: the answering rules and JSON schema as system
 * instructions, and the question, numbered context blocks and detected conflicts as the user
 * message.
 */
@Component
public class GroundedPromptBuilder {

  /** Sentence used whenever the context cannot answer; {@code %s} is the question topic. */
  public static final String NOT_FOUND_TEMPLATE =
      "The provided documents do not contain information about %s.";

  static final String OUTPUT_SCHEMA =
      """
      {
        "direct_answer": "string, one or two sentences",
        "explanation": "string, plain-language explanation",
        "claims": [
          {"text": "string", "citations": ["R1"], "status": "SUPPORTED | NOT_FOUND"}
        ],
        "requirements": [
          {"text": "string", "citations": ["R2"]}
        ],
        "conflicts": [
          {"references": ["R1", "R3"], "description": "string"}
        ],
        "confidence": {"level": "HIGH | MEDIUM | LOW", "justification": "string"},
        "limitations": "string"
      }""";

  private static final String RULES =
      """
      You answer questions about Canadian statutes and regulations for the general public.

      Rules:
      1. Use ONLY the numbered context passages in the user message. Never use outside knowledge.
      2. Every SUPPORTED claim and every requirement must cite at least one passage by its \
      reference id, for example "R2". Do not cite anything that is not in the context.
      3. If the context does not answer part of the question, state that part as a claim with \
      status NOT_FOUND and no citations.
      4. If the context does not answer the question at all, set direct_answer to exactly: \
      "%s" and return no SUPPORTED claims and no requirements.
      5. When passages supersede, amend or disagree with each other, describe it under \
      "conflicts" using their reference ids. Do not decide which one prevails.
      6. Report your own confidence honestly. This is information, not legal advice.
      7. %s

      Respond with a single JSON object and nothing else, following this schema:
      %s
      """;

  public GenerationRequest build(
      Question question, FusedContext context, List<ConflictFinding> conflicts) {
    String system =
        RULES.formatted(
            NOT_FOUND_TEMPLATE.formatted(question.topic()),
            languageInstruction(question.language()),
            OUTPUT_SCHEMA);

    StringBuilder user = new StringBuilder();
    user.append("Question: ").append(question.normalized()).append("\n\n");
    user.append("Context passages:\n\n");
    for (ContextEntry entry : context.entries()) {
      appendEntry(user, entry);
    }

    if (!conflicts.isEmpty()) {
      user.append("Detected conflicts between passages (unresolved):\n");
      for (ConflictFinding finding : conflicts) {
        user.append("- ")
            .append(finding.kind())
            .append(" [")
            .append(finding.referenceA())
            .append(", ")
            .append(finding.referenceB())
            .append("]: ")
            .append(finding.description())
            .append('\n');
      }
      user.append('\n');
    }
    user.append("Answer in JSON now.");

    return new GenerationRequest(system, user.toString());
  }

  private static void appendEntry(StringBuilder out, ContextEntry entry) {
    RetrievalHit hit = entry.hit();
    out.append('[').append(entry.referenceId()).append("] ").append(entry.label());
    if (hit.effectiveFrom() != null || hit.effectiveTo() != null) {
      out.append(" (in force ")
          .append(hit.effectiveFrom() == null ? "?" : hit.effectiveFrom())
          .append(" to ")
          .append(hit.effectiveTo() == null ? "present" : hit.effectiveTo())
          .append(')');
    }
    out.append('\n').append(hit.content().strip()).append("\n\n");
  }

  private static String languageInstruction(QuestionLanguage language) {
    if (language == QuestionLanguage.FR) {
      return "Write every text field of the JSON in French. Keep reference ids unchanged.";
    }
    return "Write every text field of the JSON in English. Keep reference ids unchanged.";
  }
}
