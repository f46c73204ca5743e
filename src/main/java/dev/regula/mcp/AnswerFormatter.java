package dev.regula.mcp;

import dev.regula.answer.FinalResponse;
import dev.regula.answer.SourceReference;
import dev.regula.conflict.ConflictFinding;
import dev.regula.synthesis.Claim;
import dev.regula.synthesis.ClaimStatus;
import dev.regula.synthesis.StructuredAnswer;
import java.util.List;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Renders a {@link FinalResponse} as plain text for MCP clients, within a token budget.
 *
 * <p>Uses character-based token estimation (chars / 4). The answer, requirements and confidence
 * always come first; if the rendering exceeds the budget it is cut at the character level and
 * marked as truncated.
 */
@Component
public class AnswerFormatter {

  private static final double CHARS_PER_TOKEN = 4.0;
  static final String TRUNCATION_MARKER = "\n[truncated]";

  private final int tokenBudget;

  public AnswerFormatter(@Value("${regula.mcp.token-budget:3000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  public String format(FinalResponse response) {
    StructuredAnswer answer = response.answer();
    StringBuilder out = new StringBuilder();
    out.append(answer.directAnswer()).append("\n\n");

    if (!answer.explanation().isBlank()) {
      out.append(answer.explanation()).append("\n\n");
    }
    appendClaims(out, "Requirements", answer.requirements());
    appendClaims(
        out,
        "Findings",
        answer.claims().stream().filter(c -> c.status() == ClaimStatus.SUPPORTED).toList());
    appendClaims(
        out,
        "Not found in the documents",
        answer.claims().stream().filter(c -> c.status() == ClaimStatus.NOT_FOUND).toList());

    if (!response.conflicts().isEmpty()) {
      out.append("Conflicts:\n");
      for (ConflictFinding finding : response.conflicts()) {
        out.append("- ").append(finding.description()).append('\n');
      }
      out.append('\n');
    }

    if (!response.sources().isEmpty()) {
      out.append("Sources:\n");
      for (SourceReference source : response.sources()) {
        out.append(
            String.format(
                Locale.ROOT,
                "- [%s] %s (tier %d, score %.2f)%n",
                source.referenceId(),
                source.label(),
                source.tier(),
                source.score()));
      }
      out.append('\n');
    }

    out.append(
        String.format(
            Locale.ROOT,
            "Confidence: %s (%.2f)%n",
            response.confidence().level(),
            response.confidence().score()));
    if (!answer.limitations().isBlank()) {
      out.append("Limitations: ").append(answer.limitations()).append('\n');
    }
    return truncate(out.toString());
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String truncate(String text) {
    if (estimateTokens(text) <= tokenBudget) {
      return text;
    }
    int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN) - TRUNCATION_MARKER.length();
    return text.substring(0, Math.max(0, maxChars)) + TRUNCATION_MARKER;
  }

  private static void appendClaims(StringBuilder out, String heading, List<Claim> claims) {
    if (claims.isEmpty()) {
      return;
    }
    out.append(heading).append(":\n");
    for (Claim claim : claims) {
      out.append("- ").append(claim.text());
      if (!claim.citations().isEmpty()) {
        out.append(" [").append(String.join(", ", claim.citations())).append(']');
      }
      out.append('\n');
    }
    out.append('\n');
  }
}
