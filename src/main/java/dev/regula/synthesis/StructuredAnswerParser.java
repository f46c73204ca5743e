package dev.regula.synthesis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Reads generator output into a {@link StructuredAnswer}.
 *
 * <p>The output is untrusted. Markdown code fences are stripped and the outermost JSON object is
 * extracted from any surrounding prose before parsing. {@code direct_answer} and {@code
 * confidence.level} are mandatory; anything else that is missing or mistyped is read as empty.
 */
@Component
public class StructuredAnswerParser {

  private static final Pattern CODE_FENCE =
      Pattern.compile("```(?:json|JSON)?\\s*(.*?)```", Pattern.DOTALL);

  private final ObjectMapper objectMapper;

  public StructuredAnswerParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parses raw generator output.
   *
   * @throws SynthesisParseException if no valid JSON object with the mandatory fields is present
   */
  public StructuredAnswer parse(@Nullable String output) {
    if (output == null || output.isBlank()) {
      throw new SynthesisParseException("Generator returned empty output");
    }
    String json = extractObject(stripFences(output));

    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new SynthesisParseException("Generator output is not valid JSON: " + e.getMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new SynthesisParseException("Generator output is not a JSON object");
    }

    String directAnswer = text(root.get("direct_answer"));
    if (directAnswer.isBlank()) {
      throw new SynthesisParseException("Missing required field: direct_answer");
    }
    JsonNode confidence = root.get("confidence");
    ConfidenceLevel level =
        ConfidenceLevel.parse(confidence == null ? null : text(confidence.get("level")))
            .orElseThrow(
                () -> new SynthesisParseException("Missing or invalid field: confidence.level"));

    return new StructuredAnswer(
        directAnswer.strip(),
        text(root.get("explanation")).strip(),
        claims(root.get("claims"), false),
        claims(root.get("requirements"), true),
        conflicts(root.get("conflicts")),
        new SelfReportedConfidence(level, text(confidence.get("justification")).strip()),
        text(root.get("limitations")).strip());
  }

  static String stripFences(String output) {
    Matcher fence = CODE_FENCE.matcher(output);
    return fence.find() ? fence.group(1) : output;
  }

  static String extractObject(String text) {
    int start = text.indexOf('{');
    int end = text.lastIndexOf('}');
    if (start < 0 || end <= start) {
      throw new SynthesisParseException("No JSON object found in generator output");
    }
    return text.substring(start, end + 1);
  }

  private static List<Claim> claims(@Nullable JsonNode node, boolean requirements) {
    if (node == null || !node.isArray()) {
      return List.of();
    }
    List<Claim> claims = new ArrayList<>();
    for (JsonNode item : node) {
      String text = item.isTextual() ? item.asText() : text(item.get("text"));
      if (text.isBlank()) {
        continue;
      }
      ClaimStatus status =
          requirements ? ClaimStatus.SUPPORTED : ClaimStatus.parse(textOrNull(item.get("status")));
      claims.add(new Claim(text.strip(), strings(item.get("citations")), status));
    }
    return claims;
  }

  private static List<ConflictNote> conflicts(@Nullable JsonNode node) {
    if (node == null || !node.isArray()) {
      return List.of();
    }
    List<ConflictNote> notes = new ArrayList<>();
    for (JsonNode item : node) {
      if (item.isObject()) {
        notes.add(
            new ConflictNote(strings(item.get("references")), text(item.get("description"))));
      }
    }
    return notes;
  }

  private static List<String> strings(@Nullable JsonNode node) {
    if (node == null || node.isNull()) {
      return List.of();
    }
    if (node.isTextual()) {
      return node.asText().isBlank() ? List.of() : List.of(node.asText().strip());
    }
    List<String> values = new ArrayList<>();
    if (node.isArray()) {
      for (JsonNode item : node) {
        if (item.isValueNode() && !item.asText().isBlank()) {
          values.add(item.asText().strip());
        }
      }
    }
    return values;
  }

  private static String text(@Nullable JsonNode node) {
    if (node == null || node.isNull()) {
      return "";
    }
    if (node.isArray()) {
      List<String> parts = new ArrayList<>();
      for (JsonNode item : node) {
        if (item.isValueNode()) {
          parts.add(item.asText().strip());
        }
      }
      return String.join(" ", parts);
    }
    return node.isValueNode() ? node.asText() : "";
  }

  private static @Nullable String textOrNull(@Nullable JsonNode node) {
    String text = text(node);
    return text.isBlank() ? null : text;
  }
}
