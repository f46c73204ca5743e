package dev.regula.mcp;

import dev.regula.answer.AnswerService;
import dev.regula.answer.FinalResponse;
import dev.regula.query.ExtractedEntity;
import dev.regula.query.QueryAnalyzer;
import dev.regula.query.Question;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing question answering as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * @see AnswerFormatter
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private final AnswerService answerService;
  private final QueryAnalyzer analyzer;
  private final AnswerFormatter formatter;

  public McpToolService(
      AnswerService answerService, QueryAnalyzer analyzer, AnswerFormatter formatter) {
    this.answerService = answerService;
    this.analyzer = analyzer;
    this.formatter = formatter;
  }

  /** Answers a question from Canadian statutes and regulations, with verified citations. */
  @Tool(
      name = "ask_regulations",
      description =
          "Answer a question about Canadian statutes and regulations using only retrieved legal "
              + "text. Returns the answer with cited sources, detected conflicts and a confidence "
              + "level. Says so explicitly when the documents do not contain the answer.")
  public String askRegulations(
      @ToolParam(description = "The question, in English or French") @Nullable String question) {
    try {
      if (question == null || question.isBlank()) {
        return "Error: Question must not be empty. Provide a question about Canadian law.";
      }
      FinalResponse response = answerService.answer(question);
      return formatter.format(response);
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.error("ask_regulations failed: {}", e.getMessage(), e);
      return "Error answering question: " + e.getMessage();
    }
  }

  /** Shows how a question is interpreted before retrieval. */
  @Tool(
      name = "analyze_question",
      description =
          "Show how a legal question is interpreted: intent, language, keywords, recognised "
              + "entities and the filters used for the first retrieval tier.")
  public String analyzeQuestion(
      @ToolParam(description = "The question to analyze") @Nullable String question) {
    try {
      Question analyzed = analyzer.analyze(question);
      StringBuilder out = new StringBuilder();
      out.append(
          String.format(
              Locale.ROOT,
              "Intent: %s (%.2f)%s%n",
              analyzed.intent(),
              analyzed.intentConfidence(),
              analyzed.ambiguous() ? ", ambiguous" : ""));
      out.append("Language: ").append(analyzed.language()).append('\n');
      out.append("Keywords: ").append(String.join(", ", analyzed.keywords())).append('\n');
      out.append("Entities:\n");
      for (ExtractedEntity entity : analyzed.entities()) {
        out.append(
            String.format(
                Locale.ROOT,
                "- %s: %s -> %s%n",
                entity.type(),
                entity.text(),
                entity.normalized()));
      }
      out.append("Filters: ").append(analyzed.filters());
      return out.toString();
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      return "Error analyzing question: " + e.getMessage();
    }
  }
}
