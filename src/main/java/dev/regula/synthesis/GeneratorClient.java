package dev.regula.synthesis;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * Calls the chat model once per request. Transport failures surface as {@link
 * GeneratorUnavailableException} and are retried with exponential backoff; the last failure is
 * rethrown once attempts are exhausted.
 */
@Service
public class GeneratorClient {

  private static final Logger log = LoggerFactory.getLogger(GeneratorClient.class);

  private final ChatModel chatModel;

  public GeneratorClient(ChatModel chatModel) {
    this.chatModel = chatModel;
  }

  @Retryable(
      retryFor = GeneratorUnavailableException.class,
      maxAttemptsExpression = "${regula.generator.retry.max-attempts:2}",
      backoff =
          @Backoff(
              delayExpression = "${regula.generator.retry.delay-ms:500}",
              multiplierExpression = "${regula.generator.retry.multiplier:2.0}"))
  public String generate(GenerationRequest request) {
    log.debug(
        "Generating answer: system={} chars, user={} chars",
        request.systemInstructions().length(),
        request.userMessage().length());
    ChatResponse response;
    try {
      response =
          chatModel.chat(
              ChatRequest.builder()
                  .messages(
                      List.of(
                          SystemMessage.from(request.systemInstructions()),
                          UserMessage.from(request.userMessage())))
                  .build());
    } catch (RuntimeException e) {
      log.warn("Generator call failed: {}", e.getMessage());
      throw new GeneratorUnavailableException("Generator call failed: " + e.getMessage(), e);
    }
    if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
      return "";
    }
    return response.aiMessage().text();
  }
}
