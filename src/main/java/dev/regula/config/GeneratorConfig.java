package dev.regula.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.regula.synthesis.GeneratorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the chat model used for answer synthesis. Any OpenAI-compatible endpoint works (OpenAI,
 * Ollama, vLLM). The client's own retries are disabled; {@link
 * dev.regula.synthesis.GeneratorClient} retries through Spring Retry instead.
 */
@Configuration
public class GeneratorConfig {

  private static final Logger log = LoggerFactory.getLogger(GeneratorConfig.class);

  @Bean
  public ChatModel chatModel(GeneratorProperties properties) {
    log.info(
        "Generator: model={} at {}", properties.getModelName(), properties.getBaseUrl());
    return OpenAiChatModel.builder()
        .baseUrl(properties.getBaseUrl())
        .apiKey(properties.getApiKey())
        .modelName(properties.getModelName())
        .temperature(properties.getTemperature())
        .timeout(properties.getTimeout())
        .maxRetries(0)
        .build();
  }
}
