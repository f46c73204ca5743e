package dev.regula.synthesis;

import dev.regula.conflict.ConflictFinding;
import dev.regula.fusion.FusedContext;
import dev.regula.query.Question;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Produces a structured answer grounded in the fused context.
 *
 * <p>The generator call runs on the retrieval executor and is abandoned after {@code
 * regula.synthesis.timeout}. Unparseable output may be regenerated once when {@code
 * regula.synthesis.parse-retries} is 1. This class never throws: every failure is reported as a
 * {@link SynthesisFailure}.
 */
@Service
public class AnswerSynthesizer {

  private static final Logger log = LoggerFactory.getLogger(AnswerSynthesizer.class);

  private final GroundedPromptBuilder promptBuilder;
  private final GeneratorClient generatorClient;
  private final StructuredAnswerParser parser;
  private final SynthesisProperties properties;
  private final ExecutorService executor;

  public AnswerSynthesizer(
      GroundedPromptBuilder promptBuilder,
      GeneratorClient generatorClient,
      StructuredAnswerParser parser,
      SynthesisProperties properties,
      @Qualifier("retrievalExecutor") ExecutorService executor) {
    this.promptBuilder = promptBuilder;
    this.generatorClient = generatorClient;
    this.parser = parser;
    this.properties = properties;
    this.executor = executor;
  }

  public SynthesisResult synthesize(
      Question question, FusedContext context, List<ConflictFinding> conflicts) {
    GenerationRequest request = promptBuilder.build(question, context, conflicts);
    log.debug(
        "Prompt built: {} context entries, {} conflicts, {} chars",
        context.size(),
        conflicts.size(),
        request.size());

    int maxAttempts = 1 + properties.getParseRetries();
    String lastParseError = "";
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      Future<String> future;
      try {
        future = executor.submit(() -> generatorClient.generate(request));
      } catch (RejectedExecutionException e) {
        log.warn("Executor rejected the generator call: {}", e.getMessage());
        return SynthesisResult.failed(
            SynthesisFailure.GENERATOR_UNAVAILABLE, attempt, "Executor saturated");
      }

      String output;
      try {
        output = future.get(properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        future.cancel(true);
        log.warn("Generator timed out after {} ms", properties.getTimeout().toMillis());
        return SynthesisResult.failed(
            SynthesisFailure.TIMED_OUT,
            attempt,
            "Timed out after " + properties.getTimeout().toMillis() + " ms");
      } catch (ExecutionException e) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        log.warn("Generator unavailable: {}", cause.getMessage());
        return SynthesisResult.failed(
            SynthesisFailure.GENERATOR_UNAVAILABLE, attempt, String.valueOf(cause.getMessage()));
      } catch (InterruptedException e) {
        future.cancel(true);
        Thread.currentThread().interrupt();
        return SynthesisResult.failed(SynthesisFailure.INTERRUPTED, attempt, "Request interrupted");
      }

      try {
        StructuredAnswer answer = parser.parse(output);
        return SynthesisResult.succeeded(answer, attempt);
      } catch (SynthesisParseException e) {
        lastParseError = e.getMessage();
        log.warn(
            "Unparseable generator output (attempt {}/{}): {}",
            attempt,
            maxAttempts,
            e.getMessage());
      }
    }
    return SynthesisResult.failed(SynthesisFailure.PARSE_ERROR, maxAttempts, lastParseError);
  }
}
