package dev.regula;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the Regula question-answering service.
 *
 * <p>Serves the REST API and the MCP tools (SSE transport) on the same port.
 */
@SpringBootApplication
@EnableRetry
public class RegulaApplication {
  public static void main(String[] args) {
    SpringApplication.run(RegulaApplication.class, args);
  }
}
