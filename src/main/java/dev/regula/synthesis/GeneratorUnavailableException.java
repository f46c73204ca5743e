package dev.regula.synthesis;

/** Thrown when the generation backend cannot be reached or returns a transport error. */
public class GeneratorUnavailableException extends RuntimeException {

  public GeneratorUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
