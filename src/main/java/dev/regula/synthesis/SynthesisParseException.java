package dev.regula.synthesis;

/** Thrown when generator output cannot be read as a structured answer. */
public class SynthesisParseException extends RuntimeException {

  public SynthesisParseException(String message) {
    super(message);
  }

  public SynthesisParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
