package dev.regula.query;

/**
 * Thrown when a question is empty, blank or otherwise unusable. This is the only failure the
 * answer pipeline surfaces to its caller.
 */
public class InvalidQuestionException extends IllegalArgumentException {

  public InvalidQuestionException(String message) {
    super(message);
  }
}
