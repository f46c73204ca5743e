package dev.regula.answer;

/** Why the pipeline answered with the fail-closed sentence instead of a generated answer. */
public enum FailClosedReason {
  EMPTY_EVIDENCE("No relevant documents were found for this question."),
  LOW_EVIDENCE("The documents found were not relevant enough to answer reliably."),
  SYNTHESIS_FAILED("The generated answer could not be read in the expected format."),
  GENERATOR_UNAVAILABLE("The answer generator was unavailable or did not respond in time."),
  UNSUPPORTED_CLAIMS("None of the generated statements could be verified against the documents."),
  CANCELLED("The request was cancelled before an answer was produced."),
  INTERNAL_ERROR("An unexpected error occurred while preparing the answer.");

  private final String description;

  FailClosedReason(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
