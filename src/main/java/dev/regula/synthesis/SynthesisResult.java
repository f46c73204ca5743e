package dev.regula.synthesis;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of one synthesis run: either a parsed answer or the reason there is none.
 *
 * @param answer parsed answer, present on success
 * @param failure failure reason, present on failure
 * @param attempts generator calls made
 * @param detail diagnostic message for failures
 */
public record SynthesisResult(
    @Nullable StructuredAnswer answer,
    @Nullable SynthesisFailure failure,
    int attempts,
    String detail) {

  public static SynthesisResult succeeded(StructuredAnswer answer, int attempts) {
    return new SynthesisResult(answer, null, attempts, "");
  }

  public static SynthesisResult failed(SynthesisFailure failure, int attempts, String detail) {
    return new SynthesisResult(null, failure, attempts, detail);
  }

  public boolean isSuccess() {
    return answer != null;
  }
}
