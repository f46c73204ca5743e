package dev.regula.synthesis;

/** Why synthesis produced no usable answer. */
public enum SynthesisFailure {
  PARSE_ERROR,
  GENERATOR_UNAVAILABLE,
  TIMED_OUT,
  INTERRUPTED
}
