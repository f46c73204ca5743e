package dev.regula.query;

/** Coarse intent of a regulatory question; shapes retrieval breadth and the answer prompt. */
public enum QueryIntent {
  DEFINITIONAL,
  ELIGIBILITY,
  PROCEDURAL,
  COMPARATIVE,
  UNKNOWN
}
