package dev.regula.conflict;

/**
 * Kinds of unresolved conflict between two context passages, declared in precedence order. When
 * a document pair qualifies for several kinds, only the earliest-declared one is reported.
 */
public enum ConflictKind {
  /** One document explicitly supersedes the other. */
  SUPERSESSION,
  /** One document amends the other; the amended text may contradict the original. */
  DIRECT_CONTRADICTION_CANDIDATE,
  /** Same citation key carried with different explicit in-force periods. */
  AMBIGUOUS_OVERLAP;

  boolean outranks(ConflictKind other) {
    return ordinal() < other.ordinal();
  }
}
