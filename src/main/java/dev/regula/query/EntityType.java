package dev.regula.query;

/** Kinds of legal entities recognised in a question. */
public enum EntityType {
  PERSON_TYPE,
  PROGRAM,
  JURISDICTION,
  REQUIREMENT,
  LEGISLATION,
  DATE,
  MONEY
}
