package dev.regula.retrieval;

/** The three retrieval backends the cascade can query. */
public enum Backend {
  HYBRID,
  GRAPH,
  FULL_TEXT
}
