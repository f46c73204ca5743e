package dev.regula.retrieval;

/**
 * Contribution of each signal to a hybrid score. Both values are already weighted, so they sum to
 * the combined raw score.
 */
public record ScoreBreakdown(double keyword, double vector) {}
