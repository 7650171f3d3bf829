package com.cosmicwatch.api.model;

/**
 * Deterministic risk score and its category.
 *
 * @param score additive score in {@code [0,125]}
 * @param category tier derived from the score
 */
public record RiskAssessment(int score, RiskCategory category) {}
