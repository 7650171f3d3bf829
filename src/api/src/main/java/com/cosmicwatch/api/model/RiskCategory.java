package com.cosmicwatch.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Risk tier derived from a risk score. */
public enum RiskCategory {
  LOW("Low"),
  MEDIUM("Medium"),
  HIGH("High");

  private final String label;

  RiskCategory(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /**
   * Maps a score to its tier: {@code >=70} High, {@code >=40} Medium, otherwise Low.
   *
   * @param score risk score
   * @return category
   */
  public static RiskCategory forScore(int score) {
    if (score >= 70) {
      return HIGH;
    }
    if (score >= 40) {
      return MEDIUM;
    }
    return LOW;
  }
}
