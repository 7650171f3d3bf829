package com.cosmicwatch.api.service;

import com.cosmicwatch.api.model.RiskAssessment;
import com.cosmicwatch.api.model.RiskCategory;

/**
 * Additive asteroid risk scoring.
 *
 * <p>Each dimension contributes the points of its highest matching tier; a missing measurement
 * contributes nothing.
 *
 * <table>
 *   <caption>Score tiers</caption>
 *   <tr><th>Dimension</th><th>Tiers</th></tr>
 *   <tr><td>hazardous</td><td>+50</td></tr>
 *   <tr><td>diameter (m)</td><td>&ge;1000 +30, &ge;300 +20, &ge;140 +10</td></tr>
 *   <tr><td>miss distance (km)</td><td>&le;750k +30, &le;3M +20, &le;7.5M +10</td></tr>
 *   <tr><td>velocity (km/s)</td><td>&ge;25 +15, &ge;15 +10, &ge;8 +5</td></tr>
 * </table>
 */
public final class RiskAnalysis {
  public static final int MAX_SCORE = 125;

  private RiskAnalysis() {}

  /**
   * Computes the risk score and category.
   *
   * @param diameterM average diameter in meters, nullable
   * @param missDistanceKm miss distance in km, nullable
   * @param velocityKps relative velocity in km/s, nullable
   * @param hazardous NeoWs hazard flag
   * @return score in {@code [0,125]} and its category
   */
  public static RiskAssessment computeRisk(
      Double diameterM, Double missDistanceKm, Double velocityKps, boolean hazardous) {
    int score = 0;
    if (hazardous) {
      score += 50;
    }
    score += diameterPoints(diameterM);
    score += missDistancePoints(missDistanceKm);
    score += velocityPoints(velocityKps);
    return new RiskAssessment(score, RiskCategory.forScore(score));
  }

  static int diameterPoints(Double diameterM) {
    if (diameterM == null) {
      return 0;
    }
    if (diameterM >= 1000) {
      return 30;
    }
    if (diameterM >= 300) {
      return 20;
    }
    return diameterM >= 140 ? 10 : 0;
  }

  static int missDistancePoints(Double missDistanceKm) {
    if (missDistanceKm == null) {
      return 0;
    }
    if (missDistanceKm <= 750_000) {
      return 30;
    }
    if (missDistanceKm <= 3_000_000) {
      return 20;
    }
    return missDistanceKm <= 7_500_000 ? 10 : 0;
  }

  static int velocityPoints(Double velocityKps) {
    if (velocityKps == null) {
      return 0;
    }
    if (velocityKps >= 25) {
      return 15;
    }
    if (velocityKps >= 15) {
      return 10;
    }
    return velocityKps >= 8 ? 5 : 0;
  }
}
