package com.cosmicwatch.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Normalized feed item returned by {@code GET /api/neo/feed}.
 *
 * <p>Derived numeric fields are independently nullable; risk score and category are always set.
 *
 * @param id NeoWs identifier
 * @param name display name
 * @param nasaJplUrl JPL reference link
 * @param closeApproachDate date of the selected close approach
 * @param orbitingBody orbiting body of the selected close approach
 * @param estimatedDiameterM average estimated diameter in meters (3 decimals)
 * @param estimatedDiameterKm average estimated diameter in kilometers (6 decimals)
 * @param relativeVelocityKps relative velocity in km/s (6 decimals)
 * @param relativeVelocityKph relative velocity in km/h (3 decimals)
 * @param missDistanceKm miss distance in km (3 decimals)
 * @param potentiallyHazardous hazard flag, false when absent upstream
 * @param riskScore additive risk score
 * @param riskCategory risk tier
 * @param sourceRecord provenance of the item
 */
public record NormalizedAsteroidItem(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("nasa_jpl_url") String nasaJplUrl,
    @JsonProperty("close_approach_date") String closeApproachDate,
    @JsonProperty("orbiting_body") String orbitingBody,
    @JsonProperty("estimated_diameter_m") Double estimatedDiameterM,
    @JsonProperty("estimated_diameter_km") Double estimatedDiameterKm,
    @JsonProperty("relative_velocity_kps") Double relativeVelocityKps,
    @JsonProperty("relative_velocity_kph") Double relativeVelocityKph,
    @JsonProperty("miss_distance_km") Double missDistanceKm,
    @JsonProperty("is_potentially_hazardous") boolean potentiallyHazardous,
    @JsonProperty("risk_score") int riskScore,
    @JsonProperty("risk_category") RiskCategory riskCategory,
    @JsonProperty("source_record") SourceRecord sourceRecord) {

  /**
   * Provenance of a normalized item.
   *
   * @param neoReferenceId upstream reference id
   * @param closeApproachIndex index of the selected close-approach entry, null when none existed
   */
  public record SourceRecord(
      @JsonProperty("neo_reference_id") String neoReferenceId,
      @JsonProperty("close_approach_index") Integer closeApproachIndex) {}
}
