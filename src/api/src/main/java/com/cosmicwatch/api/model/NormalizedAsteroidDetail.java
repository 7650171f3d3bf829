package com.cosmicwatch.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Normalized single-asteroid record returned by the lookup endpoint.
 *
 * <p>Uses the first close-approach entry and adds orbital elements.
 */
public record NormalizedAsteroidDetail(
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
    @JsonProperty("raw_close_approach_count") int rawCloseApproachCount,
    @JsonProperty("orbital_elements") OrbitalElements orbitalElements) {

  /** Orbital elements; every value nullable. */
  public record OrbitalElements(
      @JsonProperty("semi_major_axis_au") Double semiMajorAxisAu,
      @JsonProperty("eccentricity") Double eccentricity,
      @JsonProperty("inclination_deg") Double inclinationDeg,
      @JsonProperty("ascending_node_longitude_deg") Double ascendingNodeLongitudeDeg,
      @JsonProperty("perihelion_argument_deg") Double perihelionArgumentDeg,
      @JsonProperty("mean_anomaly_deg") Double meanAnomalyDeg,
      @JsonProperty("mean_motion_deg_per_day") Double meanMotionDegPerDay,
      @JsonProperty("epoch_osculation") String epochOsculation) {}
}
