package com.cosmicwatch.api.nasa;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One upstream close-approach entry. Every field is optional.
 *
 * @param closeApproachDate approach date ({@code YYYY-MM-DD})
 * @param orbitingBody body being approached, usually {@code Earth}
 * @param velocityKps relative velocity in km/s
 * @param missDistanceKm miss distance in km
 */
public record RawCloseApproach(
    String closeApproachDate,
    String orbitingBody,
    Double velocityKps,
    Double missDistanceKm) {

  private static final RawCloseApproach EMPTY = new RawCloseApproach(null, null, null, null);

  /** Placeholder used when a record carries no close-approach data at all. */
  public static RawCloseApproach empty() {
    return EMPTY;
  }

  static RawCloseApproach from(JsonNode node) {
    return new RawCloseApproach(
        JsonValues.text(node.path("close_approach_date")),
        JsonValues.text(node.path("orbiting_body")),
        JsonValues.number(node.path("relative_velocity").path("kilometers_per_second")),
        JsonValues.number(node.path("miss_distance").path("kilometers")));
  }
}
