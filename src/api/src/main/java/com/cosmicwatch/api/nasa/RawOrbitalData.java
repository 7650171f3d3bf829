package com.cosmicwatch.api.nasa;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Keplerian elements published by the lookup endpoint. Every field is optional.
 */
public record RawOrbitalData(
    Double semiMajorAxis,
    Double eccentricity,
    Double inclination,
    Double ascendingNodeLongitude,
    Double perihelionArgument,
    Double meanAnomaly,
    Double meanMotion,
    String epochOsculation) {

  static RawOrbitalData from(JsonNode node) {
    return new RawOrbitalData(
        JsonValues.number(node.path("semi_major_axis")),
        JsonValues.number(node.path("eccentricity")),
        JsonValues.number(node.path("inclination")),
        JsonValues.number(node.path("ascending_node_longitude")),
        JsonValues.number(node.path("perihelion_argument")),
        JsonValues.number(node.path("mean_anomaly")),
        JsonValues.number(node.path("mean_motion")),
        JsonValues.text(node.path("epoch_osculation")));
  }
}
