package com.cosmicwatch.api.nasa;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed view of one NeoWs asteroid record (feed item or lookup body).
 *
 * <p>Every scalar is nullable: upstream data is heterogeneous and normalization must degrade to
 * null fields rather than fail.
 *
 * @param id NeoWs identifier
 * @param neoReferenceId NeoWs reference identifier
 * @param name display name
 * @param nasaJplUrl JPL small-body database link
 * @param potentiallyHazardous hazard flag, null when absent or not boolean-ish
 * @param diameterMinM estimated minimum diameter in meters
 * @param diameterMaxM estimated maximum diameter in meters
 * @param closeApproaches close-approach entries in upstream order
 * @param orbitalData orbital elements, null when the upstream record has none
 */
public record RawAsteroidRecord(
    String id,
    String neoReferenceId,
    String name,
    String nasaJplUrl,
    Boolean potentiallyHazardous,
    Double diameterMinM,
    Double diameterMaxM,
    List<RawCloseApproach> closeApproaches,
    RawOrbitalData orbitalData) {

  public RawAsteroidRecord {
    closeApproaches = closeApproaches == null ? List.of() : List.copyOf(closeApproaches);
  }

  /**
   * Maps an upstream JSON record without ever throwing on missing or malformed fields.
   *
   * @param node upstream record node
   * @return typed record
   */
  public static RawAsteroidRecord from(JsonNode node) {
    JsonNode meters = node.path("estimated_diameter").path("meters");
    List<RawCloseApproach> approaches = new ArrayList<>();
    JsonNode entries = node.path("close_approach_data");
    if (entries.isArray()) {
      for (JsonNode entry : entries) {
        approaches.add(entry.isObject() ? RawCloseApproach.from(entry) : RawCloseApproach.empty());
      }
    }
    JsonNode orbital = node.path("orbital_data");

    return new RawAsteroidRecord(
        JsonValues.text(node.path("id")),
        JsonValues.text(node.path("neo_reference_id")),
        JsonValues.text(node.path("name")),
        JsonValues.text(node.path("nasa_jpl_url")),
        JsonValues.flag(node.path("is_potentially_hazardous_asteroid")),
        JsonValues.number(meters.path("estimated_diameter_min")),
        JsonValues.number(meters.path("estimated_diameter_max")),
        approaches,
        orbital.isObject() ? RawOrbitalData.from(orbital) : null);
  }
}
