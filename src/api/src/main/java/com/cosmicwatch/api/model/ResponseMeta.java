package com.cosmicwatch.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Provenance block attached to every NeoWs-derived response.
 *
 * @param source data source name
 * @param sourceEndpoint upstream endpoint URL the data came from
 * @param sourceFormat upstream format
 * @param retrievedAtUtc response generation timestamp (ISO-8601)
 * @param processingVersion version of the normalization rules
 * @param normalization unit and null conventions of the normalized fields
 */
public record ResponseMeta(
    @JsonProperty("source") String source,
    @JsonProperty("source_endpoint") String sourceEndpoint,
    @JsonProperty("source_format") String sourceFormat,
    @JsonProperty("retrieved_at_utc") String retrievedAtUtc,
    @JsonProperty("processing_version") String processingVersion,
    @JsonProperty("normalization") Normalization normalization) {

  /** Unit and null conventions. */
  public record Normalization(
      @JsonProperty("diameter_unit") String diameterUnit,
      @JsonProperty("velocity_unit") String velocityUnit,
      @JsonProperty("distance_unit") String distanceUnit,
      @JsonProperty("close_approach_date_format") String closeApproachDateFormat,
      @JsonProperty("null_policy") String nullPolicy) {}
}
