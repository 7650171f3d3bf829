package com.cosmicwatch.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Response contract for {@code GET /api/neo/feed}.
 *
 * @param meta provenance block
 * @param startDate resolved start date
 * @param endDate resolved end date
 * @param asteroidCount number of items
 * @param items normalized items sorted by risk score descending
 */
public record NeoFeedResponse(
    @JsonProperty("meta") ResponseMeta meta,
    @JsonProperty("start_date") String startDate,
    @JsonProperty("end_date") String endDate,
    @JsonProperty("asteroid_count") int asteroidCount,
    @JsonProperty("items") List<NormalizedAsteroidItem> items) {}
