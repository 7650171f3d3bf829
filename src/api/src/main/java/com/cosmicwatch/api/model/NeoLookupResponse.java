package com.cosmicwatch.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response contract for {@code GET /api/neo/lookup/{id}}.
 *
 * @param meta provenance block
 * @param item normalized record
 */
public record NeoLookupResponse(
    @JsonProperty("meta") ResponseMeta meta,
    @JsonProperty("item") NormalizedAsteroidDetail item) {}
