package com.cosmicwatch.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response contract for {@code GET /api/neo/today-summary}.
 *
 * @param date reference date
 * @param total number of asteroids approaching on that date
 * @param highRisk count of High items
 * @param mediumRisk count of Medium items
 * @param lowRisk count of Low items
 */
public record TodaySummaryResponse(
    @JsonProperty("date") String date,
    @JsonProperty("total") int total,
    @JsonProperty("high_risk") int highRisk,
    @JsonProperty("medium_risk") int mediumRisk,
    @JsonProperty("low_risk") int lowRisk) {}
