package com.cosmicwatch.api.model;

import java.time.LocalDate;

/**
 * Validated inclusive date range.
 *
 * @param startDate first date
 * @param endDate last date, never before {@code startDate}
 */
public record DateRange(LocalDate startDate, LocalDate endDate) {}
