package com.cosmicwatch.api.service;

import com.cosmicwatch.api.api.BadRequestException;
import com.cosmicwatch.api.model.DateRange;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Utility class for parsing and validating feed date query parameters.
 */
public final class DateRangeResolver {
  public static final String INVALID_DATE = "INVALID_DATE";
  public static final String INVALID_DATE_RANGE = "INVALID_DATE_RANGE";

  private DateRangeResolver() {}

  /**
   * Resolves optional {@code start_date}/{@code end_date} values.
   *
   * <p>The start defaults to {@code today}, the end to the resolved start.
   *
   * @param rawStart raw start date, optional
   * @param rawEnd raw end date, optional
   * @param today reference date for defaults
   * @param maxRangeDays maximum allowed distance between start and end
   * @return validated range
   */
  public static DateRange resolve(String rawStart, String rawEnd, LocalDate today, int maxRangeDays) {
    LocalDate start = parseDate("start_date", rawStart);
    LocalDate end = parseDate("end_date", rawEnd);
    LocalDate resolvedStart = start != null ? start : today;
    LocalDate resolvedEnd = end != null ? end : resolvedStart;

    if (resolvedEnd.isBefore(resolvedStart)) {
      throw new BadRequestException(INVALID_DATE_RANGE, "end_date cannot be before start_date");
    }
    if (ChronoUnit.DAYS.between(resolvedStart, resolvedEnd) > maxRangeDays) {
      throw new BadRequestException(
          INVALID_DATE_RANGE, "date range cannot exceed " + maxRangeDays + " days");
    }
    return new DateRange(resolvedStart, resolvedEnd);
  }

  static LocalDate parseDate(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return LocalDate.parse(raw.trim());
    } catch (DateTimeParseException ex) {
      throw new BadRequestException(INVALID_DATE, name + " must be an ISO date (YYYY-MM-DD)");
    }
  }
}
