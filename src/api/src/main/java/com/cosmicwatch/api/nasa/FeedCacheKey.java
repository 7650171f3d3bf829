package com.cosmicwatch.api.nasa;

import java.time.LocalDate;

/** Feed cache key: the exact ISO start/end pair sent upstream. */
public record FeedCacheKey(String startDate, String endDate) {
  public static FeedCacheKey of(LocalDate startDate, LocalDate endDate) {
    return new FeedCacheKey(startDate.toString(), endDate.toString());
  }
}
