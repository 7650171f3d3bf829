package com.cosmicwatch.api.nasa;

import com.cosmicwatch.api.config.CosmicWatchProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Serves feed ranges wider than the NeoWs window by walking it in consecutive windows.
 *
 * <p>Windows are fetched sequentially. Pagination links come from the first window; one failing
 * window fails the whole range.
 */
@Component
public class FeedRangeMerger {
  private static final Logger log = LoggerFactory.getLogger(FeedRangeMerger.class);

  private final NeoWsClient client;
  private final int windowDays;

  public FeedRangeMerger(NeoWsClient client, CosmicWatchProperties properties) {
    this.client = client;
    this.windowDays = Math.max(1, properties.getNasa().getWindowDays());
  }

  /**
   * Fetches and merges a date range.
   *
   * @param startDate first date (inclusive)
   * @param endDate last date (inclusive)
   * @return merged payload; empty without any upstream call when {@code endDate < startDate}
   */
  public RawFeedPayload fetchFeedRange(LocalDate startDate, LocalDate endDate) {
    if (endDate.isBefore(startDate)) {
      return RawFeedPayload.empty();
    }
    if (ChronoUnit.DAYS.between(startDate, endDate) <= windowDays) {
      return client.fetchFeed(startDate, endDate);
    }

    Map<String, List<JsonNode>> merged = new LinkedHashMap<>();
    JsonNode links = null;
    int windows = 0;
    LocalDate cursor = startDate;
    while (!cursor.isAfter(endDate)) {
      LocalDate windowEnd = min(cursor.plusDays(windowDays - 1L), endDate);
      RawFeedPayload window = client.fetchFeed(cursor, windowEnd);
      if (links == null) {
        links = window.links();
      }
      window.nearEarthObjects().forEach(
          (day, rows) -> merged.computeIfAbsent(day, ignored -> new ArrayList<>()).addAll(rows));
      windows++;
      cursor = windowEnd.plusDays(1);
    }

    log.debug("Merged feed range {}..{} from {} windows", startDate, endDate, windows);
    return new RawFeedPayload(links, RawFeedPayload.countRecords(merged), merged);
  }

  private static LocalDate min(LocalDate a, LocalDate b) {
    return a.isBefore(b) ? a : b;
  }
}
