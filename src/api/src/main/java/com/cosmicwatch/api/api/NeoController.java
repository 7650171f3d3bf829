package com.cosmicwatch.api.api;

import com.cosmicwatch.api.model.NeoFeedResponse;
import com.cosmicwatch.api.model.NeoLookupResponse;
import com.cosmicwatch.api.model.TodaySummaryResponse;
import com.cosmicwatch.api.nasa.RawFeedPayload;
import com.cosmicwatch.api.service.NeoFeedService;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing NeoWs-derived endpoints for the frontend.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code GET /api/neo/feed} (alias {@code /feed}): risk-scored feed items</li>
 *   <li>{@code GET /api/neo/raw}: merged upstream feed, unnormalized</li>
 *   <li>{@code GET /api/neo/today-summary}: per-category counts for today</li>
 *   <li>{@code GET /api/neo/lookup/{id}} (alias {@code /lookup/{id}}): one asteroid</li>
 *   <li>{@code GET /health}: liveness payload</li>
 * </ul>
 */
@RestController
public class NeoController {
  private final NeoFeedService neoFeedService;

  /**
   * Creates the controller with the feed service dependency.
   *
   * @param neoFeedService business service used by all NeoWs endpoints
   */
  public NeoController(NeoFeedService neoFeedService) {
    this.neoFeedService = neoFeedService;
  }

  /**
   * Returns normalized, risk-sorted feed items for a date range.
   *
   * @param startDate optional ISO start date, defaults to today
   * @param endDate optional ISO end date, defaults to {@code start_date}
   * @return feed envelope
   */
  @GetMapping({"/api/neo/feed", "/feed"})
  public NeoFeedResponse feed(
      @RequestParam(value = "start_date", required = false) String startDate,
      @RequestParam(value = "end_date", required = false) String endDate) {
    return neoFeedService.feed(startDate, endDate);
  }

  /**
   * Returns the merged upstream payload for a date range.
   *
   * @param startDate optional ISO start date
   * @param endDate optional ISO end date
   * @return raw feed payload
   */
  @GetMapping("/api/neo/raw")
  public RawFeedPayload raw(
      @RequestParam(value = "start_date", required = false) String startDate,
      @RequestParam(value = "end_date", required = false) String endDate) {
    return neoFeedService.rawFeed(startDate, endDate);
  }

  /**
   * Returns today's risk distribution.
   *
   * @return summary payload
   */
  @GetMapping("/api/neo/today-summary")
  public TodaySummaryResponse todaySummary() {
    return neoFeedService.todaySummary();
  }

  /**
   * Returns one normalized asteroid with orbital elements.
   *
   * @param asteroidId NeoWs asteroid id
   * @return lookup envelope
   */
  @GetMapping({"/api/neo/lookup/{asteroidId}", "/lookup/{asteroidId}"})
  public NeoLookupResponse lookup(@PathVariable("asteroidId") String asteroidId) {
    return neoFeedService.lookup(asteroidId);
  }

  @GetMapping("/health")
  public Map<String, String> health() {
    return Map.of("status", "ok");
  }
}
