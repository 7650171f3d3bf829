package com.cosmicwatch.api.service;

import com.cosmicwatch.api.config.CosmicWatchProperties;
import com.cosmicwatch.api.model.DateRange;
import com.cosmicwatch.api.model.NeoFeedResponse;
import com.cosmicwatch.api.model.NeoLookupResponse;
import com.cosmicwatch.api.model.NormalizedAsteroidItem;
import com.cosmicwatch.api.model.RiskCategory;
import com.cosmicwatch.api.model.TodaySummaryResponse;
import com.cosmicwatch.api.nasa.FeedRangeMerger;
import com.cosmicwatch.api.nasa.NeoWsClient;
import com.cosmicwatch.api.nasa.RawFeedPayload;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Read-side service behind the NeoWs endpoints.
 *
 * <p>Resolves request parameters, fetches through the cached upstream client and normalizes the
 * result into the public response contracts.
 */
@Service
public class NeoFeedService {
  private final FeedRangeMerger feedRangeMerger;
  private final NeoWsClient neoWsClient;
  private final NeoResponseBuilder responseBuilder;
  private final CosmicWatchProperties properties;
  private final Clock clock;

  public NeoFeedService(
      FeedRangeMerger feedRangeMerger,
      NeoWsClient neoWsClient,
      NeoResponseBuilder responseBuilder,
      CosmicWatchProperties properties,
      Clock clock) {
    this.feedRangeMerger = feedRangeMerger;
    this.neoWsClient = neoWsClient;
    this.responseBuilder = responseBuilder;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Returns risk-scored feed items for a date range.
   *
   * @param rawStart optional ISO start date, defaults to today
   * @param rawEnd optional ISO end date, defaults to the start date
   * @return feed envelope
   */
  public NeoFeedResponse feed(String rawStart, String rawEnd) {
    DateRange range = resolveRange(rawStart, rawEnd);
    return feed(range);
  }

  /**
   * Returns the merged upstream feed without normalization.
   *
   * @param rawStart optional ISO start date
   * @param rawEnd optional ISO end date
   * @return merged raw payload
   */
  public RawFeedPayload rawFeed(String rawStart, String rawEnd) {
    DateRange range = resolveRange(rawStart, rawEnd);
    return feedRangeMerger.fetchFeedRange(range.startDate(), range.endDate());
  }

  /**
   * Counts today's approaches per risk category.
   *
   * @return summary for the current date
   */
  public TodaySummaryResponse todaySummary() {
    LocalDate today = today();
    List<NormalizedAsteroidItem> items = feed(new DateRange(today, today)).items();
    return new TodaySummaryResponse(
        today.toString(),
        items.size(),
        count(items, RiskCategory.HIGH),
        count(items, RiskCategory.MEDIUM),
        count(items, RiskCategory.LOW));
  }

  /**
   * Returns the normalized record for one asteroid.
   *
   * @param asteroidId NeoWs asteroid id
   * @return lookup envelope
   */
  public NeoLookupResponse lookup(String asteroidId) {
    return responseBuilder.lookupResponse(
        asteroidId, NeoNormalizer.normalizeLookup(neoWsClient.fetchLookup(asteroidId)));
  }

  private NeoFeedResponse feed(DateRange range) {
    RawFeedPayload payload = feedRangeMerger.fetchFeedRange(range.startDate(), range.endDate());
    return responseBuilder.feedResponse(
        range.startDate(), range.endDate(), NeoNormalizer.normalizeFeed(payload));
  }

  private DateRange resolveRange(String rawStart, String rawEnd) {
    return DateRangeResolver.resolve(rawStart, rawEnd, today(), properties.getApi().getMaxRangeDays());
  }

  private LocalDate today() {
    return LocalDate.now(clock.withZone(ZoneId.of(properties.getApi().getZone())));
  }

  private static int count(List<NormalizedAsteroidItem> items, RiskCategory category) {
    return (int) items.stream().filter(item -> item.riskCategory() == category).count();
  }
}
