package com.cosmicwatch.api.service;

import com.cosmicwatch.api.config.CosmicWatchProperties;
import com.cosmicwatch.api.model.NeoFeedResponse;
import com.cosmicwatch.api.model.NeoLookupResponse;
import com.cosmicwatch.api.model.NormalizedAsteroidDetail;
import com.cosmicwatch.api.model.NormalizedAsteroidItem;
import com.cosmicwatch.api.model.ResponseMeta;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.springframework.stereotype.Component;

/** Assembles the public feed/lookup envelopes around normalized records. */
@Component
public class NeoResponseBuilder {
  static final String SOURCE = "NASA NeoWs";
  static final String SOURCE_FORMAT = "JSON";
  static final String PROCESSING_VERSION = "1.0.0";
  private static final ResponseMeta.Normalization NORMALIZATION = new ResponseMeta.Normalization(
      "m", "km/s", "km", "YYYY-MM-DD", "missing numeric values are returned as null");

  private final CosmicWatchProperties.Nasa properties;
  private final Clock clock;

  public NeoResponseBuilder(CosmicWatchProperties properties, Clock clock) {
    this.properties = properties.getNasa();
    this.clock = clock;
  }

  public NeoFeedResponse feedResponse(
      LocalDate startDate, LocalDate endDate, List<NormalizedAsteroidItem> items) {
    return new NeoFeedResponse(
        meta(properties.getFeedUrl()),
        startDate.toString(),
        endDate.toString(),
        items.size(),
        List.copyOf(items));
  }

  public NeoLookupResponse lookupResponse(String asteroidId, NormalizedAsteroidDetail item) {
    String endpoint = properties.getLookupUrl().replaceAll("/+$", "") + "/" + asteroidId;
    return new NeoLookupResponse(meta(endpoint), item);
  }

  private ResponseMeta meta(String sourceEndpoint) {
    return new ResponseMeta(
        SOURCE,
        sourceEndpoint,
        SOURCE_FORMAT,
        Instant.now(clock).toString(),
        PROCESSING_VERSION,
        NORMALIZATION);
  }
}
