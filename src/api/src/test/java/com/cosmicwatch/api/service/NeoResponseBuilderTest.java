package com.cosmicwatch.api.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.cosmicwatch.api.config.CosmicWatchProperties;
import com.cosmicwatch.api.model.NeoFeedResponse;
import com.cosmicwatch.api.model.NeoLookupResponse;
import com.cosmicwatch.api.model.NormalizedAsteroidItem;
import com.cosmicwatch.api.model.RiskCategory;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class NeoResponseBuilderTest {
  private final NeoResponseBuilder builder = new NeoResponseBuilder(
      new CosmicWatchProperties(), Clock.fixed(Instant.parse("2026-10-19T08:15:30Z"), ZoneOffset.UTC));

  @Test
  void feedEnvelopeCarriesRangeCountAndProvenance() {
    NormalizedAsteroidItem item = new NormalizedAsteroidItem(
        "1", "(a)", null, "2026-10-19", "Earth", null, null, null, null, null,
        false, 0, RiskCategory.LOW, new NormalizedAsteroidItem.SourceRecord("1", null));

    NeoFeedResponse response = builder.feedResponse(
        LocalDate.of(2026, 10, 19), LocalDate.of(2026, 10, 21), List.of(item, item));

    assertThat(response.startDate()).isEqualTo("2026-10-19");
    assertThat(response.endDate()).isEqualTo("2026-10-21");
    assertThat(response.asteroidCount()).isEqualTo(2);
    assertThat(response.meta().source()).isEqualTo("NASA NeoWs");
    assertThat(response.meta().sourceFormat()).isEqualTo("JSON");
    assertThat(response.meta().processingVersion()).isEqualTo("1.0.0");
    assertThat(response.meta().sourceEndpoint()).isEqualTo("https://api.nasa.gov/neo/rest/v1/feed");
    assertThat(response.meta().retrievedAtUtc()).isEqualTo("2026-10-19T08:15:30Z");
    assertThat(response.meta().normalization().diameterUnit()).isEqualTo("m");
  }

  @Test
  void emptyFeedHasZeroCount() {
    NeoFeedResponse response =
        builder.feedResponse(LocalDate.of(2026, 10, 19), LocalDate.of(2026, 10, 19), List.of());

    assertThat(response.asteroidCount()).isZero();
    assertThat(response.items()).isEmpty();
  }

  @Test
  void lookupEndpointIncludesAsteroidId() {
    NeoLookupResponse response = builder.lookupResponse("3542519", null);

    assertThat(response.meta().sourceEndpoint()).isEqualTo("https://api.nasa.gov/neo/rest/v1/neo/3542519");
  }
}
