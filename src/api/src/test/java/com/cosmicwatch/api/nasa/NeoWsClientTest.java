package com.cosmicwatch.api.nasa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.cosmicwatch.api.config.CosmicWatchProperties;
import com.cosmicwatch.api.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;

class NeoWsClientTest {
  private static final LocalDate START = LocalDate.of(2026, 10, 19);
  private static final LocalDate END = LocalDate.of(2026, 10, 20);
  private static final String FEED_JSON = """
      {
        "links": {"self": "https://api.nasa.gov/neo/rest/v1/feed?start_date=2026-10-19"},
        "element_count": 1,
        "near_earth_objects": {
          "2026-10-19": [{"id": "3542519", "name": "(2010 PK9)"}]
        }
      }
      """;
  private static final String LOOKUP_JSON = """
      {
        "id": "3542519",
        "neo_reference_id": "3542519",
        "name": "(2010 PK9)",
        "is_potentially_hazardous_asteroid": true,
        "estimated_diameter": {"meters": {"estimated_diameter_min": 100.0, "estimated_diameter_max": 200.0}},
        "close_approach_data": [],
        "orbital_data": {"eccentricity": "0.42", "epoch_osculation": "2461000.5"}
      }
      """;

  private HttpClient httpClient;
  private MutableClock clock;
  private SimpleMeterRegistry meterRegistry;
  private NeoWsClient client;

  @BeforeEach
  void setUp() {
    CosmicWatchProperties properties = new CosmicWatchProperties();
    properties.getNasa().setApiKey("test-key");
    properties.getNasa().setFeedUrl("https://neo.example/feed");
    properties.getNasa().setLookupUrl("https://neo.example/neo/");
    httpClient = mock(HttpClient.class);
    clock = new MutableClock(Instant.parse("2026-10-19T12:00:00Z"), ZoneOffset.UTC);
    meterRegistry = new SimpleMeterRegistry();
    client = new NeoWsClient(
        properties,
        httpClient,
        new ObjectMapper(),
        meterRegistry,
        new FetchCache<>(Duration.ofSeconds(90), clock),
        new FetchCache<>(Duration.ofHours(6), clock));
  }

  @Test
  void fetchFeedServesFreshCacheWithoutNetworkUpToTtl() throws Exception {
    stubResponses(response(200, FEED_JSON));

    RawFeedPayload first = client.fetchFeed(START, END);
    clock.advance(Duration.ofSeconds(90));
    RawFeedPayload second = client.fetchFeed(START, END);

    assertThat(second).isSameAs(first);
    assertThat(first.elementCount()).isEqualTo(1);
    assertThat(first.nearEarthObjects().get("2026-10-19")).hasSize(1);
    verify(httpClient, times(1)).send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    assertThat(meterRegistry.get("cosmicwatch.nasa.cache.requests.total")
        .tag("endpoint", "feed").tag("outcome", "hit").counter().count()).isEqualTo(1.0);
  }

  @Test
  void fetchFeedRefetchesOnceTtlElapsed() throws Exception {
    stubResponses(response(200, FEED_JSON), response(200, FEED_JSON));

    client.fetchFeed(START, END);
    clock.advance(Duration.ofSeconds(91));
    client.fetchFeed(START, END);

    verify(httpClient, times(2)).send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
  }

  @Test
  void fetchFeedCacheKeysOnExactDates() throws Exception {
    stubResponses(response(200, FEED_JSON), response(200, FEED_JSON));

    client.fetchFeed(START, END);
    client.fetchFeed(START, START);

    verify(httpClient, times(2)).send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
  }

  @Test
  void fetchFeedServesStalePayloadWhenRateLimited() throws Exception {
    stubResponses(response(200, FEED_JSON), response(429, "Too Many Requests"));

    RawFeedPayload original = client.fetchFeed(START, END);
    clock.advance(Duration.ofSeconds(91));
    RawFeedPayload fallback = client.fetchFeed(START, END);

    assertThat(fallback).isSameAs(original);
    assertThat(meterRegistry.get("cosmicwatch.nasa.cache.requests.total")
        .tag("endpoint", "feed").tag("outcome", "stale").counter().count()).isEqualTo(1.0);
  }

  @Test
  void fetchFeedTreatsForbiddenWithRateLimitBodyAsRateLimit() throws Exception {
    stubResponses(
        response(200, FEED_JSON),
        response(403, "{\"error\":{\"code\":\"OVER_RATE_LIMIT\",\"message\":\"You have exceeded your Rate Limit.\"}}"));

    RawFeedPayload original = client.fetchFeed(START, END);
    clock.advance(Duration.ofMinutes(10));

    assertThat(client.fetchFeed(START, END)).isSameAs(original);
  }

  @Test
  void fetchFeedPropagatesAuthErrorEvenWithStaleEntry() throws Exception {
    stubResponses(response(200, FEED_JSON), response(403, "{\"error\":{\"code\":\"API_KEY_INVALID\"}}"));

    client.fetchFeed(START, END);
    clock.advance(Duration.ofSeconds(91));

    assertThatThrownBy(() -> client.fetchFeed(START, END))
        .isInstanceOf(UpstreamAuthException.class)
        .extracting("upstreamStatus")
        .isEqualTo(403);
  }

  @Test
  void fetchFeedPropagatesServerErrorEvenWithStaleEntry() throws Exception {
    stubResponses(response(200, FEED_JSON), response(500, "boom"));

    client.fetchFeed(START, END);
    clock.advance(Duration.ofSeconds(91));

    assertThatThrownBy(() -> client.fetchFeed(START, END))
        .isExactlyInstanceOf(UpstreamException.class)
        .extracting("upstreamStatus")
        .isEqualTo(500);
  }

  @Test
  void fetchFeedRaisesRateLimitWhenNothingCached() throws Exception {
    stubResponses(response(429, ""));

    assertThatThrownBy(() -> client.fetchFeed(START, END))
        .isInstanceOf(UpstreamRateLimitedException.class);
  }

  @Test
  void fetchFeedRaisesUpstreamErrorOnMalformedJson() throws Exception {
    stubResponses(response(200, "{not-json"));

    assertThatThrownBy(() -> client.fetchFeed(START, END))
        .isExactlyInstanceOf(UpstreamException.class)
        .extracting("upstreamStatus")
        .isEqualTo(200);
  }

  @Test
  void fetchFeedRaisesUpstreamErrorWithoutStatusOnConnectionFailure() throws Exception {
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenThrow(new IOException("Connection refused"));

    assertThatThrownBy(() -> client.fetchFeed(START, END))
        .isExactlyInstanceOf(UpstreamException.class)
        .extracting("upstreamStatus")
        .isNull();
  }

  @Test
  void fetchFeedSendsDatesAndApiKey() throws Exception {
    stubResponses(response(200, FEED_JSON));

    client.fetchFeed(START, END);

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    assertThat(captor.getValue().uri().toString())
        .isEqualTo("https://neo.example/feed?start_date=2026-10-19&end_date=2026-10-20&api_key=test-key");
    assertThat(captor.getValue().timeout()).hasValue(Duration.ofSeconds(20));
  }

  @Test
  void fetchLookupCachesForSixHours() throws Exception {
    stubResponses(response(200, LOOKUP_JSON), response(200, LOOKUP_JSON));

    RawAsteroidRecord first = client.fetchLookup("3542519");
    clock.advance(Duration.ofHours(5));
    assertThat(client.fetchLookup("3542519")).isSameAs(first);
    clock.advance(Duration.ofHours(2));
    client.fetchLookup("3542519");

    assertThat(first.id()).isEqualTo("3542519");
    assertThat(first.potentiallyHazardous()).isTrue();
    assertThat(first.diameterMaxM()).isEqualTo(200.0);
    assertThat(first.orbitalData().eccentricity()).isEqualTo(0.42);
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient, times(2)).send(captor.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    assertThat(captor.getValue().uri().toString())
        .isEqualTo("https://neo.example/neo/3542519?api_key=test-key");
  }

  @Test
  void classifyDistinguishesRateLimitAuthAndGenericFailures() {
    assertThat(NeoWsClient.classify(429, null)).isInstanceOf(UpstreamRateLimitedException.class);
    assertThat(NeoWsClient.classify(401, "TOO MANY REQUESTS")).isInstanceOf(UpstreamRateLimitedException.class);
    assertThat(NeoWsClient.classify(401, "invalid key")).isInstanceOf(UpstreamAuthException.class);
    assertThat(NeoWsClient.classify(404, "rate limit")).isExactlyInstanceOf(UpstreamException.class);
    assertThat(NeoWsClient.classify(503, null).getUpstreamStatus()).isEqualTo(503);
  }

  @SafeVarargs
  private void stubResponses(HttpResponse<String> first, HttpResponse<String>... rest) throws Exception {
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(first, rest);
  }

  @SuppressWarnings("unchecked")
  private static HttpResponse<String> response(int status, String body) {
    HttpResponse<String> response = (HttpResponse<String>) mock(HttpResponse.class);
    when(response.statusCode()).thenReturn(status);
    when(response.body()).thenReturn(body);
    return response;
  }
}
