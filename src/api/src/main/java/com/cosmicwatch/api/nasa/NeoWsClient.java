package com.cosmicwatch.api.nasa;

import com.cosmicwatch.api.config.CosmicWatchProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Locale;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * NASA NeoWs feed/lookup client with in-memory TTL caching.
 *
 * <p>Fresh cache entries short-circuit the network. When NeoWs rate-limits a call, the last
 * cached value for the same parameters is served instead, however old it is; auth and generic
 * upstream failures always propagate.
 */
@Component
public class NeoWsClient {
  private static final Logger log = LoggerFactory.getLogger(NeoWsClient.class);
  private static final String CACHE_METRIC = "cosmicwatch.nasa.cache.requests.total";
  private static final String HTTP_METRIC = "cosmicwatch.nasa.http.requests.total";

  private final CosmicWatchProperties.Nasa properties;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final FetchCache<FeedCacheKey, RawFeedPayload> feedCache;
  private final FetchCache<String, RawAsteroidRecord> lookupCache;

  @Autowired
  public NeoWsClient(
      CosmicWatchProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      Clock clock) {
    this(
        properties,
        httpClient,
        objectMapper,
        meterRegistry,
        new FetchCache<>(Duration.ofSeconds(properties.getNasa().getFeedCacheTtlSeconds()), clock),
        new FetchCache<>(Duration.ofSeconds(properties.getNasa().getLookupCacheTtlSeconds()), clock));
  }

  NeoWsClient(
      CosmicWatchProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      FetchCache<FeedCacheKey, RawFeedPayload> feedCache,
      FetchCache<String, RawAsteroidRecord> lookupCache) {
    this.properties = properties.getNasa();
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
    this.feedCache = feedCache;
    this.lookupCache = lookupCache;
  }

  /**
   * Fetches one feed window. The caller keeps the window within the provider limit.
   *
   * @param startDate first date (inclusive)
   * @param endDate last date (inclusive)
   * @return raw feed payload, possibly served from cache
   */
  public RawFeedPayload fetchFeed(LocalDate startDate, LocalDate endDate) {
    FeedCacheKey key = FeedCacheKey.of(startDate, endDate);
    URI uri = URI.create(properties.getFeedUrl()
        + "?start_date=" + key.startDate()
        + "&end_date=" + key.endDate()
        + "&api_key=" + urlEncode(properties.getApiKey()));
    return fetchCached("feed", feedCache, key, uri, RawFeedPayload::fromJson);
  }

  /**
   * Fetches a single asteroid record.
   *
   * @param asteroidId NeoWs asteroid id
   * @return typed record, possibly served from cache
   */
  public RawAsteroidRecord fetchLookup(String asteroidId) {
    URI uri = URI.create(properties.getLookupUrl().replaceAll("/+$", "")
        + "/" + urlEncode(asteroidId)
        + "?api_key=" + urlEncode(properties.getApiKey()));
    return fetchCached("lookup", lookupCache, asteroidId, uri, RawAsteroidRecord::from);
  }

  private <K, V> V fetchCached(
      String endpoint, FetchCache<K, V> cache, K key, URI uri, Function<JsonNode, V> mapper) {
    V fresh = cache.getFresh(key);
    if (fresh != null) {
      counter(CACHE_METRIC, endpoint, "hit").increment();
      return fresh;
    }
    counter(CACHE_METRIC, endpoint, "miss").increment();

    try {
      V payload = mapper.apply(get(endpoint, uri));
      cache.put(key, payload);
      return payload;
    } catch (UpstreamRateLimitedException ex) {
      V stale = cache.getAny(key);
      if (stale == null) {
        throw ex;
      }
      counter(CACHE_METRIC, endpoint, "stale").increment();
      log.warn("NeoWs {} rate limited (status={}), serving stale cache for key={}",
          endpoint, ex.getUpstreamStatus(), key);
      return stale;
    }
  }

  private JsonNode get(String endpoint, URI uri) {
    HttpRequest request = HttpRequest.newBuilder()
        .GET()
        .uri(uri)
        .timeout(Duration.ofMillis(Math.max(1_000, properties.getTimeoutMs())))
        .header("Accept", "application/json")
        .build();

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      counter(HTTP_METRIC, endpoint, "error").increment();
      throw new UpstreamException("Unable to fetch data from NASA NeoWs.", null, ex);
    } catch (IOException ex) {
      counter(HTTP_METRIC, endpoint, "error").increment();
      log.warn("NeoWs {} request failed: {}", endpoint, ex.toString());
      throw new UpstreamException("Unable to fetch data from NASA NeoWs.", null, ex);
    }

    int status = response.statusCode();
    String body = response.body();
    if (status < 200 || status >= 300) {
      UpstreamException failure = classify(status, body);
      counter(HTTP_METRIC, endpoint, outcome(failure)).increment();
      log.warn("NeoWs {} failed: status={} outcome={}", endpoint, status, outcome(failure));
      throw failure;
    }

    try {
      JsonNode root = objectMapper.readTree(body == null ? "" : body);
      if (root == null || !root.isObject()) {
        throw new IOException("NeoWs body is not a JSON object");
      }
      counter(HTTP_METRIC, endpoint, "success").increment();
      return root;
    } catch (IOException ex) {
      counter(HTTP_METRIC, endpoint, "error").increment();
      log.warn("NeoWs {} returned an unreadable body: {}", endpoint, ex.getMessage());
      throw new UpstreamException("Unable to fetch data from NASA NeoWs.", status, ex);
    }
  }

  /**
   * Classifies a non-2xx NeoWs response.
   *
   * <p>NeoWs sometimes answers quota exhaustion with 401/403, so those are treated as rate limits
   * when the body mentions it.
   *
   * @param status HTTP status
   * @param body response body, possibly null
   * @return exception describing the failure
   */
  static UpstreamException classify(int status, String body) {
    if (status == 429 || ((status == 401 || status == 403) && mentionsRateLimit(body))) {
      return new UpstreamRateLimitedException(status);
    }
    if (status == 401 || status == 403) {
      return new UpstreamAuthException(status);
    }
    return new UpstreamException("Unable to fetch data from NASA NeoWs.", status);
  }

  private static boolean mentionsRateLimit(String body) {
    if (body == null || body.isBlank()) {
      return false;
    }
    String normalized = body.toLowerCase(Locale.ROOT);
    return normalized.contains("rate limit") || normalized.contains("too many requests");
  }

  private static String outcome(UpstreamException failure) {
    if (failure instanceof UpstreamRateLimitedException) {
      return "rate_limited";
    }
    if (failure instanceof UpstreamAuthException) {
      return "auth_error";
    }
    return "error";
  }

  private Counter counter(String name, String endpoint, String outcome) {
    return Counter.builder(name)
        .tag("endpoint", endpoint)
        .tag("outcome", outcome)
        .register(meterRegistry);
  }

  private static String urlEncode(String value) {
    return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
