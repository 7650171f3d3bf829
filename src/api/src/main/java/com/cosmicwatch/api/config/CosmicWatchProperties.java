package com.cosmicwatch.api.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the Cosmic Watch API service.
 *
 * <p>Values are bound from {@code cosmicwatch.*} in {@code application.yml} and environment
 * variables.
 */
@ConfigurationProperties(prefix = "cosmicwatch")
public class CosmicWatchProperties {
  private final Nasa nasa = new Nasa();
  private final Api api = new Api();
  private final Chat chat = new Chat();

  public Nasa getNasa() {
    return nasa;
  }

  public Api getApi() {
    return api;
  }

  public Chat getChat() {
    return chat;
  }

  /** NASA NeoWs upstream endpoints, credentials and cache lifetimes. */
  public static class Nasa {
    private String apiKey = "DEMO_KEY";
    private String feedUrl = "https://api.nasa.gov/neo/rest/v1/feed";
    private String lookupUrl = "https://api.nasa.gov/neo/rest/v1/neo";
    private int timeoutMs = 20_000;
    private long feedCacheTtlSeconds = 90L;
    private long lookupCacheTtlSeconds = 6L * 60L * 60L;
    private int windowDays = 7;

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public String getFeedUrl() {
      return feedUrl;
    }

    public void setFeedUrl(String feedUrl) {
      this.feedUrl = feedUrl;
    }

    public String getLookupUrl() {
      return lookupUrl;
    }

    public void setLookupUrl(String lookupUrl) {
      this.lookupUrl = lookupUrl;
    }

    public int getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
      this.timeoutMs = timeoutMs;
    }

    public long getFeedCacheTtlSeconds() {
      return feedCacheTtlSeconds;
    }

    public void setFeedCacheTtlSeconds(long feedCacheTtlSeconds) {
      this.feedCacheTtlSeconds = feedCacheTtlSeconds;
    }

    public long getLookupCacheTtlSeconds() {
      return lookupCacheTtlSeconds;
    }

    public void setLookupCacheTtlSeconds(long lookupCacheTtlSeconds) {
      this.lookupCacheTtlSeconds = lookupCacheTtlSeconds;
    }

    public int getWindowDays() {
      return windowDays;
    }

    public void setWindowDays(int windowDays) {
      this.windowDays = windowDays;
    }
  }

  /** API-level behavior configuration (date range limits, reference zone, CORS). */
  public static class Api {
    private int maxRangeDays = 365;
    private String zone = "UTC";
    private final Cors cors = new Cors();

    public int getMaxRangeDays() {
      return maxRangeDays;
    }

    public void setMaxRangeDays(int maxRangeDays) {
      this.maxRangeDays = maxRangeDays;
    }

    public String getZone() {
      return zone;
    }

    public void setZone(String zone) {
      this.zone = zone;
    }

    public Cors getCors() {
      return cors;
    }
  }

  /** CORS allowlist configuration for frontend consumers. */
  public static class Cors {
    private List<String> allowedOrigins = new ArrayList<>();

    public List<String> getAllowedOrigins() {
      return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
      this.allowedOrigins = allowedOrigins;
    }
  }

  /** Live chat limits and per-connection send guards. */
  public static class Chat {
    private int maxNameLength = 24;
    private int maxMessageLength = 500;
    private int sendTimeLimitMs = 10_000;
    private int sendBufferSizeLimit = 512 * 1024;
    private List<String> allowedOrigins = new ArrayList<>();

    public int getMaxNameLength() {
      return maxNameLength;
    }

    public void setMaxNameLength(int maxNameLength) {
      this.maxNameLength = maxNameLength;
    }

    public int getMaxMessageLength() {
      return maxMessageLength;
    }

    public void setMaxMessageLength(int maxMessageLength) {
      this.maxMessageLength = maxMessageLength;
    }

    public int getSendTimeLimitMs() {
      return sendTimeLimitMs;
    }

    public void setSendTimeLimitMs(int sendTimeLimitMs) {
      this.sendTimeLimitMs = sendTimeLimitMs;
    }

    public int getSendBufferSizeLimit() {
      return sendBufferSizeLimit;
    }

    public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
      this.sendBufferSizeLimit = sendBufferSizeLimit;
    }

    public List<String> getAllowedOrigins() {
      return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
      this.allowedOrigins = allowedOrigins;
    }
  }
}
