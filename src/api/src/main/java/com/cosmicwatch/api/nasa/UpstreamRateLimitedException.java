package com.cosmicwatch.api.nasa;

/**
 * NeoWs rejected the call for quota reasons (429, or 401/403 with a rate-limit body).
 *
 * <p>Only raised when no cached value exists for the request; mapped to HTTP 503
 * {@code NASA_RATE_LIMIT}.
 */
public class UpstreamRateLimitedException extends UpstreamException {
  public UpstreamRateLimitedException(int upstreamStatus) {
    super("NASA API rate limit reached. Retry shortly.", upstreamStatus);
  }
}
