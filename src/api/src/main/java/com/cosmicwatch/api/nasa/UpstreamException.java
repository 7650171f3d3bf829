package com.cosmicwatch.api.nasa;

/**
 * NeoWs call failed and no usable response is available.
 *
 * <p>Carries the upstream HTTP status when one was received. Mapped to HTTP 502
 * {@code NASA_UPSTREAM_ERROR} unless a subclass says otherwise.
 */
public class UpstreamException extends RuntimeException {
  private final Integer upstreamStatus;

  public UpstreamException(String message, Integer upstreamStatus) {
    super(message);
    this.upstreamStatus = upstreamStatus;
  }

  public UpstreamException(String message, Integer upstreamStatus, Throwable cause) {
    super(message, cause);
    this.upstreamStatus = upstreamStatus;
  }

  /**
   * Returns the upstream HTTP status.
   *
   * @return status code, or null for connection-level failures
   */
  public Integer getUpstreamStatus() {
    return upstreamStatus;
  }
}
