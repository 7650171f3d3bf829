package com.cosmicwatch.api.nasa;

/** NeoWs rejected the API key (401/403 without rate-limit wording). Mapped to HTTP 502. */
public class UpstreamAuthException extends UpstreamException {
  public UpstreamAuthException(int upstreamStatus) {
    super("NASA API key rejected the request.", upstreamStatus);
  }
}
