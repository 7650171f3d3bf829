package com.cosmicwatch.api.api;

/**
 * Domain-level exception used for request validation failures.
 *
 * <p>Mapped to HTTP 400 by {@link ApiExceptionHandler}.
 */
public class BadRequestException extends RuntimeException {
  private final String code;

  /**
   * Creates a bad-request exception with a stable error code and a client-facing message.
   *
   * @param code machine-readable error code (for example {@code INVALID_DATE_RANGE})
   * @param message validation error description
   */
  public BadRequestException(String code, String message) {
    super(message);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
