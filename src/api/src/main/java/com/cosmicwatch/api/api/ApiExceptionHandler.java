package com.cosmicwatch.api.api;

import com.cosmicwatch.api.nasa.UpstreamAuthException;
import com.cosmicwatch.api.nasa.UpstreamException;
import com.cosmicwatch.api.nasa.UpstreamRateLimitedException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Centralized REST exception mapping for the API endpoints.
 *
 * <p>Validation and NeoWs failures are converted into stable JSON error payloads.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  /**
   * Maps request validation errors to HTTP 400.
   *
   * @param ex validation exception thrown while resolving parameters
   * @return standardized error payload
   */
  @ExceptionHandler(BadRequestException.class)
  public ResponseEntity<Map<String, Object>> handleBadRequest(BadRequestException ex) {
    return ResponseEntity.badRequest().body(error(ex.getCode(), ex.getMessage()));
  }

  /**
   * Maps NeoWs quota exhaustion (with no cached fallback) to HTTP 503.
   *
   * @param ex rate limit exception
   * @return standardized error payload
   */
  @ExceptionHandler(UpstreamRateLimitedException.class)
  public ResponseEntity<Map<String, Object>> handleRateLimited(UpstreamRateLimitedException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(error("NASA_RATE_LIMIT", ex.getMessage()));
  }

  /**
   * Maps rejected NeoWs credentials to HTTP 502.
   *
   * @param ex auth exception
   * @return standardized error payload
   */
  @ExceptionHandler(UpstreamAuthException.class)
  public ResponseEntity<Map<String, Object>> handleUpstreamAuth(UpstreamAuthException ex) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(error("NASA_AUTH_ERROR", ex.getMessage()));
  }

  /**
   * Maps any other NeoWs failure to HTTP 502, echoing the upstream status.
   *
   * @param ex upstream exception
   * @return standardized error payload
   */
  @ExceptionHandler(UpstreamException.class)
  public ResponseEntity<Map<String, Object>> handleUpstream(UpstreamException ex) {
    Map<String, Object> body = error("NASA_UPSTREAM_ERROR", ex.getMessage());
    body.put("upstream_status", ex.getUpstreamStatus());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
  }

  /**
   * Maps unmatched routes to HTTP 404 instead of generic 500.
   *
   * @param ex Spring MVC no-resource/no-handler exception
   * @return standardized not-found payload
   */
  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<Map<String, Object>> handleMissingRoute(Exception ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(error("not_found", "resource not found"));
  }

  /**
   * Maps unexpected failures to HTTP 500.
   *
   * @param ex unhandled server-side exception
   * @return standardized error payload
   */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
    log.error("Unhandled API failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(error("internal_error", "internal server error"));
  }

  private Map<String, Object> error(String code, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", code);
    body.put("message", message);
    body.put("timestamp", Instant.now().toString());
    return body;
  }
}
