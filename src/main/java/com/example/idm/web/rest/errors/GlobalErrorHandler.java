package com.example.idm.web.rest.errors;

import com.example.idm.exception.EncryptionException;
import com.example.idm.exception.IdmCacheException;
import com.example.idm.exception.OidcClientException;
import com.example.idm.exception.SessionException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Consistent error bodies without exposing internals.
 */
@Slf4j
@RestControllerAdvice
public class GlobalErrorHandler {

  @ExceptionHandler(OidcClientException.class)
  public ResponseEntity<Map<String, Object>> handleOidcClientException(
      OidcClientException ex, WebRequest request) {
    log.error("Identity provider call failed (error code {})", ex.getErrorCode(), ex);
    return respond(HttpStatus.BAD_GATEWAY, "identity_provider_error",
                   "The identity provider could not complete the request", request);
  }

  @ExceptionHandler(CallNotPermittedException.class)
  public ResponseEntity<Map<String, Object>> handleCircuitOpen(
      CallNotPermittedException ex, WebRequest request) {
    log.warn("Identity provider circuit open: {}", ex.getMessage());
    return respond(HttpStatus.SERVICE_UNAVAILABLE, "service_unavailable",
                   "Service temporarily unavailable", request);
  }

  @ExceptionHandler({IdmCacheException.class, RedisConnectionFailureException.class})
  public ResponseEntity<Map<String, Object>> handleCacheException(
      RuntimeException ex, WebRequest request) {
    log.error("Session store error", ex);
    return respond(HttpStatus.SERVICE_UNAVAILABLE, "service_unavailable",
                   "Service temporarily unavailable", request);
  }

  @ExceptionHandler(SessionException.class)
  public ResponseEntity<Map<String, Object>> handleSessionException(
      SessionException ex, WebRequest request) {
    log.error("Session error", ex);
    return respond(HttpStatus.UNAUTHORIZED, "invalid_session",
                   "Session is invalid or expired", request);
  }

  @ExceptionHandler(EncryptionException.class)
  public ResponseEntity<Map<String, Object>> handleEncryptionException(
      EncryptionException ex, WebRequest request) {
    log.error("Encryption error", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "encryption_error",
                   "An error occurred processing your request", request);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<Map<String, Object>> handleMissingParams(
      MissingServletRequestParameterException ex, WebRequest request) {
    return respond(HttpStatus.BAD_REQUEST, "missing_parameter",
                   String.format("Missing required parameter: %s", ex.getParameterName()), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(
      Exception ex, WebRequest request) {
    log.error("Unexpected error", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
                   "An error occurred processing your request", request);
  }

  private ResponseEntity<Map<String, Object>> respond(
      HttpStatus status, String error, String message, WebRequest request) {

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", Instant.now());
    body.put("status", status.value());
    body.put("error", error);
    body.put("message", message);
    body.put("path", request.getDescription(false).replace("uri=", ""));

    return new ResponseEntity<>(body, status);
  }
}
