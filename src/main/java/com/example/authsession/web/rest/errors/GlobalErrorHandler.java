package com.example.authsession.web.rest.errors;

import static com.example.authsession.web.rest.ApiConstants.ErrorCode.UPSTREAM_TOKEN_UNAVAILABLE;

import com.example.authsession.exception.IdpUnavailableException;
import com.example.authsession.exception.OAuth2Exception;
import com.example.authsession.exception.SessionException;
import com.example.authsession.exception.UpstreamTokenUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global Error Handler
 *
 * Provides consistent error responses without exposing sensitive information
 */
@Slf4j
@RestControllerAdvice
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public class GlobalErrorHandler {

  @ExceptionHandler(OAuth2AuthenticationException.class)
  public ResponseEntity<Map<String, Object>> handleOAuth2AuthenticationException(
      OAuth2AuthenticationException ex, WebRequest request) {
    log.warn("OAuth2 authentication error: {}", ex.getError().getErrorCode());
    return respond(HttpStatus.UNAUTHORIZED, ex.getError().getErrorCode(), ex.getError().getDescription(), request);
  }

  @ExceptionHandler(OAuth2Exception.class)
  public ResponseEntity<Map<String, Object>> handleOAuth2Exception(
      OAuth2Exception ex, WebRequest request) {
    log.error("OAuth2 error", ex);
    return respond(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage(), request);
  }

  @ExceptionHandler(SessionException.class)
  public ResponseEntity<Map<String, Object>> handleSessionException(
      SessionException ex, WebRequest request) {
    log.debug("Session error: {}", ex.getMessage());
    return respond(HttpStatus.UNAUTHORIZED, "invalid_session", "Session is invalid or expired", request);
  }

  @ExceptionHandler(UpstreamTokenUnavailableException.class)
  public ResponseEntity<Map<String, Object>> handleUpstreamTokenUnavailable(
      UpstreamTokenUnavailableException ex, WebRequest request) {
    log.info("Upstream token unavailable: {}", ex.getMessage());
    return respond(HttpStatus.UNAUTHORIZED, UPSTREAM_TOKEN_UNAVAILABLE,
                   "Identity provider session expired; log in again to use this feature", request);
  }

  @ExceptionHandler(IdpUnavailableException.class)
  public ResponseEntity<Map<String, Object>> handleIdpUnavailable(
      IdpUnavailableException ex, WebRequest request) {
    log.error("Identity provider unavailable", ex);
    return respond(HttpStatus.BAD_GATEWAY, "idp_unavailable", "Identity provider is unavailable", request);
  }

  @ExceptionHandler({DataAccessException.class, TransactionException.class})
  public ResponseEntity<Map<String, Object>> handlePersistenceException(
      RuntimeException ex, WebRequest request) {
    log.error("Database error", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "persistence_error",
                   "An error occurred processing your request", request);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<Map<String, Object>> handleMissingParams(
      MissingServletRequestParameterException ex, WebRequest request) {
    return respond(HttpStatus.BAD_REQUEST, "missing_parameter",
                   String.format("Missing required parameter: %s", ex.getParameterName()), request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    return respond(HttpStatus.METHOD_NOT_ALLOWED, "method_not_allowed",
                   String.format("Method %s not supported", ex.getMethod()), request);
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
    body.put("path", extractPath(request));

    return new ResponseEntity<>(body, status);
  }

  private String extractPath(WebRequest request) {
    String description = request.getDescription(false);
    return description.replace("uri=", "");
  }
}
