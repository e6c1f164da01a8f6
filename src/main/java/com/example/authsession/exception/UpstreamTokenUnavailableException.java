package com.example.authsession.exception;

/**
 * Raised when an operation needs the upstream access token but the session is degraded
 */
public class UpstreamTokenUnavailableException extends RuntimeException {
  public UpstreamTokenUnavailableException(String message) {
    super(message);
  }

  public UpstreamTokenUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
