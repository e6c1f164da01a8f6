package com.example.authsession.exception;

/**
 * Raised when the identity provider cannot serve an upstream-token-dependent request
 */
public class IdpUnavailableException extends RuntimeException {
  public IdpUnavailableException(String message) {
    super(message);
  }

  public IdpUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
