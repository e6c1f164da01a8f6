package com.example.authsession.domain;

/**
 * Why a session lookup or token refresh did not produce a usable value.
 */
public enum FailureKind {
  NOT_AUTHENTICATED,
  TOKEN_EXPIRED,
  NO_REFRESH_TOKEN,
  DECRYPTION_FAILED,
  UPSTREAM_ERROR,
  CONFIGURATION
}
