package com.example.authsession.domain;

/**
 * State of the upstream access token after a session lookup.
 */
public enum TokenStatus {
  ACTIVE,
  REFRESHED,
  DEGRADED
}
