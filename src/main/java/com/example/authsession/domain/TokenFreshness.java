package com.example.authsession.domain;

import java.time.Duration;

/**
 * Freshness of a session's upstream access token relative to the refresh buffer.
 */
public enum TokenFreshness {
  // remaining >= buffer
  VALID,
  // 0 < remaining < buffer, a refresh should be attempted
  NEAR_EXPIRY,
  // remaining <= 0
  EXPIRED;

  /**
   * Classifies an access token by its expiry.
   *
   * @param expiryEpochSeconds absolute expiry as Unix seconds (fractional allowed)
   * @param nowEpochSeconds    current time as Unix seconds
   * @param buffer             how long before expiry a refresh is attempted
   */
  public static TokenFreshness classify(double expiryEpochSeconds, double nowEpochSeconds, Duration buffer) {
    double remaining = expiryEpochSeconds - nowEpochSeconds;
    if (remaining <= 0) {
      return EXPIRED;
    }
    if (remaining < buffer.toMillis() / 1000.0) {
      return NEAR_EXPIRY;
    }
    return VALID;
  }
}
