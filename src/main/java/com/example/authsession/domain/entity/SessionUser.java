package com.example.authsession.domain.entity;

import com.example.authsession.domain.FailureKind;
import com.example.authsession.domain.TokenStatus;
import com.example.authsession.exception.UpstreamTokenUnavailableException;

/**
 * Authenticated principal resolved from a session cookie.
 * A degraded user keeps its app identity but has no usable upstream access token.
 */
public record SessionUser(
    String sessionId,
    long appUserId,
    String iamSubjectId,
    String email,
    String firstName,
    String lastName,
    String accessToken,
    TokenStatus tokenStatus,
    FailureKind degradation
) {

  public static SessionUser from(String sessionId, SessionRecord record, TokenStatus status, FailureKind degradation) {
    return new SessionUser(
        sessionId,
        record.appUserId(),
        record.iamSubjectId(),
        record.email(),
        record.givenName(),
        record.familyName(),
        record.accessToken(),
        status,
        degradation);
  }

  public boolean isDegraded() {
    return tokenStatus == TokenStatus.DEGRADED;
  }

  /**
   * Returns the upstream access token or fails for operations that cannot run without one.
   */
  public String requireAccessToken() {
    if (accessToken == null) {
      throw new UpstreamTokenUnavailableException(
          "No upstream access token for user " + appUserId + " (" + degradation + ")");
    }
    return accessToken;
  }

  @Override
  public String toString() {
    return "SessionUser[appUserId=" + appUserId + ", tokenStatus=" + tokenStatus + "]";
  }
}
