package com.example.authsession.service;

import com.example.authsession.adapter.idp.IdpClient;
import com.example.authsession.domain.FailureKind;
import com.example.authsession.domain.Result;
import com.example.authsession.domain.TokenFreshness;
import com.example.authsession.domain.TokenStatus;
import com.example.authsession.domain.entity.SessionRecord;
import com.example.authsession.domain.entity.SessionUser;
import com.example.authsession.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import static com.example.authsession.service.SessionRecordCodec.mask;

/**
 * Decides per request whether a session's upstream access token is passed through,
 * refreshed, or dropped. The app session itself is never deleted here: a failed or
 * impossible refresh only nulls the access-token fields.
 * <p>
 * Refreshes are serialized per (user, provider) with a short-lived lock in the session
 * store so that concurrent requests near expiry do not race to rotate the refresh token.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenRefreshCoordinator {

  static final String LOCK_PREFIX = "refresh_lock:";
  private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

  private final SessionStore sessionStore;
  private final SessionRecordCodec codec;
  private final RefreshTokenService refreshTokenService;
  private final IdpClient idpClient;
  private final ApplicationProperties properties;
  private final Clock clock;

  /**
   * Evaluates the access token embedded in {@code record} and returns the resolved user.
   * Returns NOT_AUTHENTICATED only if the session was deleted (logout) before the
   * updated record could be written back; a deleted session is never recreated.
   */
  public Result<SessionUser> evaluate(String sessionId, SessionRecord record) {
    if (!record.hasAccessToken()) {
      return Result.ok(SessionUser.from(sessionId, record.withoutAccessToken(), TokenStatus.DEGRADED,
                                        FailureKind.TOKEN_EXPIRED));
    }

    TokenFreshness freshness = freshnessOf(record);
    log.debug("Session {} access token is {}", mask(sessionId), freshness);

    return switch (freshness) {
      case VALID -> Result.ok(SessionUser.from(sessionId, record, TokenStatus.ACTIVE, null));
      case EXPIRED -> degrade(sessionId, record, FailureKind.TOKEN_EXPIRED);
      case NEAR_EXPIRY -> refreshUnderLock(sessionId, record);
    };
  }

  TokenFreshness freshnessOf(SessionRecord record) {
    return TokenFreshness.classify(record.accessTokenExpiry(), nowSeconds(), properties.session().refreshBuffer());
  }

  private Result<SessionUser> refreshUnderLock(String sessionId, SessionRecord record) {
    String lockKey = LOCK_PREFIX + record.appUserId() + ":" + properties.oidc().providerName();
    Optional<String> lockToken = sessionStore.tryLock(lockKey, properties.session().refreshLockTtl());

    if (lockToken.isEmpty()) {
      // Another request is refreshing; the current token has not expired yet
      log.debug("Refresh for user {} already in progress, passing token through", record.appUserId());
      return Result.ok(SessionUser.from(sessionId, record, TokenStatus.ACTIVE, null));
    }

    try {
      Optional<SessionRecord> latest = reread(sessionId);
      if (latest.isEmpty()) {
        log.info("Session {} vanished during refresh", mask(sessionId));
        return Result.err(FailureKind.NOT_AUTHENTICATED);
      }
      SessionRecord current = latest.get();
      if (current.hasAccessToken() && freshnessOf(current) == TokenFreshness.VALID) {
        return Result.ok(SessionUser.from(sessionId, current, TokenStatus.ACTIVE, null));
      }

      Result<TokenGrant> grant = refresh(current.appUserId());
      if (!grant.isOk()) {
        log.info("Access token refresh for user {} failed ({}); keeping app session", current.appUserId(),
                 grant.failure());
        return degrade(sessionId, current, grant.failure());
      }

      SessionRecord refreshed = current.withAccessToken(grant.value().accessToken(), grant.value().expiry());
      if (!writeBack(sessionId, refreshed)) {
        return Result.err(FailureKind.NOT_AUTHENTICATED);
      }
      log.debug("Refreshed access token for user {}", current.appUserId());
      return Result.ok(SessionUser.from(sessionId, refreshed, TokenStatus.REFRESHED, null));

    } finally {
      sessionStore.unlock(lockKey, lockToken.get());
    }
  }

  /**
   * Runs the refresh-token grant. Never throws; every failure is a {@link FailureKind}.
   */
  Result<TokenGrant> refresh(long userId) {
    Result<String> refreshToken;
    try {
      refreshToken = refreshTokenService.loadRefreshToken(userId);
    } catch (RuntimeException e) {
      log.error("Could not load refresh token for user {}", userId, e);
      return Result.err(FailureKind.UPSTREAM_ERROR);
    }
    if (!refreshToken.isOk()) {
      return Result.err(refreshToken.failure());
    }

    IdpClient.TokenResponse response;
    try {
      response = idpClient.refreshAccessToken(refreshToken.value());
    } catch (RuntimeException e) {
      log.warn("IdP refresh call failed for user {}: {}", userId, e.getMessage());
      return Result.err(FailureKind.UPSTREAM_ERROR);
    }

    if (response.refreshToken() != null) {
      try {
        refreshTokenService.rotate(userId, response.refreshToken());
      } catch (RuntimeException e) {
        log.error("Failed to persist rotated refresh token for user {}", userId, e);
      }
    }

    return Result.ok(new TokenGrant(response.accessToken(), expiryOf(response)));
  }

  /**
   * Absolute expiry (epoch seconds) of a freshly issued access token.
   */
  double expiryOf(IdpClient.TokenResponse response) {
    Integer override = properties.oidc().fakeExpiresIn();
    long expiresIn;
    if (override != null) {
      expiresIn = override;
    } else {
      expiresIn = response.expiresIn() != null ? response.expiresIn() : DEFAULT_EXPIRES_IN_SECONDS;
    }
    return nowSeconds() + expiresIn;
  }

  private Result<SessionUser> degrade(String sessionId, SessionRecord record, FailureKind cause) {
    SessionRecord truncated = record.withoutAccessToken();
    if (!writeBack(sessionId, truncated)) {
      return Result.err(FailureKind.NOT_AUTHENTICATED);
    }
    return Result.ok(SessionUser.from(sessionId, truncated, TokenStatus.DEGRADED, cause));
  }

  private Optional<SessionRecord> reread(String sessionId) {
    return sessionStore.get(codec.key(sessionId)).flatMap(json -> codec.decode(sessionId, json));
  }

  /**
   * Writes the record with a full TTL unless the session was deleted meanwhile.
   */
  private boolean writeBack(String sessionId, SessionRecord record) {
    Duration ttl = properties.session().ttl();
    boolean written = sessionStore.replaceIfPresent(codec.key(sessionId), codec.encode(record), ttl);
    if (!written) {
      log.info("Session {} was deleted during token evaluation, not restoring it", mask(sessionId));
    }
    return written;
  }

  private double nowSeconds() {
    return clock.millis() / 1000.0;
  }

  record TokenGrant(String accessToken, double expiry) {}
}
