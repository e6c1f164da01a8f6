package com.example.authsession.service;

import com.example.authsession.domain.FailureKind;
import com.example.authsession.domain.Result;
import com.example.authsession.domain.entity.SessionRecord;
import com.example.authsession.domain.entity.SessionUser;
import com.example.authsession.exception.SessionException;
import com.example.authsession.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

import static com.example.authsession.service.SessionRecordCodec.mask;

/**
 * Session lifecycle: lookup with rolling TTL, creation at login, invalidation at logout.
 * Lookups never throw; every failure resolves to NOT_AUTHENTICATED or a degraded user.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionService {

  private static final int SESSION_ID_ENTROPY_BYTES = 32;
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final SessionStore sessionStore;
  private final SessionRecordCodec codec;
  private final TokenRefreshCoordinator refreshCoordinator;
  private final ApplicationProperties properties;

  public Result<SessionUser> resolve(String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      return Result.err(FailureKind.NOT_AUTHENTICATED);
    }

    try {
      String key = codec.key(sessionId);
      Optional<SessionRecord> record = load(sessionId);
      if (record.isEmpty()) {
        log.debug("No valid session for {}", mask(sessionId));
        return Result.err(FailureKind.NOT_AUTHENTICATED);
      }

      sessionStore.expire(key, properties.session().ttl());
      return refreshCoordinator.evaluate(sessionId, record.get());

    } catch (RuntimeException e) {
      log.error("Session lookup failed for session: {}", mask(sessionId), e);
      return Result.err(FailureKind.NOT_AUTHENTICATED);
    }
  }

  public Optional<SessionUser> findUser(String sessionId) {
    return resolve(sessionId).toOptional();
  }

  /**
   * Reads the stored record as-is: no TTL extension, no token evaluation.
   */
  public Optional<SessionRecord> load(String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      return Optional.empty();
    }
    return sessionStore.get(codec.key(sessionId)).flatMap(json -> codec.decode(sessionId, json));
  }

  public String createSession(SessionRecord record) {
    String sessionId = generateSecureSessionId();
    try {
      sessionStore.set(codec.key(sessionId), codec.encode(record), properties.session().ttl());
    } catch (SessionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SessionException("Failed to create session", e);
    }
    log.info("Created session {} for user {}", mask(sessionId), record.appUserId());
    return sessionId;
  }

  public void invalidate(String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      return;
    }
    sessionStore.delete(codec.key(sessionId));
    log.debug("Invalidated session {}", mask(sessionId));
  }

  private String generateSecureSessionId() {
    byte[] randomBytes = new byte[SESSION_ID_ENTROPY_BYTES];
    SECURE_RANDOM.nextBytes(randomBytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
  }
}
