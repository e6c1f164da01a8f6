package com.example.authsession.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.example.authsession.adapter.idp.IdpClient;
import com.example.authsession.adapter.memory.InMemorySessionStore;
import com.example.authsession.domain.FailureKind;
import com.example.authsession.domain.Result;
import com.example.authsession.domain.TokenStatus;
import com.example.authsession.domain.entity.SessionRecord;
import com.example.authsession.domain.entity.SessionUser;
import com.example.authsession.exception.SessionException;
import com.example.authsession.properties.ApplicationProperties;
import com.example.authsession.support.MutableClock;
import com.example.authsession.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

@DisplayName("SessionService")
class SessionServiceTest {

  private MutableClock clock;
  private InMemorySessionStore store;
  private IdpClient idpClient;
  private SessionService sessionService;

  @BeforeEach
  void setUp() {
    ApplicationProperties properties = TestProperties.defaults();
    clock = MutableClock.atEpochSecond(1_700_000_000L);
    store = new InMemorySessionStore(clock);
    SessionRecordCodec codec = new SessionRecordCodec(new ObjectMapper(), properties);
    idpClient = mock(IdpClient.class);
    TokenRefreshCoordinator coordinator = new TokenRefreshCoordinator(
        store, codec, mock(RefreshTokenService.class), idpClient, properties, clock);
    sessionService = new SessionService(store, codec, coordinator, properties);
  }

  private SessionRecord record(double expiresInSeconds) {
    return new SessionRecord(5L, "sub-5", "e@example.com", "Eve", "Example", "at",
                             clock.epochSeconds() + expiresInSeconds);
  }

  @Nested
  @DisplayName("Creating sessions")
  class CreateTests {

    @Test
    @DisplayName("should issue unguessable url-safe ids")
    void shouldIssueRandomIds() {
      String first = sessionService.createSession(record(3600));
      String second = sessionService.createSession(record(3600));

      assertNotEquals(first, second);
      assertEquals(43, first.length());
      assertTrue(first.matches("[A-Za-z0-9_-]+"));
    }

    @Test
    @DisplayName("should wrap store failures")
    void shouldWrapStoreFailures() {
      SessionStore failing = mock(SessionStore.class);
      doThrow(new IllegalStateException("redis down")).when(failing).set(anyString(), anyString(), any());
      ApplicationProperties properties = TestProperties.defaults();
      SessionRecordCodec codec = new SessionRecordCodec(new ObjectMapper(), properties);
      SessionService service = new SessionService(failing, codec, null, properties);

      assertThrows(SessionException.class, () -> service.createSession(record(3600)));
    }
  }

  @Nested
  @DisplayName("Resolving sessions")
  class ResolveTests {

    @Test
    @DisplayName("should resolve a freshly created session")
    void shouldResolveCreatedSession() {
      String sessionId = sessionService.createSession(record(3600));

      Result<SessionUser> result = sessionService.resolve(sessionId);

      assertTrue(result.isOk());
      assertEquals(5L, result.value().appUserId());
      assertEquals(TokenStatus.ACTIVE, result.value().tokenStatus());
      verifyNoInteractions(idpClient);
    }

    @Test
    @DisplayName("should reject missing, blank and unknown ids")
    void shouldRejectUnknownIds() {
      assertEquals(FailureKind.NOT_AUTHENTICATED, sessionService.resolve(null).failure());
      assertEquals(FailureKind.NOT_AUTHENTICATED, sessionService.resolve(" ").failure());
      assertEquals(FailureKind.NOT_AUTHENTICATED, sessionService.resolve("never-created-id").failure());
    }

    @Test
    @DisplayName("should reject a session after its TTL")
    void shouldRejectExpiredSession() {
      String sessionId = sessionService.createSession(record(7200));
      clock.advance(Duration.ofHours(1));

      assertTrue(sessionService.findUser(sessionId).isEmpty());
    }

    @Test
    @DisplayName("should extend the TTL on every lookup")
    void shouldRollTtl() {
      String sessionId = sessionService.createSession(record(7200));

      clock.advance(Duration.ofMinutes(50));
      assertTrue(sessionService.findUser(sessionId).isPresent());
      clock.advance(Duration.ofMinutes(50));

      assertTrue(sessionService.findUser(sessionId).isPresent());
    }

    @Test
    @DisplayName("should reject a corrupted record")
    void shouldRejectCorruptedRecord() {
      store.set("user_session:corrupted-id", "{oops", Duration.ofHours(1));

      assertEquals(FailureKind.NOT_AUTHENTICATED, sessionService.resolve("corrupted-id").failure());
    }

    @Test
    @DisplayName("should map store failures to NOT_AUTHENTICATED")
    void shouldMapStoreFailures() {
      SessionStore failing = mock(SessionStore.class);
      when(failing.get(anyString())).thenThrow(new IllegalStateException("redis down"));
      ApplicationProperties properties = TestProperties.defaults();
      SessionService service = new SessionService(
          failing, new SessionRecordCodec(new ObjectMapper(), properties), null, properties);

      assertEquals(FailureKind.NOT_AUTHENTICATED, service.resolve("any-session-id").failure());
    }
  }

  @Test
  @DisplayName("should no longer resolve an invalidated session")
  void shouldInvalidate() {
    String sessionId = sessionService.createSession(record(3600));

    sessionService.invalidate(sessionId);

    assertTrue(sessionService.findUser(sessionId).isEmpty());
    assertTrue(sessionService.load(sessionId).isEmpty());
  }
}
