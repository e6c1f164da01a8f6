package com.example.authsession.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.authsession.properties.ApplicationProperties;
import com.example.authsession.properties.ApplicationProperties.CookieProperties;
import com.example.authsession.properties.ApplicationProperties.OkHttpProperties;
import com.example.authsession.properties.ApplicationProperties.SessionProperties;
import com.example.authsession.support.TestProperties;

@DisplayName("ConfigurationValidator")
class ConfigurationValidatorTest {

  private static ApplicationProperties with(SessionProperties session, CookieProperties cookie,
                                            OkHttpProperties http, String discoveryUrl) {
    ApplicationProperties base = TestProperties.defaults();
    ApplicationProperties.OidcProperties oidc = base.oidc();
    return new ApplicationProperties(
        base.frontend(),
        session != null ? session : base.session(),
        cookie != null ? cookie : base.cookie(),
        new ApplicationProperties.OidcProperties(
            oidc.providerName(), discoveryUrl != null ? discoveryUrl : oidc.discoveryUrl(), oidc.clientId(),
            oidc.clientSecret(), oidc.redirectUri(), oidc.scope(), oidc.fakeExpiresIn(), oidc.metadataCacheTtl()),
        base.crypto(),
        http != null ? http : base.http(),
        base.redis());
  }

  private static SessionProperties session(Duration ttl, Duration buffer) {
    return lockTtl(ttl, buffer, Duration.ofSeconds(15));
  }

  private static SessionProperties lockTtl(Duration ttl, Duration buffer, Duration lockTtl) {
    return new SessionProperties(ttl, buffer, "user_session:", lockTtl, "memory");
  }

  private static IllegalStateException failure(ApplicationProperties properties) {
    return assertThrows(IllegalStateException.class,
                        () -> new ConfigurationValidator(properties).afterPropertiesSet());
  }

  @Test
  @DisplayName("should accept the default test configuration")
  void shouldAcceptDefaults() {
    assertDoesNotThrow(() -> new ConfigurationValidator(TestProperties.defaults()).afterPropertiesSet());
  }

  @Test
  @DisplayName("should accept SameSite=None without Secure and only warn")
  void shouldWarnOnInsecureNone() {
    ApplicationProperties properties = with(null, new CookieProperties("sid", false, "None", null, "/"), null, null);

    assertDoesNotThrow(() -> new ConfigurationValidator(properties).afterPropertiesSet());
  }

  @Test
  @DisplayName("should reject a refresh buffer not shorter than the session TTL")
  void shouldRejectOversizedBuffer() {
    IllegalStateException e = failure(with(session(Duration.ofMinutes(5), Duration.ofMinutes(5)), null, null, null));

    assertTrue(e.getMessage().contains("Refresh buffer"));
  }

  @Test
  @DisplayName("should reject non-positive durations")
  void shouldRejectNonPositiveDurations() {
    IllegalStateException e = failure(with(session(Duration.ZERO, Duration.ofSeconds(300)), null, null, null));

    assertTrue(e.getMessage().contains("Session TTL must be positive"));
  }

  @Test
  @DisplayName("should reject an unknown SameSite value")
  void shouldRejectUnknownSameSite() {
    IllegalStateException e = failure(with(null, new CookieProperties("sid", true, "Sometimes", null, "/"), null, null));

    assertTrue(e.getMessage().contains("SameSite"));
  }

  @Test
  @DisplayName("should reject a malformed discovery URL")
  void shouldRejectMalformedUrl() {
    IllegalStateException e = failure(with(null, null, null, "not a url"));

    assertTrue(e.getMessage().contains("OIDC discovery URL"));
  }

  @Test
  @DisplayName("should reject a refresh lock that a slow IdP call can outlive")
  void shouldRejectShortRefreshLock() {
    // 2s connect + 2s read, discovery plus token call
    IllegalStateException e = failure(with(
        lockTtl(Duration.ofHours(1), Duration.ofSeconds(300), Duration.ofSeconds(8)), null, null, null));

    assertTrue(e.getMessage().contains("Refresh lock TTL (PT8S)"));
    assertTrue(e.getMessage().contains("PT8S)."));
  }

  @Test
  @DisplayName("should accept a refresh lock longer than the worst-case IdP refresh")
  void shouldAcceptLongRefreshLock() {
    ApplicationProperties properties = with(
        lockTtl(Duration.ofHours(1), Duration.ofSeconds(300), Duration.ofSeconds(9)), null, null, null);

    assertDoesNotThrow(() -> new ConfigurationValidator(properties).afterPropertiesSet());
    assertEquals(Duration.ofSeconds(8), new ConfigurationValidator(properties).maxRefreshDuration());
  }

  @Test
  @DisplayName("should report every error at once")
  void shouldCollectErrors() {
    OkHttpProperties http = new OkHttpProperties(new OkHttpProperties.ClientProperties(
        5, 1, 2, 10, Duration.ofSeconds(1), Duration.ofSeconds(1)));
    IllegalStateException e = failure(with(null, new CookieProperties("sid", true, "bogus", null, "/"), http, null));

    assertTrue(e.getMessage().contains("2 error(s)"));
  }
}
