package com.example.authsession.config;

import com.example.authsession.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.net.MalformedURLException;
import java.net.URL;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Configuration validator for rules beyond JSR-303. Structural errors fail startup;
 * missing IdP client credentials are only logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URL = "%s is invalid: %s";
  private static final String ERROR_MUST_BE_POSITIVE = "%s must be positive.";
  private static final Set<String> SAME_SITE_VALUES = Set.of("lax", "strict", "none");

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration...");
    List<String> errors = new ArrayList<>();

    validateUrls(errors);
    validateSession(errors);
    validateCookie(errors);
    validateHttpConfig(errors);
    validateRefreshLock(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }

    warnOnMissingSecrets();
    log.info("Configuration validated successfully.");
  }

  private void validateUrls(List<String> errors) {
    checkUrl(properties.frontend().url(), "Frontend URL", errors);
    checkUrl(properties.oidc().discoveryUrl(), "OIDC discovery URL", errors);
    checkUrl(properties.oidc().redirectUri(), "OIDC redirect URI", errors);
  }

  private void validateSession(List<String> errors) {
    ApplicationProperties.SessionProperties session = properties.session();
    if (!isPositive(session.ttl())) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted("Session TTL"));
    }
    if (!isPositive(session.refreshBuffer())) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted("Refresh buffer"));
    }
    if (!isPositive(session.refreshLockTtl())) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted("Refresh lock TTL"));
    }
    if (isPositive(session.ttl()) && session.refreshBuffer().compareTo(session.ttl()) >= 0) {
      errors.add("Refresh buffer (%s) must be shorter than the session TTL (%s)."
                     .formatted(session.refreshBuffer(), session.ttl()));
    }
  }

  private void validateCookie(List<String> errors) {
    ApplicationProperties.CookieProperties cookie = properties.cookie();
    if (!SAME_SITE_VALUES.contains(cookie.sameSite().toLowerCase())) {
      errors.add("Cookie SameSite must be one of Lax, Strict, None but was: " + cookie.sameSite());
    }
    if ("none".equalsIgnoreCase(cookie.sameSite()) && !cookie.secure()) {
      log.warn("Cookie SameSite=None requires Secure; falling back to SameSite=Lax");
    }
  }

  private void validateHttpConfig(List<String> errors) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    if (client.maxRequests() < client.maxRequestsPerHost()) {
      errors.add("Total max requests must be greater than or equal to max requests per host.");
    }
  }

  /**
   * A refresh may fetch discovery and then call the token endpoint, each bounded by the
   * HTTP call timeout. The lock has to outlive both or a second request can spend the
   * same refresh token.
   */
  private void validateRefreshLock(List<String> errors) {
    Duration lockTtl = properties.session().refreshLockTtl();
    Duration worstCaseRefresh = maxRefreshDuration();
    if (isPositive(lockTtl) && lockTtl.compareTo(worstCaseRefresh) <= 0) {
      errors.add("Refresh lock TTL (%s) must be longer than the worst-case IdP refresh time (%s)."
                     .formatted(lockTtl, worstCaseRefresh));
    }
  }

  Duration maxRefreshDuration() {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    return client.connectTimeout().plus(client.readTimeout()).multipliedBy(2);
  }

  private void warnOnMissingSecrets() {
    // The missing encryption key is reported by TokenCipherService
    if (!properties.oidc().hasClientCredentials()) {
      log.warn("SECURITY: OIDC client id/secret are not configured; login and token refresh will fail");
    }
  }

  private boolean isPositive(Duration duration) {
    return duration != null && !duration.isNegative() && !duration.isZero();
  }

  private void checkUrl(String url, String fieldName, List<String> errors) {
    try {
      new URL(url);
    } catch (MalformedURLException e) {
      errors.add(ERROR_INVALID_URL.formatted(fieldName, url));
    }
  }
}
