package com.example.authsession.util;

import com.example.authsession.properties.ApplicationProperties.CookieProperties;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.web.util.WebUtils;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/**
 * Session cookie handling. All attributes come from {@code app.cookie.*}; the cookie is
 * always HttpOnly and SameSite=None is downgraded to Lax when Secure is off.
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CookieUtil {

  public static Optional<String> getCookieValue(HttpServletRequest request, String name) {
    if (request == null || name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(WebUtils.getCookie(request, name))
        .map(Cookie::getValue)
        .filter(value -> !value.isBlank());
  }

  public static Optional<String> getSessionId(HttpServletRequest request, CookieProperties cookie) {
    return getCookieValue(request, cookie.name());
  }

  public static ResponseCookie sessionCookie(CookieProperties cookie, String sessionId, Duration maxAge) {
    if (sessionId == null || sessionId.isBlank()) {
      throw new IllegalArgumentException("Session ID cannot be null or empty");
    }
    return baseCookie(cookie, sessionId).maxAge(maxAge).build();
  }

  public static void setSessionCookie(HttpServletResponse response, CookieProperties cookie,
                                      String sessionId, Duration maxAge) {
    response.addHeader(HttpHeaders.SET_COOKIE, sessionCookie(cookie, sessionId, maxAge).toString());
    log.debug("Set session cookie: name={}, secure={}, sameSite={}",
              cookie.name(), cookie.secure(), cookie.effectiveSameSite());
  }

  public static ResponseCookie clearedSessionCookie(CookieProperties cookie) {
    return baseCookie(cookie, "").maxAge(0).build();
  }

  public static void clearSessionCookie(HttpServletResponse response, CookieProperties cookie) {
    response.addHeader(HttpHeaders.SET_COOKIE, clearedSessionCookie(cookie).toString());
    log.debug("Cleared session cookie: name={}", cookie.name());
  }

  /**
   * True when the response already carries a Set-Cookie header for {@code name}.
   */
  public static boolean hasSetCookie(HttpServletResponse response, String name) {
    Collection<String> headers = response.getHeaders(HttpHeaders.SET_COOKIE);
    String prefix = name + "=";
    return headers != null && headers.stream().anyMatch(header -> header.startsWith(prefix));
  }

  private static ResponseCookie.ResponseCookieBuilder baseCookie(CookieProperties cookie, String value) {
    ResponseCookie.ResponseCookieBuilder builder = ResponseCookie.from(cookie.name(), value)
        .httpOnly(true)
        .secure(cookie.secure())
        .path(cookie.path())
        .sameSite(cookie.effectiveSameSite());
    if (cookie.domain() != null && !cookie.domain().isBlank()) {
      builder.domain(cookie.domain());
    }
    return builder;
  }
}
