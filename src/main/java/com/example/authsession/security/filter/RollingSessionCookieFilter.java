package com.example.authsession.security.filter;

import com.example.authsession.properties.ApplicationProperties;
import com.example.authsession.util.CookieUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.Optional;

/**
 * Re-stamps the incoming session cookie with the full max-age on every response, keeping the
 * same session id. Responses that already set the session cookie (login, logout, a cleared
 * invalid session) are left alone.
 * <p>
 * The body is buffered so headers can still be added after the handler has written it.
 */
@Slf4j
@RequiredArgsConstructor
public class RollingSessionCookieFilter extends OncePerRequestFilter {

  private final ApplicationProperties properties;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain) throws ServletException, IOException {

    ContentCachingResponseWrapper wrapped = new ContentCachingResponseWrapper(response);
    try {
      filterChain.doFilter(request, wrapped);
    } finally {
      roll(request, wrapped);
      wrapped.copyBodyToResponse();
    }
  }

  private void roll(HttpServletRequest request, HttpServletResponse response) {
    ApplicationProperties.CookieProperties cookie = properties.cookie();
    if (response.isCommitted() || CookieUtil.hasSetCookie(response, cookie.name())) {
      return;
    }
    Optional<String> sessionId = CookieUtil.getSessionId(request, cookie);
    sessionId.ifPresent(id -> CookieUtil.setSessionCookie(response, cookie, id, properties.session().ttl()));
  }
}
