package com.example.authsession.security.filter;

import com.example.authsession.domain.Result;
import com.example.authsession.domain.entity.SessionUser;
import com.example.authsession.properties.ApplicationProperties;
import com.example.authsession.service.SessionService;
import com.example.authsession.util.CookieUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.Optional;

import static com.example.authsession.web.rest.ApiConstants.ApiPath.AUTH_BASE;
import static com.example.authsession.web.rest.ApiConstants.ApiPath.LOGOUT_SESSION;

/**
 * Authenticates requests from the session cookie. A resolved session, degraded or not,
 * becomes a {@link SessionUser} principal; an unknown session clears the cookie.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionAuthenticationFilter extends OncePerRequestFilter {

  private final SessionService sessionService;
  private final ApplicationProperties properties;

  // Logout reads the raw session itself; resolving would only trigger a pointless refresh
  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().endsWith(AUTH_BASE + LOGOUT_SESSION);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain) throws ServletException, IOException {

    Optional<String> sessionId = CookieUtil.getSessionId(request, properties.cookie());

    if (sessionId.isPresent()) {
      Result<SessionUser> resolved = sessionService.resolve(sessionId.get());
      if (resolved.isOk()) {
        SessionUser user = resolved.value();
        SecurityContextHolder.getContext().setAuthentication(
            new UsernamePasswordAuthenticationToken(user, null, Collections.emptyList()));
        log.trace("Authenticated session for user {} ({})", user.appUserId(), user.tokenStatus());
      } else {
        log.debug("Session cookie did not resolve to a user ({}), clearing cookie", resolved.failure());
        CookieUtil.clearSessionCookie(response, properties.cookie());
      }
    }

    filterChain.doFilter(request, response);
  }
}
