package com.example.authsession.web.rest.controller;

import static com.example.authsession.web.rest.ApiConstants.ErrorCode.AUTH_FAILED;

import com.example.authsession.domain.entity.SessionUser;
import com.example.authsession.exception.IdpUnavailableException;
import com.example.authsession.exception.OAuth2Exception;
import com.example.authsession.exception.SessionException;
import com.example.authsession.properties.ApplicationProperties;
import com.example.authsession.service.LoginService;
import com.example.authsession.service.OAuth2Service;
import com.example.authsession.util.CookieUtil;
import com.example.authsession.web.rest.dto.SessionStatusResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.Map;

/**
 * OIDC login/callback and session lifecycle endpoints.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class AuthController implements AuthAPI {

  private final OAuth2Service oauth2Service;
  private final LoginService loginService;
  private final ApplicationProperties properties;

  @Override
  public ResponseEntity<Void> login(String returnTo) {
    String authUrl = oauth2Service.generateAuthorizationUrl(returnTo);
    log.debug("Redirecting to identity provider for login");

    return ResponseEntity.status(HttpStatus.FOUND)
        .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
        .location(URI.create(authUrl))
        .build();
  }

  /**
   * Protocol and IdP failures redirect to the frontend error page. Database failures are not
   * caught here: they surface as a 500 from the error handler, before any cookie is set.
   */
  @Override
  public ResponseEntity<Void> callback(String code, String state) {
    if (code == null || code.isBlank() || state == null || state.isBlank()) {
      log.warn("OIDC callback without code or state");
      return redirectToErrorPage(AUTH_FAILED);
    }

    OAuth2Service.CallbackResult result;
    try {
      result = oauth2Service.processCallback(code, state);
    } catch (OAuth2AuthenticationException e) {
      log.warn("OIDC callback rejected: {}", e.getError().getDescription());
      return redirectToErrorPage(AUTH_FAILED);
    } catch (OAuth2Exception | IdpUnavailableException e) {
      log.error("OIDC callback processing failed: {}", e.getMessage());
      return redirectToErrorPage(AUTH_FAILED);
    }

    String sessionId;
    try {
      sessionId = loginService.completeLogin(result.userInfo(), result.tokens());
    } catch (SessionException e) {
      log.error("Session could not be created after login", e);
      return redirectToErrorPage(AUTH_FAILED);
    }

    ResponseCookie cookie = CookieUtil.sessionCookie(properties.cookie(), sessionId, properties.session().ttl());
    return ResponseEntity.status(HttpStatus.FOUND)
        .header(HttpHeaders.SET_COOKIE, cookie.toString())
        .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
        .location(URI.create(properties.frontend().url() + result.returnTo()))
        .build();
  }

  @Override
  public ResponseEntity<Map<String, String>> logout(HttpServletRequest request) {
    CookieUtil.getSessionId(request, properties.cookie()).ifPresent(sessionId -> {
      try {
        loginService.logout(sessionId);
      } catch (RuntimeException e) {
        log.error("Logout could not clean up server-side state", e);
      }
    });

    return ResponseEntity.ok()
        .header(HttpHeaders.SET_COOKIE, CookieUtil.clearedSessionCookie(properties.cookie()).toString())
        .body(Map.of("status", "logout successful"));
  }

  @Override
  public ResponseEntity<SessionStatusResponse> session(SessionUser user) {
    if (user == null) {
      return ResponseEntity.ok(SessionStatusResponse.anonymous());
    }
    return ResponseEntity.ok(new SessionStatusResponse(true, user.tokenStatus()));
  }

  private ResponseEntity<Void> redirectToErrorPage(String error) {
    String errorUrl = properties.frontend().url() + "/auth/error?code=" + error;
    return ResponseEntity.status(HttpStatus.FOUND)
        .location(URI.create(errorUrl))
        .build();
  }
}
