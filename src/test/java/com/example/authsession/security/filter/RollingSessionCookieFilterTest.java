package com.example.authsession.security.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import com.example.authsession.support.TestProperties;
import com.example.authsession.util.CookieUtil;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletResponse;

@DisplayName("RollingSessionCookieFilter")
class RollingSessionCookieFilterTest {

  private final RollingSessionCookieFilter filter = new RollingSessionCookieFilter(TestProperties.defaults());

  private static final FilterChain WRITES_BODY = (request, response) -> response.getWriter().write("{\"ok\":true}");

  private MockHttpServletRequest requestWithCookie() {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/users/me_from_session");
    request.setCookies(new Cookie(TestProperties.COOKIE_NAME, "existing-id"));
    return request;
  }

  @Test
  @DisplayName("should re-issue the same session id with the full TTL")
  void shouldRollCookie() throws ServletException, IOException {
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(requestWithCookie(), response, WRITES_BODY);

    List<String> cookies = response.getHeaders("Set-Cookie");
    assertEquals(1, cookies.size());
    assertTrue(cookies.get(0).startsWith(TestProperties.COOKIE_NAME + "=existing-id"));
    assertTrue(cookies.get(0).contains("Max-Age=" + Duration.ofHours(1).toSeconds()));
    assertEquals("{\"ok\":true}", response.getContentAsString());
  }

  @Test
  @DisplayName("should not set a cookie for anonymous requests")
  void shouldSkipWithoutCookie() throws ServletException, IOException {
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(new MockHttpServletRequest("GET", "/api/auth/session"), response, WRITES_BODY);

    assertTrue(response.getHeaders("Set-Cookie").isEmpty());
  }

  @Test
  @DisplayName("should leave a cookie set by the handler untouched")
  void shouldNotDuplicateHandlerCookie() throws ServletException, IOException {
    MockHttpServletResponse response = new MockHttpServletResponse();
    FilterChain clearsCookie = (request, res) ->
        CookieUtil.clearSessionCookie((HttpServletResponse) res, TestProperties.defaults().cookie());

    filter.doFilter(requestWithCookie(), response, clearsCookie);

    List<String> cookies = response.getHeaders("Set-Cookie");
    assertEquals(1, cookies.size());
    assertTrue(cookies.get(0).contains("Max-Age=0"));
  }
}
