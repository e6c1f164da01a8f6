package com.example.authsession.adapter.idp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.example.authsession.adapter.idp.dto.UserInfo;
import com.example.authsession.exception.IdpUnavailableException;
import com.example.authsession.exception.OAuth2Exception;
import com.example.authsession.properties.ApplicationProperties;
import com.example.authsession.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

@DisplayName("OidcIdpClient")
class OidcIdpClientTest {

  private MockWebServer server;
  private OidcIdpClient client;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();

    ApplicationProperties properties = TestProperties.withDiscoveryUrl(
        server.url("/.well-known/openid-configuration").toString());
    OkHttpClient httpClient = new OkHttpClient.Builder().callTimeout(5, TimeUnit.SECONDS).build();
    ObjectMapper objectMapper = new ObjectMapper();
    OidcDiscoveryClient discoveryClient = new OidcDiscoveryClient(httpClient, objectMapper, properties);
    client = new OidcIdpClient(properties, discoveryClient, httpClient, objectMapper);

    server.enqueue(json(200, "{"
        + "\"issuer\":\"" + server.url("/") + "\","
        + "\"authorization_endpoint\":\"" + server.url("/authorize") + "\","
        + "\"token_endpoint\":\"" + server.url("/token") + "\","
        + "\"userinfo_endpoint\":\"" + server.url("/userinfo") + "\"}"));
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  private static MockResponse json(int status, String body) {
    return new MockResponse().setResponseCode(status).setHeader("Content-Type", "application/json").setBody(body);
  }

  private RecordedRequest skipDiscovery() throws InterruptedException {
    server.takeRequest();
    return server.takeRequest();
  }

  @Nested
  @DisplayName("Token endpoint")
  class TokenEndpointTests {

    @Test
    @DisplayName("should exchange a code with PKCE and client credentials")
    void shouldExchangeCode() throws InterruptedException {
      server.enqueue(json(200, "{\"access_token\":\"at\",\"refresh_token\":\"rt\",\"id_token\":\"idt\","
          + "\"expires_in\":900,\"token_type\":\"Bearer\"}"));

      IdpClient.TokenResponse tokens = client.exchangeCodeForTokens("the-code", "verifier", "http://app/callback");

      assertEquals("at", tokens.accessToken());
      assertEquals("rt", tokens.refreshToken());
      assertEquals("idt", tokens.idToken());
      assertEquals(900L, tokens.expiresIn());

      RecordedRequest request = skipDiscovery();
      assertEquals("/token", request.getPath());
      assertEquals(Credentials.basic("test-client", "test-secret"), request.getHeader("Authorization"));
      String body = request.getBody().readUtf8();
      assertTrue(body.contains("grant_type=authorization_code"));
      assertTrue(body.contains("code=the-code"));
      assertTrue(body.contains("code_verifier=verifier"));
    }

    @Test
    @DisplayName("should send the refresh_token grant and tolerate a missing expires_in")
    void shouldRefresh() throws InterruptedException {
      server.enqueue(json(200, "{\"access_token\":\"at-2\"}"));

      IdpClient.TokenResponse tokens = client.refreshAccessToken("rt");

      assertEquals("at-2", tokens.accessToken());
      assertNull(tokens.refreshToken());
      assertNull(tokens.expiresIn());
      String body = skipDiscovery().getBody().readUtf8();
      assertTrue(body.contains("grant_type=refresh_token"));
      assertTrue(body.contains("refresh_token=rt"));
    }

    @Test
    @DisplayName("should parse a string expires_in")
    void shouldParseStringExpiresIn() {
      server.enqueue(json(200, "{\"access_token\":\"at\",\"expires_in\":\"120\"}"));

      assertEquals(120L, client.refreshAccessToken("rt").expiresIn());
    }

    @Test
    @DisplayName("should treat a rejected grant as a protocol error")
    void shouldMapClientErrors() {
      server.enqueue(json(400, "{\"error\":\"invalid_grant\"}"));

      assertThrows(OAuth2Exception.class, () -> client.refreshAccessToken("revoked"));
    }

    @Test
    @DisplayName("should treat a server error as the IdP being unavailable")
    void shouldMapServerErrors() {
      server.enqueue(json(503, "{}"));

      assertThrows(IdpUnavailableException.class, () -> client.refreshAccessToken("rt"));
    }

    @Test
    @DisplayName("should reject a response without an access_token")
    void shouldRequireAccessToken() {
      server.enqueue(json(200, "{\"refresh_token\":\"rt\"}"));

      assertThrows(OAuth2Exception.class, () -> client.refreshAccessToken("rt"));
    }
  }

  @Nested
  @DisplayName("Userinfo endpoint")
  class UserInfoTests {

    @Test
    @DisplayName("should send the bearer token and map the claims")
    void shouldFetchUserInfo() throws InterruptedException {
      server.enqueue(json(200, "{\"sub\":\"sub-1\",\"email\":\"a@example.com\",\"given_name\":\"Ada\","
          + "\"family_name\":\"Lovelace\",\"groups\":[\"x\"]}"));

      UserInfo userInfo = client.fetchUserInfo("at");

      assertEquals("sub-1", userInfo.subject());
      assertEquals("Lovelace", userInfo.familyName());
      RecordedRequest request = skipDiscovery();
      assertEquals("/userinfo", request.getPath());
      assertEquals("Bearer at", request.getHeader("Authorization"));
    }

    @Test
    @DisplayName("should reject an invalid access token as a protocol error")
    void shouldMapUnauthorized() {
      server.enqueue(json(401, "{\"error\":\"invalid_token\"}"));

      assertThrows(OAuth2Exception.class, () -> client.fetchUserInfo("expired"));
    }
  }

  @Test
  @DisplayName("should resolve the authorization endpoint from discovery")
  void shouldResolveAuthorizationEndpoint() {
    assertEquals(server.url("/authorize").toString(), client.getAuthorizationEndpoint());
    assertEquals("test-client", client.getClientId());
  }
}
