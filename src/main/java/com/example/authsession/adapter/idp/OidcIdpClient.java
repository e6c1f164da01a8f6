package com.example.authsession.adapter.idp;

import com.example.authsession.adapter.idp.dto.UserInfo;
import com.example.authsession.exception.IdpUnavailableException;
import com.example.authsession.exception.OAuth2Exception;
import com.example.authsession.properties.ApplicationProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class OidcIdpClient implements IdpClient {

  private static final String CIRCUIT_BREAKER = "oidcProvider";

  private final ApplicationProperties properties;
  private final OidcDiscoveryClient discoveryClient;
  private final OkHttpClient defaultOkHttpClient;
  private final ObjectMapper objectMapper;

  @Override
  public String getAuthorizationEndpoint() {
    return discoveryClient.getMetadata().authorizationEndpoint();
  }

  @Override
  public String getClientId() {
    return properties.oidc().clientId();
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "exchangeCodeFallback")
  public TokenResponse exchangeCodeForTokens(String code, String codeVerifier, String redirectUri) {
    log.debug("Exchanging authorization code for tokens");

    FormBody formBody = new FormBody.Builder()
        .add("grant_type", "authorization_code")
        .add("code", code)
        .add("redirect_uri", redirectUri)
        .add("code_verifier", codeVerifier)
        .build();

    return postToTokenEndpoint(formBody, "Token exchange");
  }

  public TokenResponse exchangeCodeFallback(String code, String codeVerifier,
                                            String redirectUri, Throwable ex) {
    throw fallbackException("token exchange", ex);
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "refreshFallback")
  public TokenResponse refreshAccessToken(String refreshToken) {
    log.debug("Refreshing access token");

    FormBody formBody = new FormBody.Builder()
        .add("grant_type", "refresh_token")
        .add("refresh_token", refreshToken)
        .build();

    return postToTokenEndpoint(formBody, "Token refresh");
  }

  public TokenResponse refreshFallback(String refreshToken, Throwable ex) {
    throw fallbackException("token refresh", ex);
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "userInfoFallback")
  public UserInfo fetchUserInfo(String accessToken) {
    String userinfoEndpoint = discoveryClient.getMetadata().userinfoEndpoint();
    if (userinfoEndpoint == null) {
      throw new OAuth2Exception("IdP does not advertise a userinfo endpoint");
    }

    Request request = new Request.Builder()
        .url(userinfoEndpoint)
        .header("Authorization", "Bearer " + accessToken)
        .header("Accept", "application/json")
        .get()
        .build();

    try (Response response = defaultOkHttpClient.newCall(request).execute()) {
      ensureSuccess(response, "Userinfo request");
      return objectMapper.readValue(response.body().string(), UserInfo.class);
    } catch (IOException e) {
      throw new IdpUnavailableException("Userinfo request failed due to network error", e);
    }
  }

  public UserInfo userInfoFallback(String accessToken, Throwable ex) {
    throw fallbackException("userinfo", ex);
  }

  private TokenResponse postToTokenEndpoint(FormBody formBody, String operation) {
    String clientSecret = properties.oidc().clientSecret();
    String credentials = Credentials.basic(getClientId(), clientSecret == null ? "" : clientSecret);

    Request request = new Request.Builder()
        .url(discoveryClient.getMetadata().tokenEndpoint())
        .header("Authorization", credentials)
        .header("Accept", "application/json")
        .post(formBody)
        .build();

    try (Response response = defaultOkHttpClient.newCall(request).execute()) {
      ensureSuccess(response, operation);

      Map<String, Object> tokenResponse = objectMapper.readValue(
          response.body().string(),
          new TypeReference<>() {});

      String accessToken = (String) tokenResponse.get("access_token");
      if (accessToken == null || accessToken.isBlank()) {
        throw new OAuth2Exception(operation + " response did not contain an access_token");
      }

      return new TokenResponse(
          (String) tokenResponse.get("id_token"),
          accessToken,
          (String) tokenResponse.get("refresh_token"),
          parseExpiresIn(tokenResponse.get("expires_in"))
      );

    } catch (IOException e) {
      throw new IdpUnavailableException(operation + " failed due to network error", e);
    }
  }

  private Long parseExpiresIn(Object value) {
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    if (value instanceof String) {
      try {
        return Long.parseLong((String) value);
      } catch (NumberFormatException e) {
        log.warn("Ignoring non-numeric expires_in: {}", value);
      }
    }
    return null;
  }

  /**
   * 4xx answers are protocol errors ({@link OAuth2Exception}, ignored by the circuit breaker);
   * 5xx answers mean the IdP itself is failing.
   */
  private void ensureSuccess(Response response, String operation) {
    if (response.isSuccessful() && response.body() != null) {
      return;
    }
    String message = operation + " failed with IdP, status: " + response.code();
    if (response.code() >= 500) {
      throw new IdpUnavailableException(message);
    }
    throw new OAuth2Exception(message);
  }

  private RuntimeException fallbackException(String operation, Throwable ex) {
    if (ex instanceof OAuth2Exception || ex instanceof IdpUnavailableException) {
      return (RuntimeException) ex;
    }
    log.error("IdP {} failed or circuit breaker is open", operation, ex);
    return new IdpUnavailableException("Identity provider is temporarily unavailable.", ex);
  }
}
