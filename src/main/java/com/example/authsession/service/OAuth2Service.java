package com.example.authsession.service;

import com.example.authsession.adapter.idp.IdpClient;
import com.example.authsession.adapter.idp.dto.UserInfo;
import com.example.authsession.exception.OAuth2Exception;
import com.example.authsession.properties.ApplicationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jwt.JWTParser;
import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.oauth2.sdk.pkce.CodeChallenge;
import com.nimbusds.oauth2.sdk.pkce.CodeChallengeMethod;
import com.nimbusds.oauth2.sdk.pkce.CodeVerifier;
import com.nimbusds.openid.connect.sdk.Nonce;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.text.ParseException;
import java.time.Duration;

/**
 * Authorization-code flow with PKCE. Login state (verifier, nonce, return path) is kept
 * in the session store under {@code oidc_state:<state>} and consumed exactly once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OAuth2Service {

  static final String STATE_PREFIX = "oidc_state:";
  private static final Duration STATE_TTL = Duration.ofMinutes(10);
  private static final String DEFAULT_RETURN_TO = "/";
  private static final String ERROR_INVALID_GRANT = "invalid_grant";
  private static final String ERROR_INVALID_TOKEN = "invalid_token";

  private final SessionStore sessionStore;
  private final ObjectMapper objectMapper;
  private final ApplicationProperties properties;
  private final IdpClient idpClient;

  public String generateAuthorizationUrl(String returnTo) {
    CodeVerifier codeVerifier = new CodeVerifier();
    CodeChallenge codeChallenge = CodeChallenge.compute(CodeChallengeMethod.S256, codeVerifier);
    State state = new State();
    Nonce nonce = new Nonce();

    storeLoginState(state.getValue(),
                    new LoginState(codeVerifier.getValue(), nonce.getValue(), sanitizeReturnTo(returnTo)));

    return UriComponentsBuilder.fromHttpUrl(idpClient.getAuthorizationEndpoint())
        .queryParam("response_type", "code")
        .queryParam("client_id", idpClient.getClientId())
        .queryParam("scope", properties.oidc().scope())
        .queryParam("redirect_uri", properties.oidc().redirectUri())
        .queryParam("state", state.getValue())
        .queryParam("nonce", nonce.getValue())
        .queryParam("code_challenge", codeChallenge.getValue())
        .queryParam("code_challenge_method", "S256")
        .encode()
        .build()
        .toUriString();
  }

  /**
   * Validates the callback, exchanges the code and loads the userinfo claims.
   * Throws {@link OAuth2AuthenticationException} for an invalid state or nonce.
   */
  public CallbackResult processCallback(@NonNull String code, @NonNull String state) {
    LoginState loginState = consumeLoginState(state);

    IdpClient.TokenResponse tokens = idpClient.exchangeCodeForTokens(
        code, loginState.codeVerifier(), properties.oidc().redirectUri());

    if (tokens.idToken() != null) {
      verifyNonce(tokens.idToken(), loginState.nonce());
    }

    UserInfo userInfo = idpClient.fetchUserInfo(tokens.accessToken());
    if (userInfo == null || userInfo.subject() == null || userInfo.subject().isBlank()) {
      throw new OAuth2Exception("Userinfo response did not contain a sub claim");
    }

    log.info("Processed OIDC callback for subject {}", userInfo.subject());
    return new CallbackResult(userInfo, tokens, loginState.returnTo());
  }

  /**
   * Structural parse of the id_token and nonce comparison. The signature is not checked:
   * the token came directly from the token endpoint over TLS.
   */
  private void verifyNonce(String idToken, String expectedNonce) {
    try {
      Object tokenNonce = JWTParser.parse(idToken).getJWTClaimsSet().getClaim("nonce");
      if (tokenNonce == null || !tokenNonce.equals(expectedNonce)) {
        throw new OAuth2AuthenticationException(
            new OAuth2Error(ERROR_INVALID_TOKEN, "Nonce validation failed.", null));
      }
    } catch (ParseException e) {
      throw new OAuth2Exception("Received a malformed ID token from the provider.", e);
    }
  }

  private void storeLoginState(String state, LoginState loginState) {
    try {
      sessionStore.set(STATE_PREFIX + state, objectMapper.writeValueAsString(loginState), STATE_TTL);
    } catch (JsonProcessingException e) {
      throw new OAuth2Exception("Failed to store login state", e);
    }
  }

  private LoginState consumeLoginState(String state) {
    String json = sessionStore.getAndDelete(STATE_PREFIX + state).orElseThrow(() ->
        new OAuth2AuthenticationException(new OAuth2Error(ERROR_INVALID_GRANT, "Invalid or expired state.", null)));
    try {
      return objectMapper.readValue(json, LoginState.class);
    } catch (JsonProcessingException e) {
      throw new OAuth2Exception("Invalid state data format.", e);
    }
  }

  // Only same-origin relative paths; anything else would make the callback an open redirect
  static String sanitizeReturnTo(String returnTo) {
    if (returnTo == null || !returnTo.startsWith("/") || returnTo.startsWith("//") || returnTo.contains("\\")) {
      return DEFAULT_RETURN_TO;
    }
    return returnTo;
  }

  record LoginState(String codeVerifier, String nonce, String returnTo) {}

  public record CallbackResult(
      UserInfo userInfo,
      IdpClient.TokenResponse tokens,
      String returnTo
  ) {}
}
