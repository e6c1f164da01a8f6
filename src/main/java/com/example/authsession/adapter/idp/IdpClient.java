package com.example.authsession.adapter.idp;

import com.example.authsession.adapter.idp.dto.UserInfo;

/**
 * Interface for the OIDC identity provider.
 * Handles protocol operations only; session policy lives in the services.
 */
public interface IdpClient {

  /**
   * Gets the authorization endpoint URL.
   */
  String getAuthorizationEndpoint();

  /**
   * Gets the client ID registered with the IdP.
   */
  String getClientId();

  /**
   * Exchanges an authorization code for tokens using PKCE.
   */
  TokenResponse exchangeCodeForTokens(String code, String codeVerifier, String redirectUri);

  /**
   * Calls the token endpoint with {@code grant_type=refresh_token}.
   */
  TokenResponse refreshAccessToken(String refreshToken);

  /**
   * Fetches the userinfo claims for an access token.
   */
  UserInfo fetchUserInfo(String accessToken);

  /**
   * Token response from the IdP. {@code refreshToken} and {@code expiresIn} may be null.
   */
  record TokenResponse(
      String idToken,
      String accessToken,
      String refreshToken,
      Long expiresIn
  ) {}
}
