package com.example.authsession.adapter.idp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Endpoints taken from the IdP's {@code .well-known/openid-configuration} document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OidcProviderMetadata(
    @JsonProperty("issuer") String issuer,
    @JsonProperty("authorization_endpoint") String authorizationEndpoint,
    @JsonProperty("token_endpoint") String tokenEndpoint,
    @JsonProperty("userinfo_endpoint") String userinfoEndpoint,
    @JsonProperty("end_session_endpoint") String endSessionEndpoint
) {}
