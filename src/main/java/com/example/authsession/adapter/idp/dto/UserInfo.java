package com.example.authsession.adapter.idp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Subset of the OIDC userinfo response used by the login flow.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserInfo(
    @JsonProperty("sub") String subject,
    @JsonProperty("email") String email,
    @JsonProperty("given_name") String givenName,
    @JsonProperty("family_name") String familyName,
    @JsonProperty("preferred_username") String preferredUsername
) {}
