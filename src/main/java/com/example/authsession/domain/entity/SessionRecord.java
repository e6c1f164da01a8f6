package com.example.authsession.domain.entity;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Server-side session state, stored as a JSON blob under {@code <prefix><session-id>}.
 * Replaced as a whole on every write; there are no partial-field updates.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionRecord(
    @JsonProperty("app_user_id")
    Long appUserId,

    @JsonProperty("iam_subject_id") @JsonAlias({"iam_sub", "sub"})
    String iamSubjectId,

    @JsonProperty("email") @JsonAlias("iam_email")
    String email,

    @JsonProperty("given_name") @JsonAlias("first_name")
    String givenName,

    @JsonProperty("family_name") @JsonAlias("last_name")
    String familyName,

    // Current upstream access token; null once refresh has failed or the token expired.
    @JsonProperty("access_token") @JsonAlias("iam_at")
    String accessToken,

    // Unix seconds, required while accessToken is non-null.
    @JsonProperty("access_token_expiry") @JsonAlias("iam_at_exp")
    Double accessTokenExpiry
) {

  @JsonIgnore
  public boolean hasAccessToken() {
    return accessToken != null && accessTokenExpiry != null;
  }

  public SessionRecord withAccessToken(String newAccessToken, double newExpiry) {
    return new SessionRecord(appUserId, iamSubjectId, email, givenName, familyName, newAccessToken, newExpiry);
  }

  public SessionRecord withoutAccessToken() {
    return new SessionRecord(appUserId, iamSubjectId, email, givenName, familyName, null, null);
  }
}
