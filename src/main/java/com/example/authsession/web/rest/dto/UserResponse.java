package com.example.authsession.web.rest.dto;

import com.example.authsession.domain.entity.SessionUser;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Current user as seen by the frontend; built from the session, not from the database.
 */
public record UserResponse(
    @JsonProperty("id") long id,
    @JsonProperty("email") String email,
    @JsonProperty("first_name") String firstName,
    @JsonProperty("last_name") String lastName,
    @JsonProperty("iam_subject_id") String iamSubjectId,
    @JsonProperty("is_active") boolean active,
    @JsonProperty("is_superuser") boolean superuser,
    @JsonProperty("is_verified") boolean verified
) {

  public static UserResponse from(SessionUser user) {
    return new UserResponse(
        user.appUserId(),
        user.email(),
        user.firstName(),
        user.lastName(),
        user.iamSubjectId(),
        true,
        false,
        true);
  }
}
