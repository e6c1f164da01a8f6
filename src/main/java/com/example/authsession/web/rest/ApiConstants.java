package com.example.authsession.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String OIDC_BASE = "/api/oidc";
    public static final String AUTH_BASE = "/api/auth";
    public static final String USERS_BASE = "/api/users";

    // OIDC paths
    public static final String LOGIN = "/login";
    public static final String CALLBACK = "/callback";

    // Auth paths
    public static final String LOGOUT_SESSION = "/logout_session";
    public static final String SESSION = "/session";

    // User paths
    public static final String ME_FROM_SESSION = "/me_from_session";
    public static final String ME_IAM_PROFILE = "/me/iam_profile";

    private ApiPath() {}
  }

  public static final class ErrorCode {
    public static final String AUTH_FAILED = "auth_failed";
    public static final String UPSTREAM_TOKEN_UNAVAILABLE = "upstream_token_unavailable";

    private ErrorCode() {}
  }

  private ApiConstants() {}
}
