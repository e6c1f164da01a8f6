package com.example.authsession.web.rest.controller;

import static com.example.authsession.web.rest.ApiConstants.ApiPath.*;

import com.example.authsession.domain.entity.SessionUser;
import com.example.authsession.web.rest.dto.SessionStatusResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Tag(
    name = "Authentication",
    description = "OIDC login flow and session lifecycle endpoints"
)
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public interface AuthAPI {

  @Operation(
      summary = "Initiate OIDC login flow",
      description = "Starts the authorization-code + PKCE flow with the identity provider"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "302", description = "Redirect to identity provider"),
      @ApiResponse(responseCode = "400", description = "Identity provider metadata unavailable")
  })
  @GetMapping(value = OIDC_BASE + LOGIN)
  ResponseEntity<Void> login(
      @Parameter(description = "Frontend path to return to after login", example = "/baskets")
      @RequestParam(defaultValue = "/") String returnTo);

  @Operation(
      summary = "OIDC callback handler",
      description = "Exchanges the authorization code, creates the session and sets the session cookie"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "302", description = "Redirect to the frontend, with or without a session"),
      @ApiResponse(responseCode = "500", description = "User or refresh token could not be persisted")
  })
  @GetMapping(value = OIDC_BASE + CALLBACK)
  ResponseEntity<Void> callback(
      @Parameter(description = "Authorization code")
      @RequestParam(required = false) String code,
      @Parameter(description = "State parameter issued at login")
      @RequestParam(required = false) String state);

  @Operation(
      summary = "Logout",
      description = "Deletes the session and all stored refresh tokens of the user, and clears the cookie"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Logged out (also when there was no session)")
  })
  @PostMapping(value = AUTH_BASE + LOGOUT_SESSION)
  ResponseEntity<Map<String, String>> logout(HttpServletRequest request);

  @Operation(
      summary = "Session status",
      description = "Whether the cookie resolves to a user, and the state of the upstream access token"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Status returned")
  })
  @GetMapping(value = AUTH_BASE + SESSION)
  ResponseEntity<SessionStatusResponse> session(@Parameter(hidden = true) @AuthenticationPrincipal SessionUser user);
}
