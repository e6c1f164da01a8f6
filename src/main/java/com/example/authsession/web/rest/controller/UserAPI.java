package com.example.authsession.web.rest.controller;

import static com.example.authsession.web.rest.ApiConstants.ApiPath.*;

import com.example.authsession.adapter.idp.dto.UserInfo;
import com.example.authsession.domain.entity.SessionUser;
import com.example.authsession.web.rest.dto.UserResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

@Tag(
    name = "Users",
    description = "Current user endpoints backed by the server-side session"
)
@RequestMapping(
    value = USERS_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface UserAPI {

  @Operation(
      summary = "Get current user",
      description = "Returns the user identity stored in the session; works for degraded sessions"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "User returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated")
  })
  @GetMapping(value = ME_FROM_SESSION)
  ResponseEntity<UserResponse> meFromSession(@Parameter(hidden = true) @AuthenticationPrincipal SessionUser user);

  @Operation(
      summary = "Get identity provider profile",
      description = "Calls the IdP userinfo endpoint with the session's upstream access token"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Userinfo claims returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated, or no upstream access token"),
      @ApiResponse(responseCode = "502", description = "Identity provider unavailable")
  })
  @GetMapping(value = ME_IAM_PROFILE)
  ResponseEntity<UserInfo> iamProfile(@Parameter(hidden = true) @AuthenticationPrincipal SessionUser user);
}
