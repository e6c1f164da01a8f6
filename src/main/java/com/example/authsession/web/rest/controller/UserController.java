package com.example.authsession.web.rest.controller;

import com.example.authsession.adapter.idp.IdpClient;
import com.example.authsession.adapter.idp.dto.UserInfo;
import com.example.authsession.domain.entity.SessionUser;
import com.example.authsession.exception.OAuth2Exception;
import com.example.authsession.exception.SessionException;
import com.example.authsession.exception.UpstreamTokenUnavailableException;
import com.example.authsession.web.rest.dto.UserResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Slf4j
@RequiredArgsConstructor
public class UserController implements UserAPI {

  private final IdpClient idpClient;

  @Override
  public ResponseEntity<UserResponse> meFromSession(SessionUser user) {
    return ResponseEntity.ok(UserResponse.from(requireUser(user)));
  }

  @Override
  public ResponseEntity<UserInfo> iamProfile(SessionUser user) {
    String accessToken = requireUser(user).requireAccessToken();
    try {
      return ResponseEntity.ok(idpClient.fetchUserInfo(accessToken));
    } catch (OAuth2Exception e) {
      // IdP rejected the token (revoked or expired early)
      throw new UpstreamTokenUnavailableException("Userinfo rejected the access token of user " + user.appUserId(), e);
    }
  }

  private SessionUser requireUser(SessionUser user) {
    if (user == null) {
      throw new SessionException("No session found");
    }
    return user;
  }
}
