package com.example.authsession.web.rest.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.authsession.adapter.idp.IdpClient;
import com.example.authsession.adapter.idp.dto.UserInfo;
import com.example.authsession.domain.FailureKind;
import com.example.authsession.domain.TokenStatus;
import com.example.authsession.domain.entity.SessionUser;
import com.example.authsession.exception.OAuth2Exception;
import com.example.authsession.exception.SessionException;
import com.example.authsession.exception.UpstreamTokenUnavailableException;
import com.example.authsession.web.rest.dto.UserResponse;

@ExtendWith(MockitoExtension.class)
@DisplayName("UserController")
class UserControllerTest {

  private static final SessionUser ACTIVE =
      new SessionUser("sid", 8L, "sub-8", "h@example.com", "Hedy", "Lamarr", "at", TokenStatus.ACTIVE, null);
  private static final SessionUser DEGRADED =
      new SessionUser("sid", 8L, "sub-8", "h@example.com", "Hedy", "Lamarr", null, TokenStatus.DEGRADED,
                      FailureKind.NO_REFRESH_TOKEN);

  @Mock
  private IdpClient idpClient;

  private UserController controller;

  @BeforeEach
  void setUp() {
    controller = new UserController(idpClient);
  }

  @Test
  @DisplayName("should serve the current user from the session, degraded or not")
  void shouldServeUserFromSession() {
    UserResponse user = controller.meFromSession(DEGRADED).getBody();

    assertEquals(8L, user.id());
    assertEquals("sub-8", user.iamSubjectId());
    assertEquals("Hedy", user.firstName());
    assertTrue(user.active());
    verifyNoInteractions(idpClient);
  }

  @Test
  @DisplayName("should reject a request without a session")
  void shouldRejectMissingSession() {
    assertThrows(SessionException.class, () -> controller.meFromSession(null));
  }

  @Test
  @DisplayName("should fetch the IdP profile with the session's access token")
  void shouldFetchProfile() {
    UserInfo profile = new UserInfo("sub-8", "h@example.com", "Hedy", "Lamarr", "hedy");
    when(idpClient.fetchUserInfo("at")).thenReturn(profile);

    assertEquals(profile, controller.iamProfile(ACTIVE).getBody());
  }

  @Test
  @DisplayName("should refuse the IdP profile for a degraded session")
  void shouldRefuseProfileWhenDegraded() {
    assertThrows(UpstreamTokenUnavailableException.class, () -> controller.iamProfile(DEGRADED));
    verifyNoInteractions(idpClient);
  }

  @Test
  @DisplayName("should report a token rejected by the IdP as unavailable")
  void shouldMapRejectedToken() {
    when(idpClient.fetchUserInfo("at")).thenThrow(new OAuth2Exception("401"));

    assertThrows(UpstreamTokenUnavailableException.class, () -> controller.iamProfile(ACTIVE));
  }
}
