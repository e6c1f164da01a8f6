package com.example.authsession.service;

import com.example.authsession.adapter.idp.IdpClient;
import com.example.authsession.adapter.idp.dto.UserInfo;
import com.example.authsession.domain.entity.AppUser;
import com.example.authsession.domain.entity.SessionRecord;
import com.example.authsession.repository.AppUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Completes a login after a successful code exchange.
 * <p>
 * The user row and the encrypted refresh token are committed first; the session is created
 * only after the commit succeeded, so a failed commit never leaves a usable session behind.
 * Commit failures propagate as {@link org.springframework.transaction.TransactionException}
 * or {@link org.springframework.dao.DataAccessException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginService {

  private final AppUserRepository userRepository;
  private final RefreshTokenService refreshTokenService;
  private final SessionService sessionService;
  private final TokenRefreshCoordinator refreshCoordinator;
  private final TransactionTemplate transactionTemplate;

  /**
   * @return the new session id
   */
  public String completeLogin(UserInfo userInfo, IdpClient.TokenResponse tokens) {
    AppUser user = transactionTemplate.execute(status -> {
      AppUser appUser = findOrCreateUser(userInfo.subject());
      if (tokens.refreshToken() != null) {
        refreshTokenService.storeRefreshToken(appUser.getId(), tokens.refreshToken());
      } else {
        log.info("IdP returned no refresh token for user {}; session will degrade at expiry", appUser.getId());
      }
      return appUser;
    });

    SessionRecord record = new SessionRecord(
        user.getId(),
        userInfo.subject(),
        userInfo.email(),
        userInfo.givenName(),
        userInfo.familyName(),
        tokens.accessToken(),
        refreshCoordinator.expiryOf(tokens));

    return sessionService.createSession(record);
  }

  /**
   * Deletes the session and every stored refresh token of its user. Unknown sessions are a no-op.
   */
  public void logout(String sessionId) {
    sessionService.load(sessionId).ifPresent(record -> {
      try {
        refreshTokenService.deleteAllForUser(record.appUserId());
      } catch (RuntimeException e) {
        log.error("Failed to delete refresh tokens for user {} at logout", record.appUserId(), e);
      }
    });
    sessionService.invalidate(sessionId);
  }

  private AppUser findOrCreateUser(String subject) {
    return userRepository.findByIamSubjectId(subject)
        .orElseGet(() -> {
          AppUser created = userRepository.save(AppUser.builder().iamSubjectId(subject).build());
          log.info("Created user {} for subject {}", created.getId(), subject);
          return created;
        });
  }
}
