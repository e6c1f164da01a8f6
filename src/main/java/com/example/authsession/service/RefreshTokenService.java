package com.example.authsession.service;

import com.example.authsession.domain.FailureKind;
import com.example.authsession.domain.Result;
import com.example.authsession.domain.entity.UserRefreshToken;
import com.example.authsession.properties.ApplicationProperties;
import com.example.authsession.repository.UserRefreshTokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Refresh-token repository access with encryption at rest.
 * One row per (user, provider); rotation updates the row in place.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshTokenService {

  private final UserRefreshTokenRepository repository;
  private final TokenCipherService cipher;
  private final ApplicationProperties properties;
  private final Clock clock;

  /**
   * Loads and decrypts the stored refresh token for the configured provider.
   */
  @Transactional(readOnly = true)
  public Result<String> loadRefreshToken(long userId) {
    Optional<UserRefreshToken> record = repository.findByUserIdAndProviderName(userId, providerName());
    if (record.isEmpty() || record.get().getEncryptedRefreshToken() == null) {
      return Result.err(FailureKind.NO_REFRESH_TOKEN);
    }
    if (!cipher.isConfigured()) {
      return Result.err(FailureKind.CONFIGURATION);
    }
    return cipher.decrypt(record.get().getEncryptedRefreshToken())
        .map(Result::ok)
        .orElseGet(() -> {
          log.warn("Stored refresh token for user {} could not be decrypted", userId);
          return Result.err(FailureKind.DECRYPTION_FAILED);
        });
  }

  /**
   * Encrypts and upserts a refresh token. Returns false when it could not be encrypted.
   */
  @Transactional
  public boolean storeRefreshToken(long userId, String refreshToken) {
    Optional<String> encrypted = cipher.encrypt(refreshToken);
    if (encrypted.isEmpty()) {
      log.warn("Refresh token for user {} not stored: encryption unavailable", userId);
      return false;
    }

    Instant now = clock.instant();
    UserRefreshToken record = repository.findByUserIdAndProviderName(userId, providerName())
        .orElseGet(() -> UserRefreshToken.builder()
            .userId(userId)
            .providerName(providerName())
            .createdAt(now)
            .build());
    record.setEncryptedRefreshToken(encrypted.get());
    record.setLastUsedAt(now);
    repository.save(record);
    return true;
  }

  /**
   * Replaces the stored token after the IdP issued a new one. If re-encryption fails
   * the previous ciphertext is kept; last_used_at is bumped either way.
   */
  @Transactional
  public void rotate(long userId, String newRefreshToken) {
    Optional<UserRefreshToken> existing = repository.findByUserIdAndProviderName(userId, providerName());
    if (existing.isEmpty()) {
      // Row vanished (concurrent logout); do not resurrect it
      log.info("No refresh token row for user {} during rotation, skipping", userId);
      return;
    }
    UserRefreshToken record = existing.get();
    cipher.encrypt(newRefreshToken).ifPresentOrElse(
        record::setEncryptedRefreshToken,
        () -> log.warn("Rotated refresh token for user {} could not be encrypted, keeping previous", userId));
    record.setLastUsedAt(clock.instant());
    repository.save(record);
  }

  @Transactional
  public int deleteAllForUser(long userId) {
    int deleted = repository.deleteAllByUserId(userId);
    log.info("Deleted {} refresh token(s) for user {}", deleted, userId);
    return deleted;
  }

  private String providerName() {
    return properties.oidc().providerName();
  }
}
