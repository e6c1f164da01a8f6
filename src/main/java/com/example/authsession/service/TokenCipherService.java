package com.example.authsession.service;

import com.example.authsession.properties.ApplicationProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * Refresh token cipher
 *
 * AES-256-GCM with a key from {@code app.crypto.refresh-token-key}. Never throws:
 * a missing or malformed key, or any cryptographic failure, yields an empty result
 * so that callers degrade to "no refresh token" instead of failing the request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenCipherService {

  private static final int GCM_TAG_LENGTH = 128;
  private static final int GCM_IV_LENGTH = 12;
  private static final int KEY_LENGTH_BYTES = 32;
  private static final String ENCRYPTION_ALGORITHM = "AES/GCM/NoPadding";
  private static final SecureRandom secureRandom = new SecureRandom();

  private final ApplicationProperties properties;

  private volatile SecretKey currentKey;

  @PostConstruct
  public void initialize() {
    currentKey = loadEncryptionKey(properties.crypto().refreshTokenKey());
  }

  public boolean isConfigured() {
    return currentKey != null;
  }

  /**
   * Encrypt data using AES-256-GCM. The IV is prepended to the ciphertext.
   */
  public Optional<String> encrypt(String plaintext) {
    SecretKey key = currentKey;
    if (key == null || plaintext == null) {
      return Optional.empty();
    }
    try {
      byte[] iv = new byte[GCM_IV_LENGTH];
      secureRandom.nextBytes(iv);

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));

      byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

      byte[] combined = new byte[iv.length + encrypted.length];
      System.arraycopy(iv, 0, combined, 0, iv.length);
      System.arraycopy(encrypted, 0, combined, iv.length, encrypted.length);

      return Optional.of(Base64.getEncoder().encodeToString(combined));

    } catch (Exception e) {
      log.error("Refresh token encryption failed", e);
      return Optional.empty();
    }
  }

  /**
   * Decrypt data using AES-256-GCM. Wrong key or corrupted input yields empty.
   */
  public Optional<String> decrypt(String encryptedData) {
    SecretKey key = currentKey;
    if (key == null || encryptedData == null) {
      return Optional.empty();
    }
    try {
      byte[] combined = Base64.getDecoder().decode(encryptedData);
      if (combined.length <= GCM_IV_LENGTH) {
        log.warn("Refresh token ciphertext too short to decrypt");
        return Optional.empty();
      }

      byte[] iv = new byte[GCM_IV_LENGTH];
      byte[] encrypted = new byte[combined.length - GCM_IV_LENGTH];
      System.arraycopy(combined, 0, iv, 0, GCM_IV_LENGTH);
      System.arraycopy(combined, GCM_IV_LENGTH, encrypted, 0, encrypted.length);

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));

      byte[] decrypted = cipher.doFinal(encrypted);
      return Optional.of(new String(decrypted, StandardCharsets.UTF_8));

    } catch (Exception e) {
      log.warn("Refresh token decryption failed: {}", e.getClass().getSimpleName());
      return Optional.empty();
    }
  }

  private SecretKey loadEncryptionKey(String keyBase64) {
    if (keyBase64 == null || keyBase64.isBlank()) {
      log.warn("SECURITY: app.crypto.refresh-token-key is not set. Refresh tokens cannot be stored "
                   + "or used; sessions will lose their upstream token at expiry.");
      return null;
    }
    try {
      byte[] keyBytes = Base64.getDecoder().decode(keyBase64.trim());
      if (keyBytes.length != KEY_LENGTH_BYTES) {
        log.error("SECURITY: refresh token key has invalid length {} bytes, expected {}",
                  keyBytes.length, KEY_LENGTH_BYTES);
        return null;
      }
      log.info("Refresh token encryption key loaded");
      return new SecretKeySpec(keyBytes, "AES");
    } catch (IllegalArgumentException e) {
      log.error("SECURITY: refresh token key is not valid base64", e);
      return null;
    }
  }
}
