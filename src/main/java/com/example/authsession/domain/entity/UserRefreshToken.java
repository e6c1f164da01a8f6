package com.example.authsession.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Durable refresh token, one row per (user, provider). Only ciphertext is stored.
 */
@Entity
@Table(name = "user_refresh_tokens",
       uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "iam_provider_name"}))
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class UserRefreshToken {

  @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "user_id", nullable = false)
  private Long userId;

  @Column(name = "iam_provider_name", nullable = false, length = 64)
  private String providerName;

  @Column(name = "encrypted_refresh_token", nullable = false, columnDefinition = "text")
  private String encryptedRefreshToken;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "last_used_at")
  private Instant lastUsedAt;
}
