package com.example.authsession.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Centralized configuration properties for the Auth Session Service.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid FrontendProperties frontend,
    @DefaultValue @Valid SessionProperties session,
    @DefaultValue @Valid CookieProperties cookie,
    @NotNull @Valid OidcProperties oidc,
    @DefaultValue @Valid CryptoProperties crypto,
    @DefaultValue @Valid OkHttpProperties http,
    @DefaultValue @Valid RedisProperties redis
) {

  /**
   * Frontend application configuration
   */
  public record FrontendProperties(@NotBlank String url) {}

  /**
   * Server-side session configuration
   */
  public record SessionProperties(
      @DefaultValue("8h") Duration ttl,
      @DefaultValue("300s") @DurationUnit(ChronoUnit.SECONDS) Duration refreshBuffer,
      @DefaultValue("user_session:") @NotBlank String keyPrefix,
      @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration refreshLockTtl,
      @DefaultValue("redis") @Pattern(regexp = "redis|memory") String store
  ) {}

  /**
   * Session cookie attributes. SameSite=None is only honoured together with Secure.
   */
  public record CookieProperties(
      @DefaultValue("ctao_session_main") @NotBlank String name,
      @DefaultValue("false") boolean secure,
      @DefaultValue("Lax") @NotBlank String sameSite,
      String domain,
      @DefaultValue("/") @NotBlank String path
  ) {

    public String effectiveSameSite() {
      if ("none".equalsIgnoreCase(sameSite) && !secure) {
        return "Lax";
      }
      String lower = sameSite.toLowerCase();
      return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
  }

  /**
   * OIDC identity provider configuration
   */
  public record OidcProperties(
      @DefaultValue("ctao") @NotBlank String providerName,
      @NotBlank String discoveryUrl,
      String clientId,
      String clientSecret,
      @NotBlank String redirectUri,
      @DefaultValue("openid profile email offline_access") @NotBlank String scope,
      @Positive Integer fakeExpiresIn,
      @DefaultValue("1h") Duration metadataCacheTtl
  ) {

    public boolean hasClientCredentials() {
      return clientId != null && !clientId.isBlank() && clientSecret != null && !clientSecret.isBlank();
    }
  }

  /**
   * At-rest encryption of refresh tokens
   */
  public record CryptoProperties(String refreshTokenKey) {}

  /**
   * OkHttp client configuration
   */
  public record OkHttpProperties(
      @DefaultValue @Valid ClientProperties client
  ) {
    public record ClientProperties(
        @DefaultValue("20") @Positive int maxIdleConnections,
        @DefaultValue("5") @Positive int keepAliveDurationMinutes,
        @DefaultValue("100") @Positive int maxRequests,
        @DefaultValue("20") @Positive int maxRequestsPerHost,
        @DefaultValue("3s") @DurationUnit(ChronoUnit.SECONDS) Duration connectTimeout,
        @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) Duration readTimeout
    ) {}
  }

  /**
   * Redis configuration
   */
  public record RedisProperties(
      @DefaultValue("localhost") @NotBlank String host,
      @DefaultValue("6379") @Min(1) @Max(65535) int port,
      String password,
      @DefaultValue("0") @Min(0) int database,
      @DefaultValue("false") boolean ssl,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
      @DefaultValue @Valid PoolProperties pool
  ) {
    public record PoolProperties(
        @DefaultValue("16") @Positive int maxActive,
        @DefaultValue("8") @Positive int maxIdle,
        @DefaultValue("4") @PositiveOrZero int minIdle,
        @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration maxWait,
        @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration timeBetweenEvictionRuns
    ) {}
  }
}
