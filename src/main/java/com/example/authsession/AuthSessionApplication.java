package com.example.authsession;

import com.example.authsession.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Auth Session Service
 *
 * Server-side session and OIDC token lifecycle management:
 * - Opaque session ids in an HttpOnly cookie, session state in Redis
 * - Proactive access-token refresh against the IdP token endpoint
 * - Refresh tokens persisted encrypted (AES-256-GCM) in PostgreSQL
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
public class AuthSessionApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(AuthSessionApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
