package com.example.authsession.config;

import com.example.authsession.properties.ApplicationProperties;
import com.example.authsession.security.filter.RollingSessionCookieFilter;
import com.example.authsession.security.filter.SessionAuthenticationFilter;
import com.example.authsession.web.rest.errors.DelegatedAuthenticationEntryPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;

/**
 * Filter chains:
 * <ol>
 *   <li>OIDC login/callback, actuator and API docs: public, no session lookup</li>
 *   <li>{@code /api/auth/**}: public, session resolved when a cookie is present</li>
 *   <li>{@code /api/users/**}: session required, JSON 401 otherwise</li>
 *   <li>everything else: denied</li>
 * </ol>
 * The rolling cookie filter runs outside Spring Security so that it sees every response.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private final SessionAuthenticationFilter sessionAuthenticationFilter;
  private final DelegatedAuthenticationEntryPoint delegatedAuthenticationEntryPoint;

  @Bean
  @Order(1)
  public SecurityFilterChain publicEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/api/oidc/**",
                         "/actuator/**",
                         "/v3/api-docs/**",
                         "/swagger-ui/**",
                         "/swagger-ui.html")
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain optionalSessionFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/api/auth/**")
        .addFilterBefore(sessionAuthenticationFilter, UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(3)
  public SecurityFilterChain protectedEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/api/users/**")
        .addFilterBefore(sessionAuthenticationFilter, UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().authenticated())
        .exceptionHandling(exceptions ->
                               exceptions.authenticationEntryPoint(delegatedAuthenticationEntryPoint));

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(4)
  public SecurityFilterChain defaultDenyFilterChain(HttpSecurity http) throws Exception {
    http
        .authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll())
        .exceptionHandling(exceptions ->
                               exceptions.authenticationEntryPoint(delegatedAuthenticationEntryPoint));
    applyCommonSettings(http);
    return http.build();
  }

  /**
   * The session filter only runs inside the security chains above, not as a plain servlet filter.
   */
  @Bean
  public FilterRegistrationBean<SessionAuthenticationFilter> sessionAuthenticationFilterRegistration() {
    FilterRegistrationBean<SessionAuthenticationFilter> registration =
        new FilterRegistrationBean<>(sessionAuthenticationFilter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  public FilterRegistrationBean<RollingSessionCookieFilter> rollingSessionCookieFilter(
      ApplicationProperties properties) {
    FilterRegistrationBean<RollingSessionCookieFilter> registration =
        new FilterRegistrationBean<>(new RollingSessionCookieFilter(properties));
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
    registration.addUrlPatterns("/*");
    return registration;
  }

  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        // Session cookie is HttpOnly and SameSite; no server-side HttpSession
        .csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .headers(headers -> headers
            .frameOptions(FrameOptionsConfig::deny)
            .contentTypeOptions(contentType -> {
            })
            .referrerPolicy(referrer -> referrer.policy(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN))
            .addHeaderWriter((request, response) -> {
              response.setHeader("Cache-Control", "no-cache, no-store, must-revalidate");
              response.setHeader("Pragma", "no-cache");
            }));
  }
}
