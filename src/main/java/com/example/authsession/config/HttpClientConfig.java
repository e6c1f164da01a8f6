package com.example.authsession.config;

import com.example.authsession.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp client used for all identity provider calls.
 *
 * Timeouts are short so that a slow IdP cannot pin request threads.
 */
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

  private final ApplicationProperties properties;

  @Bean
  public ConnectionPool sharedConnectionPool() {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    return new ConnectionPool(client.maxIdleConnections(), client.keepAliveDurationMinutes(), TimeUnit.MINUTES);
  }

  @Bean
  public Dispatcher sharedDispatcher() {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    Dispatcher dispatcher = new Dispatcher();
    dispatcher.setMaxRequests(client.maxRequests());
    dispatcher.setMaxRequestsPerHost(client.maxRequestsPerHost());
    return dispatcher;
  }

  /**
   * Default HTTP client for OIDC discovery, token and userinfo calls
   */
  @Bean
  public OkHttpClient defaultOkHttpClient(ConnectionPool connectionPool, Dispatcher dispatcher) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    return new OkHttpClient.Builder()
        .connectionPool(connectionPool)
        .dispatcher(dispatcher)
        .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
        .connectTimeout(client.connectTimeout())
        .readTimeout(client.readTimeout())
        .writeTimeout(client.readTimeout())
        .callTimeout(client.connectTimeout().plus(client.readTimeout()))
        .retryOnConnectionFailure(true)
        .followRedirects(false)
        .followSslRedirects(false)
        .build();
  }
}
