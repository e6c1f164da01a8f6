package com.example.authsession.adapter.idp;

import com.example.authsession.adapter.idp.dto.OidcProviderMetadata;
import com.example.authsession.exception.IdpUnavailableException;
import com.example.authsession.exception.OAuth2Exception;
import com.example.authsession.properties.ApplicationProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Loads the IdP discovery document and keeps it in a local cache.
 */
@Slf4j
@Component
public class OidcDiscoveryClient {

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String discoveryUrl;
  private final Cache<String, OidcProviderMetadata> metadataCache;

  public OidcDiscoveryClient(
      OkHttpClient defaultOkHttpClient,
      ObjectMapper objectMapper,
      ApplicationProperties properties) {
    this.httpClient = defaultOkHttpClient;
    this.objectMapper = objectMapper;
    this.discoveryUrl = properties.oidc().discoveryUrl();
    this.metadataCache = Caffeine.newBuilder()
        .maximumSize(1)
        .expireAfterWrite(properties.oidc().metadataCacheTtl())
        .build();
  }

  public OidcProviderMetadata getMetadata() {
    return metadataCache.get(discoveryUrl, this::fetchMetadata);
  }

  private OidcProviderMetadata fetchMetadata(String url) {
    log.debug("Fetching OIDC discovery document from {}", url);
    Request request = new Request.Builder().url(url).get().build();

    try (Response response = httpClient.newCall(request).execute()) {
      if (response.code() >= 500) {
        throw new IdpUnavailableException("OIDC discovery failed, status: " + response.code());
      }
      if (!response.isSuccessful() || response.body() == null) {
        throw new OAuth2Exception("OIDC discovery failed, status: " + response.code());
      }
      OidcProviderMetadata metadata = objectMapper.readValue(response.body().string(), OidcProviderMetadata.class);
      if (metadata.tokenEndpoint() == null || metadata.authorizationEndpoint() == null) {
        throw new OAuth2Exception("OIDC discovery document is missing required endpoints");
      }
      log.info("Loaded OIDC metadata for issuer {}", metadata.issuer());
      return metadata;
    } catch (IOException e) {
      throw new IdpUnavailableException("OIDC discovery failed due to network error", e);
    }
  }
}
