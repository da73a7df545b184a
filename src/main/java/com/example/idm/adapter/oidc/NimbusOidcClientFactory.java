package com.example.idm.adapter.oidc;

import com.example.idm.exception.OidcClientException;
import com.example.idm.properties.IdmProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.openid.connect.sdk.op.OIDCProviderMetadata;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Resolves provider metadata from the discovery document on first use per policy
 * and keeps one client per policy until the metadata TTL lapses.
 */
@Slf4j
@Component
public class NimbusOidcClientFactory implements OidcClientFactory {

  static final String POLICY_PLACEHOLDER = "{policyName}";

  private final IdmProperties properties;
  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final CircuitBreaker circuitBreaker;
  private final Clock clock;
  private final Cache<String, OidcClient> clients;

  public NimbusOidcClientFactory(IdmProperties properties,
                                 OkHttpClient httpClient,
                                 ObjectMapper objectMapper,
                                 CircuitBreaker oidcCircuitBreaker,
                                 Clock clock) {
    this.properties = properties;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.circuitBreaker = oidcCircuitBreaker;
    this.clock = clock;
    this.clients = Caffeine.newBuilder()
        .expireAfterWrite(properties.oidc().metadataTtl())
        .maximumSize(100)
        .build();
  }

  @Override
  public OidcClient getClient(String policyName) {
    Assert.hasText(policyName, "policyName must be passed to getClient");
    return clients.get(policyName, this::createClient);
  }

  private OidcClient createClient(String policyName) {
    OIDCProviderMetadata metadata = fetchMetadata(discoveryUri(policyName));
    log.info("Loaded provider metadata for policy {} from issuer {}", policyName, metadata.getIssuer());

    return new NimbusOidcClient(
        metadata,
        properties.clientId(),
        properties.oidc().clientSecret(),
        httpClient,
        objectMapper,
        circuitBreaker,
        clock);
  }

  String discoveryUri(String policyName) {
    return properties.oidc().discoveryUri()
        .replace(POLICY_PLACEHOLDER, URLEncoder.encode(policyName, StandardCharsets.UTF_8));
  }

  private OIDCProviderMetadata fetchMetadata(String discoveryUri) {
    Request request = new Request.Builder()
        .url(discoveryUri)
        .header("Accept", "application/json")
        .get()
        .build();

    try (Response response = circuitBreaker.executeCallable(() -> httpClient.newCall(request).execute())) {
      ResponseBody body = response.body();
      if (!response.isSuccessful() || body == null) {
        throw new OidcClientException(
            "Provider discovery failed with status " + response.code() + ": " + discoveryUri);
      }
      return OIDCProviderMetadata.parse(body.string());

    } catch (ParseException e) {
      throw new OidcClientException("Invalid provider metadata at " + discoveryUri, e);
    } catch (OidcClientException e) {
      throw e;
    } catch (Exception e) {
      throw new OidcClientException("Provider discovery failed due to network error: " + discoveryUri, e);
    }
  }
}
