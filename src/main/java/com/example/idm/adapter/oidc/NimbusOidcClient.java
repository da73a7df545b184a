package com.example.idm.adapter.oidc;

import com.example.idm.domain.entity.TokenSet;
import com.example.idm.exception.OidcClientException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jwt.JWTParser;
import com.nimbusds.oauth2.sdk.ResponseMode;
import com.nimbusds.oauth2.sdk.ResponseType;
import com.nimbusds.oauth2.sdk.Scope;
import com.nimbusds.oauth2.sdk.id.ClientID;
import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.openid.connect.sdk.AuthenticationRequest;
import com.nimbusds.openid.connect.sdk.op.OIDCProviderMetadata;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.net.URI;
import java.text.ParseException;
import java.time.Clock;
import java.util.Map;

/**
 * Protocol client for one policy, built from that policy's discovery metadata.
 * Authorization URLs are produced with the Nimbus SDK; token endpoint calls go through OkHttp.
 */
@Slf4j
public class NimbusOidcClient implements OidcClient {

  private static final String GRANT_REFRESH_TOKEN = "refresh_token";
  private static final String GRANT_AUTHORIZATION_CODE = "authorization_code";

  private final OIDCProviderMetadata metadata;
  private final String clientId;
  private final String clientSecret;
  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final CircuitBreaker circuitBreaker;
  private final Clock clock;

  public NimbusOidcClient(OIDCProviderMetadata metadata,
                          String clientId,
                          String clientSecret,
                          OkHttpClient httpClient,
                          ObjectMapper objectMapper,
                          CircuitBreaker circuitBreaker,
                          Clock clock) {
    this.metadata = metadata;
    this.clientId = clientId;
    this.clientSecret = clientSecret;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.circuitBreaker = circuitBreaker;
    this.clock = clock;
  }

  @Override
  public String authorizationUrl(AuthorizationParameters parameters) {
    try {
      AuthenticationRequest request = new AuthenticationRequest.Builder(
          new ResponseType(ResponseType.Value.CODE),
          Scope.parse(parameters.scope()),
          new ClientID(clientId),
          URI.create(parameters.redirectUri()))
          .endpointURI(metadata.getAuthorizationEndpointURI())
          .responseMode(new ResponseMode(parameters.responseMode()))
          .state(new State(parameters.state()))
          .build();

      return request.toURI().toString();
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw new OidcClientException("Cannot build authorization request: " + e.getMessage(), e);
    }
  }

  @Override
  public TokenSet refresh(String refreshToken) {
    if (refreshToken == null || refreshToken.isBlank()) {
      throw new OidcClientException("Refresh token is required", "invalid_request", null);
    }
    log.debug("Refreshing tokens at {}", metadata.getTokenEndpointURI());

    FormBody.Builder form = new FormBody.Builder()
        .add("grant_type", GRANT_REFRESH_TOKEN)
        .add("refresh_token", refreshToken);

    return circuitBreaker.executeSupplier(() -> requestTokens(form));
  }

  @Override
  public TokenSet exchangeCode(String code, String redirectUri) {
    log.debug("Exchanging authorization code at {}", metadata.getTokenEndpointURI());

    FormBody.Builder form = new FormBody.Builder()
        .add("grant_type", GRANT_AUTHORIZATION_CODE)
        .add("code", code)
        .add("redirect_uri", redirectUri);

    return circuitBreaker.executeSupplier(() -> requestTokens(form));
  }

  private TokenSet requestTokens(FormBody.Builder form) {
    Request.Builder request = new Request.Builder()
        .url(metadata.getTokenEndpointURI().toString())
        .header("Accept", "application/json");

    if (clientSecret != null && !clientSecret.isBlank()) {
      request.header("Authorization", Credentials.basic(clientId, clientSecret));
    } else {
      form.add("client_id", clientId);
    }

    String content;
    try (Response response = httpClient.newCall(request.post(form.build()).build()).execute()) {
      ResponseBody body = response.body();
      content = body == null ? "" : body.string();

      if (!response.isSuccessful()) {
        String errorCode = readErrorCode(content);
        String message = "Token endpoint returned status " + response.code();
        if (response.code() < 500) {
          throw OidcClientException.rejected(message, errorCode);
        }
        throw new OidcClientException(message, errorCode, null);
      }
    } catch (IOException e) {
      throw new OidcClientException("Token request failed due to network error", e);
    }

    try {
      Map<String, Object> tokenResponse = objectMapper.readValue(content, new TypeReference<>() {});
      return toTokenSet(tokenResponse);
    } catch (JsonProcessingException | NumberFormatException | ClassCastException e) {
      throw new OidcClientException("Malformed token response", e);
    }
  }

  private TokenSet toTokenSet(Map<String, Object> tokenResponse) {
    String idToken = (String) tokenResponse.get("id_token");
    Long expiresAt = null;
    if (tokenResponse.get("expires_in") != null) {
      long expiresIn = Long.parseLong(tokenResponse.get("expires_in").toString());
      expiresAt = clock.instant().getEpochSecond() + expiresIn;
    }

    return new TokenSet(
        (String) tokenResponse.get("access_token"),
        (String) tokenResponse.get("refresh_token"),
        idToken,
        (String) tokenResponse.get("token_type"),
        (String) tokenResponse.get("scope"),
        expiresAt,
        decodeClaims(idToken));
  }

  /**
   * Structural decode only; signature validation belongs to the token exchange consumer.
   */
  private Map<String, Object> decodeClaims(String idToken) {
    if (idToken == null || idToken.isBlank()) {
      return Map.of();
    }
    try {
      return JWTParser.parse(idToken).getJWTClaimsSet().toJSONObject();
    } catch (ParseException e) {
      throw new OidcClientException("Received a malformed ID token from the provider.", e);
    }
  }

  private String readErrorCode(String content) {
    if (content == null || content.isBlank()) {
      return null;
    }
    try {
      Map<String, Object> error = objectMapper.readValue(content, new TypeReference<>() {});
      Object code = error.get("error");
      return code == null ? null : code.toString();
    } catch (IOException e) {
      log.debug("Token endpoint error body is not JSON: {}", e.getMessage());
      return null;
    }
  }
}
