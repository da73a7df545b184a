package com.example.idm.service;

import com.example.idm.adapter.oidc.OidcClient;
import com.example.idm.adapter.oidc.OidcClientFactory;
import com.example.idm.domain.entity.AuthenticationIntent;
import com.example.idm.domain.entity.AuthenticationUrlOptions;
import com.example.idm.domain.entity.PersistedState;
import com.example.idm.domain.entity.RedirectOptions;
import com.example.idm.domain.url.OutboundUrl;
import com.example.idm.properties.IdmProperties;
import com.example.idm.util.QueryFlags;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the outbound URLs of the login round trip: the plain link to the local outbound
 * endpoint, the first-stage URL through the identity app, and the final-stage authorization URL.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboundRedirectService {

  static final String IDENTITY_APP_AUTH_PATH = "/auth";
  static final String SCOPE = "openid offline_access";
  static final String RESPONSE_MODE_FORM_POST = "form_post";
  static final String PROMPT_LOGIN = "login";

  private final RequestStateService requestStateService;
  private final OidcClientFactory clientFactory;
  private final IdmProperties properties;

  /**
   * Link to this application's outbound endpoint.
   */
  public OutboundUrl authenticationUrl(String backToPath, AuthenticationUrlOptions options) {
    AuthenticationUrlOptions opts = options == null ? AuthenticationUrlOptions.none() : options;

    Map<String, String> query = new LinkedHashMap<>();
    query.put("backToPath", StringUtils.hasText(backToPath) ? backToPath : properties.defaultBackToPath());
    query.put("policyName", opts.policyName());
    query.put("journey", opts.journey());
    query.put("forceLogin", QueryFlags.encode(opts.forceLogin()));

    return OutboundUrl.parse(properties.appDomain())
        .withPath(properties.outboundPath())
        .withQueryParams(query);
  }

  /**
   * Persist the request state and point the user at the identity app, which bounces them
   * back through this application before the identity provider.
   */
  public String firstStageUrl(AuthenticationIntent intent, RedirectOptions options) {
    RedirectOptions opts = options == null ? RedirectOptions.none() : options;
    AuthenticationIntent resolved = requestStateService.applyDefaults(intent);
    PersistedState persisted = requestStateService.beginAuthAttempt(
        resolved, opts.state(), opts.stateCacheData());

    Map<String, String> query = new LinkedHashMap<>();
    query.put("redirect_uri", properties.redirectUriFqdn());
    query.put("forceLogin", QueryFlags.encode(resolved.forceLogin()));
    query.put("policyName", resolved.policyName());
    query.put("journey", resolved.journey());
    query.put("state", persisted.state());
    query.put("client_id", properties.clientId());
    query.put("serviceId", properties.serviceId());

    return OutboundUrl.parse(properties.identityAppUrl())
        .withPath(IDENTITY_APP_AUTH_PATH)
        .withQueryParams(query)
        .format();
  }

  /**
   * Persist the request state and build the identity provider's authorization URL,
   * adding the journey, the login prompt and any client identifier override.
   */
  public String finalStageUrl(AuthenticationIntent intent, RedirectOptions options) {
    RedirectOptions opts = options == null ? RedirectOptions.none() : options;
    AuthenticationIntent resolved = requestStateService.applyDefaults(intent);
    String redirectUri = StringUtils.hasText(opts.redirectUri())
        ? opts.redirectUri()
        : properties.redirectUriFqdn();

    PersistedState persisted = requestStateService.beginAuthAttempt(
        resolved, opts.state(), opts.stateCacheData());

    OidcClient client = clientFactory.getClient(resolved.policyName());
    String authorizationUrl = client.authorizationUrl(new OidcClient.AuthorizationParameters(
        redirectUri, SCOPE, RESPONSE_MODE_FORM_POST, persisted.state()));

    OutboundUrl url = OutboundUrl.parse(authorizationUrl)
        .withQueryParam("journey", resolved.journey());

    if (resolved.forceLogin()) {
      url = url.withQueryParam("prompt", PROMPT_LOGIN);
    }
    if (StringUtils.hasText(opts.clientId())) {
      url = url.withQueryParam("client_id", opts.clientId());
    }

    log.debug("Generated authorization URL for policy {}", resolved.policyName());
    return url.format();
  }
}
