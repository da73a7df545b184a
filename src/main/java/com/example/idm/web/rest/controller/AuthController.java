package com.example.idm.web.rest.controller;

import com.example.idm.adapter.oidc.OidcClientFactory;
import com.example.idm.domain.entity.AuthenticationIntent;
import com.example.idm.domain.entity.RedirectOptions;
import com.example.idm.domain.entity.RequestState;
import com.example.idm.domain.entity.TokenSet;
import com.example.idm.properties.IdmProperties;
import com.example.idm.security.SessionKeyExtractor;
import com.example.idm.service.IdmService;
import com.example.idm.service.RequestStateService;
import com.example.idm.service.TokenSetResponseHandler;
import com.example.idm.util.QueryFlags;
import com.example.idm.web.IdmRequest;
import com.example.idm.web.IdmRequestFactory;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.Optional;

/**
 * Login round trip and logout endpoints.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class AuthController implements AuthAPI {

  private static final String NO_CACHE = "no-cache, no-store, must-revalidate";

  private final IdmService idmService;
  private final RequestStateService requestStateService;
  private final OidcClientFactory clientFactory;
  private final TokenSetResponseHandler tokenSetResponseHandler;
  private final IdmRequestFactory requestFactory;
  private final IdmProperties properties;

  @Override
  public ResponseEntity<Void> outbound(String backToPath, String policyName, String journey, String forceLogin) {
    AuthenticationIntent intent = new AuthenticationIntent(
        validateReturnPath(backToPath),
        StringUtils.hasText(policyName) ? policyName : null,
        QueryFlags.decode(forceLogin),
        StringUtils.hasText(journey) ? journey : null);

    String url = idmService.generateFinalOutboundRedirectUrl(intent, RedirectOptions.none());
    log.debug("Redirecting to identity provider for policy {}", intent.policyName());
    return redirect(url);
  }

  @Override
  public ResponseEntity<Void> callback(String code,
                                       String state,
                                       String error,
                                       String errorDescription,
                                       HttpServletRequest request,
                                       HttpServletResponse response) {
    if (StringUtils.hasText(error)) {
      log.warn("Identity provider returned error {}: {}", error, errorDescription);
      return redirect(properties.disallowedRedirectPath());
    }
    if (!StringUtils.hasText(code)) {
      log.warn("Callback without authorization code");
      return redirect(properties.disallowedRedirectPath());
    }

    Optional<RequestState> requestState = requestStateService.find(state);
    if (requestState.isEmpty()) {
      log.warn("Callback with unknown state {}", SessionKeyExtractor.mask(state));
      return redirect(properties.disallowedRedirectPath());
    }

    RequestState stored = requestState.get();
    String policyName = StringUtils.hasText(stored.policyName()) ? stored.policyName() : properties.defaultPolicy();

    TokenSet tokenSet = clientFactory.getClient(policyName).exchangeCode(code, properties.redirectUriFqdn());
    IdmRequest idmRequest = requestFactory.create(request, response);
    tokenSetResponseHandler.storeTokenSetResponse(idmRequest, tokenSet);

    log.info("Login completed for policy {}", policyName);
    return redirect(validateReturnPath(stored.backToPath()));
  }

  @Override
  public ResponseEntity<Void> logout(HttpServletRequest request, HttpServletResponse response) {
    idmService.logout(requestFactory.create(request, response));
    return redirect(properties.defaultBackToPath());
  }

  private ResponseEntity<Void> redirect(String location) {
    return ResponseEntity.status(HttpStatus.FOUND)
        .header(HttpHeaders.CACHE_CONTROL, NO_CACHE)
        .header(HttpHeaders.PRAGMA, "no-cache")
        .location(URI.create(location))
        .build();
  }

  /**
   * Only local paths are allowed as return targets; anything else falls back to the default.
   */
  private String validateReturnPath(String returnPath) {
    if (!StringUtils.hasText(returnPath)) {
      return properties.defaultBackToPath();
    }
    if (!returnPath.startsWith("/") || returnPath.startsWith("//") || returnPath.contains("\\")) {
      log.warn("Rejected non-local return path: {}", returnPath);
      return properties.defaultBackToPath();
    }
    if (returnPath.contains("..")) {
      log.warn("Rejected return path with traversal: {}", returnPath);
      return properties.defaultBackToPath();
    }
    return returnPath;
  }
}
