package com.example.idm.service;

import com.example.idm.domain.entity.AuthenticationIntent;
import com.example.idm.domain.entity.AuthenticationUrlOptions;
import com.example.idm.domain.entity.RedirectOptions;
import com.example.idm.domain.entity.SessionCredentials;
import com.example.idm.domain.url.OutboundUrl;
import com.example.idm.properties.IdmProperties;
import com.example.idm.web.IdmRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Entry point for host applications: session lookup, login redirects, token refresh and logout.
 */
@Service
@RequiredArgsConstructor
public class IdmService {

  private final SessionCredentialsService credentialsService;
  private final OutboundRedirectService redirectService;
  private final TokenRefreshService refreshService;
  private final SessionTerminationService terminationService;
  private final IdmProperties properties;

  public Optional<SessionCredentials> getCredentials(IdmRequest request) {
    return credentialsService.getCredentials(request);
  }

  public Optional<Map<String, Object>> getClaims(IdmRequest request) {
    return credentialsService.getClaims(request);
  }

  public String generateAuthenticationUrl(String backToPath, AuthenticationUrlOptions options) {
    return redirectService.authenticationUrl(backToPath, options).format();
  }

  public OutboundUrl generateAuthenticationUrlObject(String backToPath, AuthenticationUrlOptions options) {
    return redirectService.authenticationUrl(backToPath, options);
  }

  public String generateFirstStageOutboundRedirectUrl(AuthenticationIntent intent, RedirectOptions options) {
    return redirectService.firstStageUrl(intent, options);
  }

  public String generateFinalOutboundRedirectUrl(AuthenticationIntent intent, RedirectOptions options) {
    return redirectService.finalStageUrl(intent, options);
  }

  public void refreshToken(IdmRequest request, String refreshToken, String policyName) {
    refreshService.refresh(request, refreshToken, policyName);
  }

  public void logout(IdmRequest request) {
    terminationService.logout(request);
  }

  public IdmProperties getConfig() {
    return properties;
  }
}
