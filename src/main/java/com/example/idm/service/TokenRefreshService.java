package com.example.idm.service;

import com.example.idm.adapter.oidc.OidcClientFactory;
import com.example.idm.domain.entity.TokenSet;
import com.example.idm.properties.IdmProperties;
import com.example.idm.web.IdmRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Exchanges a refresh token for a new token set and stores it as the session's credentials.
 * Provider and store failures propagate; nothing is stored when the exchange fails.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenRefreshService {

  private final OidcClientFactory clientFactory;
  private final TokenSetResponseHandler tokenSetResponseHandler;
  private final IdmProperties properties;

  public void refresh(IdmRequest request, String refreshToken, String policyName) {
    Assert.notNull(request, "request object must be passed to idm.refresh");
    String policy = StringUtils.hasText(policyName) ? policyName : properties.defaultPolicy();

    TokenSet tokenSet = clientFactory.getClient(policy).refresh(refreshToken);
    tokenSetResponseHandler.storeTokenSetResponse(request, tokenSet);

    log.info("Refreshed session tokens for policy {}", policy);
  }
}
