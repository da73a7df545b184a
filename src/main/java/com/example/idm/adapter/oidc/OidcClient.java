package com.example.idm.adapter.oidc;

import com.example.idm.domain.entity.TokenSet;

/**
 * OpenID Connect protocol client bound to one policy's provider metadata.
 * Handles protocol-specific operations; failures surface as
 * {@link com.example.idm.exception.OidcClientException}.
 */
public interface OidcClient {

  /**
   * Builds the provider's authorization URL for the given parameters.
   */
  String authorizationUrl(AuthorizationParameters parameters);

  /**
   * Exchanges a refresh token for a new token set.
   */
  TokenSet refresh(String refreshToken);

  /**
   * Exchanges an authorization code received on the callback for a token set.
   */
  TokenSet exchangeCode(String code, String redirectUri);

  /**
   * Parameters of an authorization request.
   */
  record AuthorizationParameters(
      String redirectUri,
      String scope,
      String responseMode,
      String state
  ) {}
}
