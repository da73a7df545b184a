package com.example.idm.adapter.oidc;

/**
 * Supplies a protocol client per authentication policy.
 */
public interface OidcClientFactory {

  OidcClient getClient(String policyName);
}
