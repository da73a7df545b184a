package com.example.idm.domain.entity;

/**
 * What the caller wants from a login: where to return, which policy and journey,
 * and whether the broker's existing-session shortcut should be bypassed.
 * {@code policyName} and {@code journey} may be {@code null} to use the configured defaults.
 */
public record AuthenticationIntent(
    String backToPath,
    String policyName,
    boolean forceLogin,
    String journey
) {

  public static AuthenticationIntent returningTo(String backToPath) {
    return new AuthenticationIntent(backToPath, null, false, null);
  }
}
