package com.example.idm.domain.entity;

/**
 * Options for a plain link to the local outbound endpoint.
 */
public record AuthenticationUrlOptions(
    String policyName,
    String journey,
    boolean forceLogin
) {

  public static AuthenticationUrlOptions none() {
    return new AuthenticationUrlOptions(null, null, false);
  }
}
