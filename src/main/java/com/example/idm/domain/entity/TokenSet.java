package com.example.idm.domain.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token set as returned by the identity provider's token endpoint.
 * The {@code claims} are the decoded id_token claims with time claims in epoch seconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenSet(
    String accessToken,
    String refreshToken,
    String idToken,
    String tokenType,
    String scope,
    Long expiresAt,
    Map<String, Object> claims
) {

  public TokenSet {
    claims = claims == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
  }
}
