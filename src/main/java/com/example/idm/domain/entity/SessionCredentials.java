package com.example.idm.domain.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Cached credentials of an authenticated session, keyed by the session subject.
 * Expiry is derived from {@code claims.exp} at read time and is never stored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionCredentials(
    Map<String, Object> claims,
    TokenSet tokenSet
) {

  public static final String CLAIM_EXPIRY = "exp";
  public static final String CLAIM_SUBJECT = "sub";

  /**
   * Checks whether the credentials are expired against the system clock.
   *
   * @return {@code true} when the claims are absent, carry no numeric {@code exp},
   *     or {@code exp} lies strictly before now.
   */
  @JsonIgnore
  public boolean isExpired() {
    return isExpired(Clock.systemUTC());
  }

  @JsonIgnore
  public boolean isExpired(Clock clock) {
    return isExpiredAt(clock.instant());
  }

  @JsonIgnore
  public boolean isExpiredAt(Instant now) {
    Optional<Number> expiry = expiryClaim();
    if (expiry.isEmpty()) {
      return true;
    }
    double nowSeconds = now.toEpochMilli() / 1000.0;
    return expiry.get().doubleValue() < nowSeconds;
  }

  /**
   * The {@code exp} claim in whole epoch seconds, if present and numeric.
   */
  @JsonIgnore
  public Optional<Long> expiresAt() {
    return expiryClaim().map(Number::longValue);
  }

  private Optional<Number> expiryClaim() {
    if (claims == null || !(claims.get(CLAIM_EXPIRY) instanceof Number exp)) {
      return Optional.empty();
    }
    return Optional.of(exp);
  }

  @JsonIgnore
  public Optional<String> subject() {
    if (claims == null || !(claims.get(CLAIM_SUBJECT) instanceof String sub) || sub.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(sub);
  }
}
