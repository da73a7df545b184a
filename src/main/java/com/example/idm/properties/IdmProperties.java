package com.example.idm.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Centralized configuration for the identity session gateway.
 * Read-only at call time; uses records for immutability.
 */
@Validated
@ConfigurationProperties(prefix = "idm")
public record IdmProperties(
    @NotBlank String appDomain,
    @NotBlank String identityAppUrl,
    @NotBlank String clientId,
    @NotBlank String serviceId,
    @NotBlank String defaultPolicy,
    @NotBlank String defaultJourney,
    @DefaultValue("/") @NotBlank String defaultBackToPath,
    @DefaultValue("/login/out") @NotBlank String outboundPath,
    @DefaultValue("/login/return") @NotBlank String returnUri,
    @DefaultValue("/logout") @NotBlank String logoutPath,
    @DefaultValue("/error") @NotBlank String disallowedRedirectPath,
    @NotNull @Valid CookieProperties cookie,
    @NotNull @Valid CacheProperties cache,
    @NotNull @Valid OidcProperties oidc,
    @NotNull @Valid OkHttpProperties http,
    @NotNull @Valid RedisProperties redis
) {

  /**
   * Fully qualified callback URI handed to the identity broker.
   */
  public String redirectUriFqdn() {
    return appDomain + returnUri;
  }

  /**
   * Session cookie configuration
   */
  public record CookieProperties(
      @DefaultValue("idm") @NotBlank String name,
      @DefaultValue("true") boolean secure,
      @DefaultValue("24h") @DurationUnit(ChronoUnit.HOURS) Duration ttl,
      @NotBlank String password,
      String domain
  ) {}

  /**
   * Cache facade configuration
   */
  public record CacheProperties(
      @DefaultValue("redis") @Pattern(regexp = "redis|local") String mode,
      @DefaultValue("idm") @NotBlank String segment,
      @DefaultValue("24h") @DurationUnit(ChronoUnit.HOURS) Duration ttl,
      @DefaultValue("10000") @Positive int maxSize
  ) {}

  /**
   * OpenID Connect provider configuration
   */
  public record OidcProperties(
      @NotBlank String discoveryUri,
      String clientSecret,
      @DefaultValue("1h") @DurationUnit(ChronoUnit.HOURS) Duration metadataTtl
  ) {}

  /**
   * OkHttp client configuration
   */
  public record OkHttpProperties(
      @NotNull @Valid ClientProperties client
  ) {
    public record ClientProperties(
        @DefaultValue("20") @Positive int maxIdleConnections,
        @DefaultValue("5") @Positive int keepAliveDurationMinutes,
        @DefaultValue("100") @Positive int maxRequests,
        @DefaultValue("20") @Positive int maxRequestsPerHost,
        @DefaultValue("3s") @DurationUnit(ChronoUnit.SECONDS) Duration connectTimeout,
        @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) Duration readTimeout
    ) {}
  }

  /**
   * Redis configuration with cluster support
   */
  public record RedisProperties(
      @DefaultValue("standalone") @Pattern(regexp = "standalone|cluster") String mode,
      @DefaultValue("localhost") @NotBlank String host,
      @DefaultValue("6379") @Min(1) @Max(65535) int port,
      String password,
      @DefaultValue("false") boolean ssl,
      String clusterNodes,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
      @NotNull @Valid PoolProperties pool
  ) {
    public record PoolProperties(
        @DefaultValue("16") @Positive int maxActive,
        @DefaultValue("8") @Positive int maxIdle,
        @DefaultValue("4") @PositiveOrZero int minIdle,
        @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration maxWait
    ) {}
  }
}
