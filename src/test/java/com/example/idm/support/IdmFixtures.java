package com.example.idm.support;

import com.example.idm.cache.CaffeineIdmCache;
import com.example.idm.properties.IdmProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;

/**
 * Shared configuration and collaborators for unit tests.
 */
public final class IdmFixtures {

  /** Base64 of 32 zero bytes. */
  public static final String COOKIE_KEY = "AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA=";

  public static final String APP_DOMAIN = "https://app.example.com";
  public static final String IDENTITY_APP_URL = "https://identity.example.com";
  public static final String CLIENT_ID = "app-client";
  public static final String SERVICE_ID = "app-service";
  public static final String DEFAULT_POLICY = "b2c_1a_signin";
  public static final String DEFAULT_JOURNEY = "sign-in";

  private IdmFixtures() {
  }

  public static IdmProperties properties() {
    return properties("https://login.example.com/{policyName}/v2.0/.well-known/openid-configuration");
  }

  public static IdmProperties properties(String discoveryUri) {
    return new IdmProperties(
        APP_DOMAIN,
        IDENTITY_APP_URL,
        CLIENT_ID,
        SERVICE_ID,
        DEFAULT_POLICY,
        DEFAULT_JOURNEY,
        "/",
        "/login/out",
        "/login/return",
        "/logout",
        "/error",
        new IdmProperties.CookieProperties("idm", true, Duration.ofHours(24), COOKIE_KEY, null),
        new IdmProperties.CacheProperties("local", "idm", Duration.ofHours(24), 1000),
        new IdmProperties.OidcProperties(discoveryUri, null, Duration.ofHours(1)),
        new IdmProperties.OkHttpProperties(new IdmProperties.OkHttpProperties.ClientProperties(
            5, 1, 10, 5, Duration.ofSeconds(2), Duration.ofSeconds(2))),
        new IdmProperties.RedisProperties("standalone", "localhost", 6379, null, false, null,
            Duration.ofSeconds(2),
            new IdmProperties.RedisProperties.PoolProperties(4, 2, 0, Duration.ofSeconds(1))));
  }

  public static ObjectMapper objectMapper() {
    return new ObjectMapper();
  }

  public static CaffeineIdmCache cache() {
    return new CaffeineIdmCache(objectMapper(), Duration.ofMinutes(5), 1000);
  }
}
