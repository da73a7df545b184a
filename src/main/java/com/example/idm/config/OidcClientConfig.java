package com.example.idm.config;

import com.example.idm.exception.OidcClientException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Protocol client wiring: circuit breaker around provider calls and the clock used
 * for expiry arithmetic. Only transport errors and provider-side faults open the breaker.
 */
@Configuration(proxyBeanMethods = false)
public class OidcClientConfig {

  @Bean
  public CircuitBreakerRegistry circuitBreakerRegistry() {
    CircuitBreakerConfig config = CircuitBreakerConfig.custom()
        .failureRateThreshold(50)
        .slidingWindowSize(20)
        .minimumNumberOfCalls(10)
        .waitDurationInOpenState(Duration.ofSeconds(30))
        // refused grants say nothing about provider health
        .recordException(e -> !(e instanceof OidcClientException oidc && oidc.isRejected()))
        .build();
    return CircuitBreakerRegistry.of(config);
  }

  @Bean
  public CircuitBreaker oidcCircuitBreaker(CircuitBreakerRegistry registry) {
    return registry.circuitBreaker("identityProvider");
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
