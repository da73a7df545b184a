package com.example.idm.config;

import com.example.idm.cache.CaffeineIdmCache;
import com.example.idm.cache.IdmCache;
import com.example.idm.properties.IdmProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-process cache backend, for single-node and local deployments.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(name = "idm.cache.mode", havingValue = "local")
public class LocalCacheConfig {

  @Bean
  public IdmCache idmCache(ObjectMapper objectMapper, IdmProperties properties) {
    IdmProperties.CacheProperties cache = properties.cache();
    log.warn("Using in-process cache backend; state is not shared between instances");
    return new CaffeineIdmCache(objectMapper, cache.ttl(), cache.maxSize());
  }
}
