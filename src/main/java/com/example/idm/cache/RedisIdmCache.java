package com.example.idm.cache;

import com.example.idm.exception.IdmCacheException;
import com.example.idm.properties.IdmProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed cache facade. Keys live under the configured segment prefix.
 */
@Slf4j
public class RedisIdmCache implements IdmCache {

  private final RedisTemplate<String, String> redisTemplate;
  private final ObjectMapper objectMapper;
  private final String keyPrefix;
  private final Duration defaultTtl;

  public RedisIdmCache(RedisTemplate<String, String> redisTemplate,
                       ObjectMapper objectMapper,
                       IdmProperties.CacheProperties cacheProperties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.keyPrefix = cacheProperties.segment() + ":";
    this.defaultTtl = cacheProperties.ttl();
  }

  @Override
  public <T> Optional<T> get(String key, Class<T> type) {
    String json = redisTemplate.opsForValue().get(keyPrefix + key);
    if (json == null) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.readValue(json, type));
    } catch (JsonProcessingException e) {
      throw new IdmCacheException("Invalid cache entry format for type " + type.getSimpleName(), e);
    }
  }

  @Override
  public void set(String key, Object value) {
    set(key, value, defaultTtl);
  }

  @Override
  public void set(String key, Object value, Duration ttl) {
    try {
      String json = objectMapper.writeValueAsString(value);
      redisTemplate.opsForValue().set(keyPrefix + key, json, ttl);
    } catch (JsonProcessingException e) {
      throw new IdmCacheException("Failed to serialize cache entry", e);
    }
  }

  @Override
  public void drop(String key) {
    Boolean deleted = redisTemplate.delete(keyPrefix + key);
    log.debug("Dropped cache entry under segment {}: {}", keyPrefix, Boolean.TRUE.equals(deleted));
  }
}
