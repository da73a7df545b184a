package com.example.idm.cache;

import com.example.idm.exception.IdmCacheException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process cache facade for single-node and local deployments.
 * Entries are kept as JSON so reads behave exactly like the Redis backend.
 */
public class CaffeineIdmCache implements IdmCache {

  private final Cache<String, Entry> cache;
  private final ObjectMapper objectMapper;
  private final Duration defaultTtl;

  public CaffeineIdmCache(ObjectMapper objectMapper, Duration defaultTtl, long maxSize) {
    this.objectMapper = objectMapper;
    this.defaultTtl = defaultTtl;
    this.cache = Caffeine.newBuilder()
        .maximumSize(maxSize)
        .expireAfter(new PerEntryExpiry())
        .build();
  }

  @Override
  public <T> Optional<T> get(String key, Class<T> type) {
    Entry entry = cache.getIfPresent(key);
    if (entry == null) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.readValue(entry.json(), type));
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
      cache.put(key, new Entry(objectMapper.writeValueAsString(value), ttl));
    } catch (JsonProcessingException e) {
      throw new IdmCacheException("Failed to serialize cache entry", e);
    }
  }

  @Override
  public void drop(String key) {
    cache.invalidate(key);
  }

  private record Entry(String json, Duration ttl) {}

  private static final class PerEntryExpiry implements Expiry<String, Entry> {

    @Override
    public long expireAfterCreate(String key, Entry entry, long currentTime) {
      return entry.ttl().toNanos();
    }

    @Override
    public long expireAfterUpdate(String key, Entry entry, long currentTime,
                                  long currentDuration) {
      return entry.ttl().toNanos();
    }

    @Override
    public long expireAfterRead(String key, Entry entry, long currentTime,
                                long currentDuration) {
      return currentDuration;
    }
  }
}
