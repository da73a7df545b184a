package com.example.idm.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store backing request state and session credentials.
 * Values are stored as JSON; store I/O failures propagate to the caller unmodified.
 */
public interface IdmCache {

  <T> Optional<T> get(String key, Class<T> type);

  /**
   * Store a value with the configured default TTL.
   */
  void set(String key, Object value);

  void set(String key, Object value, Duration ttl);

  void drop(String key);
}
