package com.example.idm.exception;

/**
 * Cache facade serialization failure
 */
public class IdmCacheException extends RuntimeException {
  public IdmCacheException(String message) {
    super(message);
  }

  public IdmCacheException(String message, Throwable cause) {
    super(message, cause);
  }
}
