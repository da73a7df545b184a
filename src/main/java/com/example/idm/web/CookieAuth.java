package com.example.idm.web;

import java.util.Map;

/**
 * Session cookie write access for the current request/response cycle.
 */
public interface CookieAuth {

  void set(Map<String, Object> payload);

  void clear();
}
