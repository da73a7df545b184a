package com.example.idm.web;

import java.util.Map;

/**
 * The slice of an inbound request the session bookkeeping needs: decoded cookie state
 * keyed by cookie name, and the capability to set or clear the session cookie.
 */
public interface IdmRequest {

  /**
   * Decoded cookie values by cookie name. A value may have any shape; callers must
   * check it before reading from it.
   */
  Map<String, Object> state();

  CookieAuth cookieAuth();
}
