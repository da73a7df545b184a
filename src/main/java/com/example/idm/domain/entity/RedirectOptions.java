package com.example.idm.domain.entity;

import java.util.Map;

/**
 * Call-time options for outbound redirect generation.
 *
 * @param state          explicit correlation identifier; only for trusted callers resuming a flow
 * @param stateCacheData extra data stored with the request state, overriding computed fields
 * @param redirectUri    callback override for the final-stage URL
 * @param clientId       client identifier override for the final-stage URL
 */
public record RedirectOptions(
    String state,
    Map<String, Object> stateCacheData,
    String redirectUri,
    String clientId
) {

  public RedirectOptions {
    stateCacheData = stateCacheData == null ? Map.of() : stateCacheData;
  }

  public static RedirectOptions none() {
    return new RedirectOptions(null, Map.of(), null, null);
  }

  public static RedirectOptions withStateData(Map<String, Object> stateCacheData) {
    return new RedirectOptions(null, stateCacheData, null, null);
  }
}
