package com.example.idm.support;

import com.example.idm.web.CookieAuth;
import com.example.idm.web.IdmRequest;

import java.util.HashMap;
import java.util.Map;

/**
 * In-memory request whose cookie state is set directly and whose cookie writes are recorded.
 */
public class FakeIdmRequest implements IdmRequest, CookieAuth {

  private Map<String, Object> state;
  private Map<String, Object> lastSetPayload;
  private int clearCount;

  public FakeIdmRequest(Map<String, Object> state) {
    this.state = state;
  }

  public static FakeIdmRequest withoutCookie() {
    return new FakeIdmRequest(new HashMap<>());
  }

  public static FakeIdmRequest withCookie(Object cookieValue) {
    Map<String, Object> state = new HashMap<>();
    state.put("idm", cookieValue);
    return new FakeIdmRequest(state);
  }

  public static FakeIdmRequest withSubject(String subject) {
    return withCookie(Map.of("sub", subject));
  }

  @Override
  public Map<String, Object> state() {
    return state;
  }

  @Override
  public CookieAuth cookieAuth() {
    return this;
  }

  @Override
  public void set(Map<String, Object> payload) {
    lastSetPayload = payload;
    state = new HashMap<>(Map.of("idm", payload));
  }

  @Override
  public void clear() {
    clearCount++;
    state = new HashMap<>();
  }

  public Map<String, Object> lastSetPayload() {
    return lastSetPayload;
  }

  public int clearCount() {
    return clearCount;
  }
}
