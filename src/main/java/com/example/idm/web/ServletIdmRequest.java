package com.example.idm.web;

import com.example.idm.properties.IdmProperties;
import com.example.idm.service.SessionCookieCodec;
import com.example.idm.util.CookieUtil;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.util.Map;

/**
 * {@link IdmRequest} over a servlet request/response pair. The session cookie is decoded
 * lazily, once, on first access to {@link #state()}.
 */
public class ServletIdmRequest implements IdmRequest, CookieAuth {

  private final HttpServletRequest request;
  private final HttpServletResponse response;
  private final SessionCookieCodec codec;
  private final IdmProperties.CookieProperties cookie;
  private Map<String, Object> state;

  public ServletIdmRequest(HttpServletRequest request,
                           HttpServletResponse response,
                           SessionCookieCodec codec,
                           IdmProperties.CookieProperties cookie) {
    this.request = request;
    this.response = response;
    this.codec = codec;
    this.cookie = cookie;
  }

  @Override
  public Map<String, Object> state() {
    if (state == null) {
      state = CookieUtil.getCookieValue(request, cookie.name())
          .flatMap(codec::decode)
          .map(value -> Map.of(cookie.name(), value))
          .orElseGet(Map::of);
    }
    return state;
  }

  @Override
  public CookieAuth cookieAuth() {
    return this;
  }

  @Override
  public void set(Map<String, Object> payload) {
    CookieUtil.setCookie(response, cookie.name(), codec.encode(payload),
                         cookie.ttl(), cookie.secure(), cookie.domain());
    state = Map.of(cookie.name(), payload);
  }

  @Override
  public void clear() {
    CookieUtil.clearCookie(response, cookie.name(), cookie.secure(), cookie.domain());
    state = Map.of();
  }
}
