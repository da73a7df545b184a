package com.example.idm.web;

import com.example.idm.properties.IdmProperties;
import com.example.idm.service.SessionCookieCodec;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Adapts servlet request/response pairs for the session services.
 */
@Component
@RequiredArgsConstructor
public class IdmRequestFactory {

  private final SessionCookieCodec codec;
  private final IdmProperties properties;

  public IdmRequest create(HttpServletRequest request, HttpServletResponse response) {
    return new ServletIdmRequest(request, response, codec, properties.cookie());
  }
}
