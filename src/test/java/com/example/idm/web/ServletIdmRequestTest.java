package com.example.idm.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.idm.properties.IdmProperties;
import com.example.idm.service.EncryptionService;
import com.example.idm.service.SessionCookieCodec;
import com.example.idm.support.IdmFixtures;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.Map;

@DisplayName("ServletIdmRequest")
class ServletIdmRequestTest {

  private IdmRequestFactory factory;
  private SessionCookieCodec codec;

  @BeforeEach
  void setUp() {
    IdmProperties properties = IdmFixtures.properties();
    codec = new SessionCookieCodec(new EncryptionService(properties), IdmFixtures.objectMapper());
    factory = new IdmRequestFactory(codec, properties);
  }

  @Test
  @DisplayName("should decode the session cookie into state keyed by cookie name")
  void shouldDecodeCookie() {
    MockHttpServletRequest servletRequest = new MockHttpServletRequest();
    servletRequest.setCookies(new Cookie("idm", codec.encode(Map.of("sub", "user-1"))));

    IdmRequest request = factory.create(servletRequest, new MockHttpServletResponse());

    assertThat(request.state()).containsEntry("idm", Map.of("sub", "user-1"));
  }

  @Test
  @DisplayName("should present an undecryptable cookie as no cookie")
  void shouldIgnoreGarbageCookie() {
    MockHttpServletRequest servletRequest = new MockHttpServletRequest();
    servletRequest.setCookies(new Cookie("idm", "garbage-value-that-is-long-enough"));

    assertThat(factory.create(servletRequest, new MockHttpServletResponse()).state()).isEmpty();
  }

  @Test
  @DisplayName("should write and clear an HttpOnly cookie")
  void shouldWriteAndClear() {
    MockHttpServletResponse response = new MockHttpServletResponse();
    IdmRequest request = factory.create(new MockHttpServletRequest(), response);

    request.cookieAuth().set(Map.of("sub", "user-1"));
    assertThat(request.state()).containsKey("idm");

    request.cookieAuth().clear();
    assertThat(request.state()).isEmpty();

    assertThat(response.getHeaders(HttpHeaders.SET_COOKIE)).hasSize(2);
    assertThat(response.getHeaders(HttpHeaders.SET_COOKIE).get(0)).startsWith("idm=").contains("HttpOnly", "Secure");
    assertThat(response.getHeaders(HttpHeaders.SET_COOKIE).get(1)).contains("Max-Age=0");
  }
}
