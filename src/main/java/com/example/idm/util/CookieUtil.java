package com.example.idm.util;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.web.util.WebUtils;

import java.time.Duration;
import java.util.Optional;

/**
 * Cookie utility for the session cookie.
 * Uses Spring's ResponseCookie builder for proper cookie handling.
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CookieUtil {

  private static final String COOKIE_PATH = "/";
  // Lax: the identity broker returns via a cross-site form post followed by top-level redirects
  private static final String SAME_SITE_LAX = "Lax";

  /**
   * Extract a non-empty cookie value by name.
   */
  public static Optional<String> getCookieValue(HttpServletRequest request, String name) {
    if (request == null || name == null) {
      return Optional.empty();
    }
    Cookie cookie = WebUtils.getCookie(request, name);
    return Optional.ofNullable(cookie)
        .map(Cookie::getValue)
        .filter(value -> !value.isEmpty());
  }

  /**
   * Set an HttpOnly cookie.
   *
   * @param domain optional domain (null for current domain)
   */
  public static void setCookie(HttpServletResponse response,
                               String name,
                               String value,
                               Duration maxAge,
                               boolean secure,
                               String domain) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Cookie value cannot be null or empty");
    }

    ResponseCookie.ResponseCookieBuilder cookieBuilder = ResponseCookie
        .from(name, value)
        .httpOnly(true)
        .secure(secure)
        .path(COOKIE_PATH)
        .maxAge(maxAge)
        .sameSite(SAME_SITE_LAX);

    if (domain != null && !domain.isBlank()) {
      cookieBuilder.domain(domain);
    }

    response.addHeader(HttpHeaders.SET_COOKIE, cookieBuilder.build().toString());
    log.debug("Set cookie: name={}, secure={}, maxAge={}", name, secure, maxAge);
  }

  /**
   * Expire a cookie immediately.
   *
   * @param domain optional domain (should match the domain used when setting)
   */
  public static void clearCookie(HttpServletResponse response, String name, boolean secure, String domain) {
    ResponseCookie.ResponseCookieBuilder cookieBuilder = ResponseCookie
        .from(name, "")
        .httpOnly(true)
        .secure(secure)
        .path(COOKIE_PATH)
        .maxAge(0)
        .sameSite(SAME_SITE_LAX);

    if (domain != null && !domain.isBlank()) {
      cookieBuilder.domain(domain);
    }

    response.addHeader(HttpHeaders.SET_COOKIE, cookieBuilder.build().toString());
    log.debug("Cleared cookie: name={}", name);
  }
}
