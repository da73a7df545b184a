package com.example.idm.security;

import com.example.idm.web.IdmRequest;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * Reads the session cache key (the {@code sub} claim) from a request's session cookie state.
 * Total: every shape of missing or malformed cookie state yields {@link Optional#empty()}.
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class SessionKeyExtractor {

  public static final String SUBJECT_CLAIM = "sub";

  /**
   * Why no session key could be read. Only logged; callers see "no session" either way.
   */
  public enum Absence {
    NO_COOKIE_STATE,
    NO_COOKIE,
    MALFORMED_COOKIE,
    NO_SUBJECT
  }

  public static Optional<String> extractSessionKey(IdmRequest request, String cookieName) {
    Map<String, Object> state = request == null ? null : request.state();
    if (state == null) {
      return absent(Absence.NO_COOKIE_STATE, cookieName);
    }

    Object cookie = state.get(cookieName);
    if (cookie == null) {
      return absent(Absence.NO_COOKIE, cookieName);
    }
    if (!(cookie instanceof Map<?, ?> values)) {
      return absent(Absence.MALFORMED_COOKIE, cookieName);
    }
    if (!(values.get(SUBJECT_CLAIM) instanceof String subject) || subject.isBlank()) {
      return absent(Absence.NO_SUBJECT, cookieName);
    }
    return Optional.of(subject);
  }

  public static String mask(String value) {
    if (value == null || value.length() < 8) {
      return "INVALID";
    }
    return value.substring(0, 8) + "...";
  }

  private static Optional<String> absent(Absence reason, String cookieName) {
    log.debug("No session key in cookie '{}': {}", cookieName, reason);
    return Optional.empty();
  }
}
