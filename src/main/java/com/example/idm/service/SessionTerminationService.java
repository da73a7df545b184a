package com.example.idm.service;

import com.example.idm.cache.IdmCache;
import com.example.idm.properties.IdmProperties;
import com.example.idm.security.SessionKeyExtractor;
import com.example.idm.web.IdmRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

import java.util.Optional;

/**
 * Ends the local session: drops the cached credentials when a session key can be read,
 * and always clears the session cookie.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionTerminationService {

  private final IdmCache cache;
  private final IdmProperties properties;

  public void logout(IdmRequest request) {
    Assert.notNull(request, "request object must be passed to idm.logout");

    Optional<String> sessionKey = SessionKeyExtractor.extractSessionKey(request, properties.cookie().name());
    try {
      sessionKey.ifPresent(cache::drop);
    } finally {
      request.cookieAuth().clear();
    }

    sessionKey.ifPresentOrElse(
        key -> log.info("Session terminated: {}", SessionKeyExtractor.mask(key)),
        () -> log.debug("Logout without an active session; cookie cleared"));
  }
}
