package com.example.idm.service;

import com.example.idm.cache.IdmCache;
import com.example.idm.domain.entity.SessionCredentials;
import com.example.idm.properties.IdmProperties;
import com.example.idm.security.SessionKeyExtractor;
import com.example.idm.web.IdmRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves the cached credentials for the session named by the request's cookie.
 * A missing, malformed or unknown session is an empty result, never an error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionCredentialsService {

  private final IdmCache cache;
  private final IdmProperties properties;

  public Optional<SessionCredentials> getCredentials(IdmRequest request) {
    Assert.notNull(request, "request object must be passed to idm.getCredentials");

    Optional<String> sessionKey = SessionKeyExtractor.extractSessionKey(request, properties.cookie().name());
    if (sessionKey.isEmpty()) {
      return Optional.empty();
    }

    Optional<SessionCredentials> credentials = cache.get(sessionKey.get(), SessionCredentials.class);
    if (credentials.isEmpty()) {
      log.debug("No cached credentials for session {}", SessionKeyExtractor.mask(sessionKey.get()));
    }
    return credentials;
  }

  public Optional<Map<String, Object>> getClaims(IdmRequest request) {
    Assert.notNull(request, "request object must be passed to idm.getClaims");
    return getCredentials(request).map(SessionCredentials::claims);
  }
}
