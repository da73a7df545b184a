package com.example.idm.service;

import com.example.idm.cache.IdmCache;
import com.example.idm.domain.entity.SessionCredentials;
import com.example.idm.domain.entity.TokenSet;
import com.example.idm.exception.SessionException;
import com.example.idm.properties.IdmProperties;
import com.example.idm.security.SessionKeyExtractor;
import com.example.idm.web.IdmRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Persists a token set as the session's credentials and points the session cookie at them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenSetResponseHandler {

  private final IdmCache cache;
  private final IdmProperties properties;

  public void storeTokenSetResponse(IdmRequest request, TokenSet tokenSet) {
    String sessionKey = resolveSessionKey(request, tokenSet);

    SessionCredentials credentials = new SessionCredentials(tokenSet.claims(), tokenSet);
    cache.set(sessionKey, credentials, properties.cookie().ttl());
    request.cookieAuth().set(Map.of(SessionCredentials.CLAIM_SUBJECT, sessionKey));

    log.debug("Stored session credentials for {}", SessionKeyExtractor.mask(sessionKey));
  }

  private String resolveSessionKey(IdmRequest request, TokenSet tokenSet) {
    if (tokenSet.claims().get(SessionCredentials.CLAIM_SUBJECT) instanceof String sub && !sub.isBlank()) {
      return sub;
    }
    // refresh responses may carry no id_token; keep the session the request already has
    return SessionKeyExtractor.extractSessionKey(request, properties.cookie().name())
        .orElseThrow(() -> new SessionException("Token response has no subject and no session is active"));
  }
}
