package com.example.idm.service;

import com.example.idm.cache.IdmCache;
import com.example.idm.domain.entity.AuthenticationIntent;
import com.example.idm.domain.entity.PersistedState;
import com.example.idm.domain.entity.RequestState;
import com.example.idm.properties.IdmProperties;
import com.example.idm.security.SessionKeyExtractor;
import com.nimbusds.oauth2.sdk.id.State;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.Optional;

/**
 * Creates and persists the per-attempt request state under an unguessable correlation
 * identifier. Entries are never deleted here; they expire with the cache TTL.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequestStateService {

  private final IdmCache cache;
  private final IdmProperties properties;

  /**
   * Fill in the configured policy and journey where the caller left them out.
   */
  public AuthenticationIntent applyDefaults(AuthenticationIntent intent) {
    Assert.notNull(intent, "authentication intent must be passed to applyDefaults");
    return new AuthenticationIntent(
        intent.backToPath(),
        StringUtils.hasText(intent.policyName()) ? intent.policyName() : properties.defaultPolicy(),
        intent.forceLogin(),
        StringUtils.hasText(intent.journey()) ? intent.journey() : properties.defaultJourney());
  }

  /**
   * Persist a new request state before any redirect is issued.
   *
   * @param explicitState identifier to reuse; {@code null} generates a fresh one
   * @param extra         caller data; non-null entries override the computed fields
   */
  public PersistedState beginAuthAttempt(AuthenticationIntent intent,
                                         String explicitState,
                                         Map<String, Object> extra) {
    AuthenticationIntent resolved = applyDefaults(intent);
    String state = StringUtils.hasText(explicitState) ? explicitState : newStateIdentifier();

    RequestState requestState = RequestState.withDefaults(
        resolved.policyName(),
        resolved.journey(),
        resolved.forceLogin(),
        resolved.backToPath(),
        extra);

    cache.set(state, requestState);
    log.debug("Stored request state {} for policy {} and journey {}",
              SessionKeyExtractor.mask(state), requestState.policyName(), requestState.journey());

    return new PersistedState(state, requestState);
  }

  public Optional<RequestState> find(String state) {
    if (!StringUtils.hasText(state)) {
      return Optional.empty();
    }
    return cache.get(state, RequestState.class);
  }

  /**
   * 256 bits from a secure random source, base64url encoded.
   */
  public static String newStateIdentifier() {
    return new State().getValue();
  }
}
