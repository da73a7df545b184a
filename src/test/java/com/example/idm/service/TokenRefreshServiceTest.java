package com.example.idm.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.idm.adapter.oidc.OidcClient;
import com.example.idm.adapter.oidc.OidcClientFactory;
import com.example.idm.cache.CaffeineIdmCache;
import com.example.idm.domain.entity.SessionCredentials;
import com.example.idm.domain.entity.TokenSet;
import com.example.idm.exception.OidcClientException;
import com.example.idm.properties.IdmProperties;
import com.example.idm.support.FakeIdmRequest;
import com.example.idm.support.IdmFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

@ExtendWith(MockitoExtension.class)
@DisplayName("TokenRefreshService")
class TokenRefreshServiceTest {

  @Mock
  private OidcClientFactory clientFactory;

  @Mock
  private OidcClient client;

  private CaffeineIdmCache cache;
  private TokenRefreshService service;

  @BeforeEach
  void setUp() {
    IdmProperties properties = IdmFixtures.properties();
    cache = IdmFixtures.cache();
    service = new TokenRefreshService(clientFactory, new TokenSetResponseHandler(cache, properties), properties);
  }

  @Test
  @DisplayName("should store the refreshed token set under the subject and set the cookie")
  void shouldStoreRefreshedTokens() {
    Map<String, Object> claims = Map.of("sub", "user-1", "exp", 4_000_000_000L);
    when(clientFactory.getClient("b2c_1a_signin")).thenReturn(client);
    when(client.refresh("rt-old")).thenReturn(new TokenSet("at", "rt-new", "id", "Bearer", null, null, claims));
    FakeIdmRequest request = FakeIdmRequest.withSubject("user-1");

    service.refresh(request, "rt-old", "b2c_1a_signin");

    assertThat(cache.get("user-1", SessionCredentials.class))
        .hasValueSatisfying(stored -> assertThat(stored.tokenSet().refreshToken()).isEqualTo("rt-new"));
    assertThat(request.lastSetPayload()).containsEntry("sub", "user-1");
  }

  @Test
  @DisplayName("should keep the current session key when the response has no id_token")
  void shouldFallBackToCurrentSession() {
    when(clientFactory.getClient(IdmFixtures.DEFAULT_POLICY)).thenReturn(client);
    when(client.refresh("rt")).thenReturn(new TokenSet("at", "rt2", null, "Bearer", null, null, null));

    service.refresh(FakeIdmRequest.withSubject("user-9"), "rt", null);

    assertThat(cache.get("user-9", SessionCredentials.class)).isPresent();
  }

  @Test
  @DisplayName("should propagate provider failures without storing anything")
  void shouldPropagateProviderFailure() {
    when(clientFactory.getClient("b2c_1a_signin")).thenReturn(client);
    when(client.refresh(any())).thenThrow(OidcClientException.rejected("invalid_grant", "invalid_grant"));
    FakeIdmRequest request = FakeIdmRequest.withSubject("user-1");

    assertThatThrownBy(() -> service.refresh(request, "revoked", "b2c_1a_signin"))
        .isInstanceOf(OidcClientException.class);

    assertThat(cache.get("user-1", SessionCredentials.class)).isEmpty();
    assertThat(request.lastSetPayload()).isNull();
  }

  @Test
  @DisplayName("should reject a null request before calling the provider")
  void shouldRejectNullRequest() {
    assertThatThrownBy(() -> service.refresh(null, "rt", "p"))
        .isInstanceOf(IllegalArgumentException.class);
    verify(clientFactory, never()).getClient(any());
  }
}
