package com.example.idm.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.example.idm.cache.CaffeineIdmCache;
import com.example.idm.cache.IdmCache;
import com.example.idm.domain.entity.AuthenticationIntent;
import com.example.idm.domain.entity.PersistedState;
import com.example.idm.domain.entity.RequestState;
import com.example.idm.exception.IdmCacheException;
import com.example.idm.support.IdmFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

@DisplayName("RequestStateService")
class RequestStateServiceTest {

  private CaffeineIdmCache cache;
  private RequestStateService service;

  @BeforeEach
  void setUp() {
    cache = IdmFixtures.cache();
    service = new RequestStateService(cache, IdmFixtures.properties());
  }

  @Nested
  @DisplayName("beginAuthAttempt")
  class BeginAuthAttempt {

    @Test
    @DisplayName("should store configured defaults under a fresh state")
    void shouldStoreDefaults() {
      PersistedState persisted = service.beginAuthAttempt(
          AuthenticationIntent.returningTo("/account"), null, null);

      RequestState stored = cache.get(persisted.state(), RequestState.class).orElseThrow();
      assertThat(stored.policyName()).isEqualTo(IdmFixtures.DEFAULT_POLICY);
      assertThat(stored.journey()).isEqualTo(IdmFixtures.DEFAULT_JOURNEY);
      assertThat(stored.forceLogin()).isFalse();
      assertThat(stored.backToPath()).isEqualTo("/account");
      assertThat(stored).isEqualTo(persisted.requestState());
    }

    @Test
    @DisplayName("should reuse an explicit state")
    void shouldReuseExplicitState() {
      PersistedState persisted = service.beginAuthAttempt(
          AuthenticationIntent.returningTo("/"), "resume-123", Map.of());

      assertThat(persisted.state()).isEqualTo("resume-123");
      assertThat(cache.get("resume-123", RequestState.class)).isPresent();
    }

    @Test
    @DisplayName("should let caller data override computed fields and keep extensions")
    void shouldApplyOverrides() {
      Map<String, Object> extra = new HashMap<>();
      extra.put("policyName", "b2c_1a_reset");
      extra.put("journey", null);
      extra.put("resetToken", "abc");

      PersistedState persisted = service.beginAuthAttempt(
          new AuthenticationIntent("/", "b2c_1a_signin", true, "sign-in"), null, extra);

      RequestState stored = cache.get(persisted.state(), RequestState.class).orElseThrow();
      assertThat(stored.policyName()).isEqualTo("b2c_1a_reset");
      assertThat(stored.journey()).isEqualTo("sign-in");
      assertThat(stored.forceLogin()).isTrue();
      assertThat(stored.extension("resetToken")).contains("abc");
    }

    @Test
    @DisplayName("should propagate store failures")
    void shouldPropagateStoreFailure() {
      IdmCache failing = mock(IdmCache.class);
      doThrow(new IdmCacheException("store down")).when(failing).set(anyString(), any());
      RequestStateService failingService = new RequestStateService(failing, IdmFixtures.properties());

      assertThatThrownBy(() -> failingService.beginAuthAttempt(
          AuthenticationIntent.returningTo("/"), null, null))
          .isInstanceOf(IdmCacheException.class)
          .hasMessage("store down");
    }
  }

  @Nested
  @DisplayName("State identifiers")
  class StateIdentifiers {

    @Test
    @DisplayName("should not repeat across many attempts")
    void shouldBeUnique() {
      Set<String> seen = new HashSet<>();
      for (int i = 0; i < 10_000; i++) {
        seen.add(RequestStateService.newStateIdentifier());
      }
      assertThat(seen).hasSize(10_000);
    }

    @Test
    @DisplayName("should carry 256 bits of base64url text")
    void shouldBeUrlSafe() {
      String state = RequestStateService.newStateIdentifier();
      assertThat(state).matches("[A-Za-z0-9_-]{43}");
    }
  }

  @Nested
  @DisplayName("find")
  class Find {

    @Test
    @DisplayName("should return empty for blank or unknown state")
    void shouldReturnEmptyForUnknown() {
      assertThat(service.find(null)).isEmpty();
      assertThat(service.find("")).isEmpty();
      assertThat(service.find("unknown")).isEmpty();
    }
  }
}
