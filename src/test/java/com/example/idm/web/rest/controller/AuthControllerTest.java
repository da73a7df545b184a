package com.example.idm.web.rest.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.redirectedUrl;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.idm.adapter.oidc.OidcClient;
import com.example.idm.adapter.oidc.OidcClientFactory;
import com.example.idm.domain.entity.AuthenticationIntent;
import com.example.idm.domain.entity.RedirectOptions;
import com.example.idm.domain.entity.RequestState;
import com.example.idm.domain.entity.TokenSet;
import com.example.idm.exception.OidcClientException;
import com.example.idm.service.IdmService;
import com.example.idm.service.RequestStateService;
import com.example.idm.service.TokenSetResponseHandler;
import com.example.idm.support.FakeIdmRequest;
import com.example.idm.support.IdmFixtures;
import com.example.idm.web.IdmRequestFactory;
import com.example.idm.web.rest.errors.GlobalErrorHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Map;
import java.util.Optional;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthController")
class AuthControllerTest {

  @Mock
  private IdmService idmService;

  @Mock
  private RequestStateService requestStateService;

  @Mock
  private OidcClientFactory clientFactory;

  @Mock
  private OidcClient client;

  @Mock
  private TokenSetResponseHandler tokenSetResponseHandler;

  @Mock
  private IdmRequestFactory requestFactory;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    AuthController controller = new AuthController(idmService, requestStateService, clientFactory,
        tokenSetResponseHandler, requestFactory, IdmFixtures.properties());
    mockMvc = MockMvcBuilders.standaloneSetup(controller)
        .setControllerAdvice(new GlobalErrorHandler())
        .build();
  }

  @Nested
  @DisplayName("Outbound")
  class Outbound {

    @Test
    @DisplayName("should redirect to the authorization URL with the decoded flag")
    void shouldRedirect() throws Exception {
      when(idmService.generateFinalOutboundRedirectUrl(any(), any()))
          .thenReturn("https://login.example.com/authorize?state=s");

      mockMvc.perform(get("/login/out")
              .param("backToPath", "/account")
              .param("policyName", "b2c_1a_signup")
              .param("forceLogin", "yes"))
          .andExpect(status().isFound())
          .andExpect(redirectedUrl("https://login.example.com/authorize?state=s"))
          .andExpect(header().string("Cache-Control", "no-cache, no-store, must-revalidate"));

      ArgumentCaptor<AuthenticationIntent> intent = ArgumentCaptor.forClass(AuthenticationIntent.class);
      verify(idmService).generateFinalOutboundRedirectUrl(intent.capture(), any(RedirectOptions.class));
      assertThat(intent.getValue()).isEqualTo(new AuthenticationIntent("/account", "b2c_1a_signup", true, null));
    }

    @Test
    @DisplayName("should replace an off-site back-to path with the default")
    void shouldRejectOffsiteBackToPath() throws Exception {
      when(idmService.generateFinalOutboundRedirectUrl(any(), any())).thenReturn("https://login.example.com/a");

      mockMvc.perform(get("/login/out").param("backToPath", "//evil.example.com"))
          .andExpect(status().isFound());

      ArgumentCaptor<AuthenticationIntent> intent = ArgumentCaptor.forClass(AuthenticationIntent.class);
      verify(idmService).generateFinalOutboundRedirectUrl(intent.capture(), any());
      assertThat(intent.getValue().backToPath()).isEqualTo("/");
      assertThat(intent.getValue().forceLogin()).isFalse();
    }

    @Test
    @DisplayName("should answer 502 when the provider is unavailable")
    void shouldMapProviderFailure() throws Exception {
      when(idmService.generateFinalOutboundRedirectUrl(any(), any()))
          .thenThrow(new OidcClientException("discovery failed"));

      mockMvc.perform(get("/login/out"))
          .andExpect(status().isBadGateway())
          .andExpect(jsonPath("$.error").value("identity_provider_error"));
    }
  }

  @Nested
  @DisplayName("Callback")
  class Callback {

    @Test
    @DisplayName("should store the session and return to the stored path")
    void shouldCompleteLogin() throws Exception {
      FakeIdmRequest idmRequest = FakeIdmRequest.withoutCookie();
      TokenSet tokenSet = new TokenSet("at", "rt", "id", "Bearer", null, null, Map.of("sub", "user-1"));
      when(requestStateService.find("state-1"))
          .thenReturn(Optional.of(RequestState.withDefaults("b2c_1a_signin", "sign-in", false, "/orders", null)));
      when(clientFactory.getClient("b2c_1a_signin")).thenReturn(client);
      when(client.exchangeCode("code-1", "https://app.example.com/login/return")).thenReturn(tokenSet);
      when(requestFactory.create(any(), any())).thenReturn(idmRequest);

      mockMvc.perform(post("/login/return")
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .param("code", "code-1")
              .param("state", "state-1"))
          .andExpect(status().isFound())
          .andExpect(redirectedUrl("/orders"));

      verify(tokenSetResponseHandler).storeTokenSetResponse(idmRequest, tokenSet);
    }

    @Test
    @DisplayName("should send unknown states to the disallowed path")
    void shouldRejectUnknownState() throws Exception {
      when(requestStateService.find("forged")).thenReturn(Optional.empty());

      mockMvc.perform(post("/login/return")
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .param("code", "code-1")
              .param("state", "forged"))
          .andExpect(status().isFound())
          .andExpect(redirectedUrl("/error"));

      verify(clientFactory, never()).getClient(any());
    }

    @Test
    @DisplayName("should send provider errors to the disallowed path")
    void shouldRejectProviderError() throws Exception {
      mockMvc.perform(post("/login/return")
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .param("error", "access_denied")
              .param("state", "state-1"))
          .andExpect(status().isFound())
          .andExpect(redirectedUrl("/error"));

      verify(requestStateService, never()).find(eq("state-1"));
    }
  }

  @Test
  @DisplayName("should log out and return to the default path")
  void shouldLogout() throws Exception {
    FakeIdmRequest idmRequest = FakeIdmRequest.withSubject("user-1");
    when(requestFactory.create(any(), any())).thenReturn(idmRequest);

    mockMvc.perform(get("/logout"))
        .andExpect(status().isFound())
        .andExpect(redirectedUrl("/"));

    verify(idmService).logout(idmRequest);
  }
}
