package com.example.idm.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.idm.properties.IdmProperties;
import com.example.idm.support.IdmFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

@DisplayName("ConfigurationValidator")
class ConfigurationValidatorTest {

  @Test
  @DisplayName("should accept the test configuration")
  void shouldAcceptValidConfiguration() {
    assertThat(ConfigurationValidator.validate(IdmFixtures.properties())).isEmpty();
  }

  @Test
  @DisplayName("should allow plain HTTP on localhost only")
  void shouldRequireHttps() {
    IdmProperties local = IdmFixtures.properties("http://localhost:9000/{policyName}/.well-known/openid-configuration");
    IdmProperties remote = IdmFixtures.properties("http://login.example.com/{policyName}/.well-known/openid-configuration");

    assertThat(ConfigurationValidator.validate(local)).isEmpty();
    List<String> errors = ConfigurationValidator.validate(remote);
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0)).contains("must use HTTPS");
  }

  @Test
  @DisplayName("should collect every violation and fail startup once")
  void shouldCollectViolations() {
    IdmProperties base = IdmFixtures.properties();
    IdmProperties broken = new IdmProperties(
        base.appDomain(), base.identityAppUrl(), base.clientId(), base.serviceId(),
        base.defaultPolicy(), base.defaultJourney(), base.defaultBackToPath(),
        "login/out", "/login/../return", base.logoutPath(), base.disallowedRedirectPath(),
        new IdmProperties.CookieProperties("idm", true, Duration.ofHours(1), "c2hvcnQ=", null),
        base.cache(), base.oidc(), base.http(), base.redis());

    assertThat(ConfigurationValidator.validate(broken)).hasSize(3);
    assertThatThrownBy(() -> new ConfigurationValidator(broken).afterPropertiesSet())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("3 error(s)");
  }
}
