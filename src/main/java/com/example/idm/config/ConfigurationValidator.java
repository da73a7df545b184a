package com.example.idm.config;

import com.example.idm.properties.IdmProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Configuration validator that enforces business rules beyond basic JSR-303 validation.
 * Collects every violation and fails startup once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URL = "%s is invalid: %s";
  private static final String ERROR_HTTPS_REQUIRED = "%s must use HTTPS in non-local environments: %s";
  private static final String ERROR_INVALID_PATH = "%s must be an absolute path without traversal: %s";
  private static final String HOST_LOCALHOST = "localhost";
  private static final String HOST_LOOPBACK = "127.0.0.1";
  private static final String PATH_PREFIX_SLASH = "/";
  private static final String PATH_TRAVERSAL_SEQUENCE = "..";
  private static final int COOKIE_KEY_BYTES = 32;

  private final IdmProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating identity gateway configuration...");
    List<String> errors = validate(properties);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  static List<String> validate(IdmProperties properties) {
    List<String> errors = new ArrayList<>();

    validateUrl("App domain", properties.appDomain(), errors);
    validateUrl("Identity app URL", properties.identityAppUrl(), errors);
    validateUrl("Discovery URI", properties.oidc().discoveryUri(), errors);

    validatePath("Outbound path", properties.outboundPath(), errors);
    validatePath("Return URI", properties.returnUri(), errors);
    validatePath("Logout path", properties.logoutPath(), errors);
    validatePath("Disallowed redirect path", properties.disallowedRedirectPath(), errors);
    validatePath("Default back-to path", properties.defaultBackToPath(), errors);

    validateCookieKey(properties.cookie().password(), errors);

    if (!properties.oidc().discoveryUri().contains("{policyName}")) {
      log.warn("Discovery URI has no policyName placeholder; every policy shares one provider");
    }
    return errors;
  }

  private static void validateUrl(String name, String value, List<String> errors) {
    URI uri;
    try {
      uri = new URI(value.replace("{policyName}", "policy"));
    } catch (URISyntaxException e) {
      errors.add(ERROR_INVALID_URL.formatted(name, value));
      return;
    }
    if (uri.getScheme() == null || uri.getHost() == null) {
      errors.add(ERROR_INVALID_URL.formatted(name, value));
      return;
    }
    boolean local = HOST_LOCALHOST.equals(uri.getHost()) || HOST_LOOPBACK.equals(uri.getHost());
    if (!local && !"https".equalsIgnoreCase(uri.getScheme())) {
      errors.add(ERROR_HTTPS_REQUIRED.formatted(name, value));
    }
  }

  private static void validatePath(String name, String value, List<String> errors) {
    if (!value.startsWith(PATH_PREFIX_SLASH) || value.contains(PATH_TRAVERSAL_SEQUENCE)) {
      errors.add(ERROR_INVALID_PATH.formatted(name, value));
    }
  }

  private static void validateCookieKey(String password, List<String> errors) {
    try {
      if (Base64.getDecoder().decode(password).length != COOKIE_KEY_BYTES) {
        errors.add("Cookie password must be a base64 encoded 256-bit key");
      }
    } catch (IllegalArgumentException e) {
      errors.add("Cookie password is not valid base64");
    }
  }
}
