package com.example.idm.domain.entity;

import com.example.idm.util.QueryFlags;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Transient state of one authentication attempt, stored under its correlation identifier.
 * Serialized as a single flat object: the four well-known fields plus any extension entries
 * supplied by the caller (for example a password-reset journey's pre-seeded data).
 */
public record RequestState(
    String policyName,
    String journey,
    boolean forceLogin,
    String backToPath,
    Map<String, Object> extensions
) {

  public static final String FIELD_POLICY_NAME = "policyName";
  public static final String FIELD_JOURNEY = "journey";
  public static final String FIELD_FORCE_LOGIN = "forceLogin";
  public static final String FIELD_BACK_TO_PATH = "backToPath";

  public RequestState {
    extensions = extensions == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
  }

  /**
   * Builds a state from computed defaults overridden by caller-supplied data.
   * Every non-null entry of {@code overrides} wins, including the well-known fields.
   */
  public static RequestState withDefaults(String policyName,
                                          String journey,
                                          boolean forceLogin,
                                          String backToPath,
                                          Map<String, Object> overrides) {
    Map<String, Object> merged = new LinkedHashMap<>();
    merged.put(FIELD_POLICY_NAME, policyName);
    merged.put(FIELD_FORCE_LOGIN, forceLogin);
    merged.put(FIELD_BACK_TO_PATH, backToPath);
    merged.put(FIELD_JOURNEY, journey);

    if (overrides != null) {
      overrides.forEach((key, value) -> {
        if (value != null) {
          merged.put(key, value);
        }
      });
    }
    return fromMap(merged);
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static RequestState fromMap(Map<String, Object> values) {
    Map<String, Object> extensions = new LinkedHashMap<>(values);
    Object policyName = extensions.remove(FIELD_POLICY_NAME);
    Object journey = extensions.remove(FIELD_JOURNEY);
    Object forceLogin = extensions.remove(FIELD_FORCE_LOGIN);
    Object backToPath = extensions.remove(FIELD_BACK_TO_PATH);

    return new RequestState(
        asString(policyName),
        asString(journey),
        QueryFlags.decode(forceLogin),
        asString(backToPath),
        extensions);
  }

  @JsonValue
  public Map<String, Object> toMap() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put(FIELD_POLICY_NAME, policyName);
    values.put(FIELD_FORCE_LOGIN, forceLogin);
    values.put(FIELD_BACK_TO_PATH, backToPath);
    values.put(FIELD_JOURNEY, journey);
    values.putAll(extensions);
    return values;
  }

  public Optional<Object> extension(String name) {
    return Optional.ofNullable(extensions.get(name));
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }
}
