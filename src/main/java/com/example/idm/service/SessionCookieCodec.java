package com.example.idm.service;

import com.example.idm.exception.EncryptionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Encodes the session cookie payload as encrypted JSON and decodes it back.
 * Values that cannot be decrypted or parsed decode to empty, as if no cookie was sent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionCookieCodec {

  private final EncryptionService encryptionService;
  private final ObjectMapper objectMapper;

  public String encode(Map<String, Object> payload) {
    try {
      return encryptionService.encrypt(objectMapper.writeValueAsString(payload));
    } catch (JsonProcessingException e) {
      throw new EncryptionException("Failed to serialize cookie payload", e);
    }
  }

  /**
   * Decode a raw cookie value. The result keeps whatever JSON shape was found, so callers
   * must check it is an object before reading claims from it.
   */
  public Optional<Object> decode(String cookieValue) {
    if (cookieValue == null || cookieValue.isBlank()) {
      return Optional.empty();
    }
    try {
      String json = encryptionService.decrypt(cookieValue);
      return Optional.ofNullable(objectMapper.readValue(json, Object.class));
    } catch (EncryptionException e) {
      log.debug("Session cookie could not be decrypted: {}", e.getMessage());
      return Optional.empty();
    } catch (JsonProcessingException e) {
      log.debug("Session cookie payload is not JSON: {}", e.getOriginalMessage());
      return Optional.empty();
    }
  }
}
