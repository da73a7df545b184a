package com.example.idm.service;

import com.example.idm.exception.EncryptionException;
import com.example.idm.properties.IdmProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM encryption of session cookie payloads.
 * Output is base64url without padding so it can travel as a cookie value.
 */
@Slf4j
@Service
public class EncryptionService {

  private static final int GCM_TAG_LENGTH = 128;
  private static final int GCM_IV_LENGTH = 12;
  private static final int KEY_LENGTH_BYTES = 32;
  private static final String ENCRYPTION_ALGORITHM = "AES/GCM/NoPadding";
  private static final SecureRandom secureRandom = new SecureRandom();

  private final SecretKey key;

  public EncryptionService(IdmProperties properties) {
    this.key = loadKey(properties.cookie().password());
  }

  public String encrypt(String plaintext) {
    try {
      byte[] iv = new byte[GCM_IV_LENGTH];
      secureRandom.nextBytes(iv);

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

      byte[] combined = new byte[iv.length + encrypted.length];
      System.arraycopy(iv, 0, combined, 0, iv.length);
      System.arraycopy(encrypted, 0, combined, iv.length, encrypted.length);

      return Base64.getUrlEncoder().withoutPadding().encodeToString(combined);

    } catch (Exception e) {
      throw new EncryptionException("Failed to encrypt data", e);
    }
  }

  /**
   * @throws EncryptionException if the value is not valid ciphertext for the current key
   */
  public String decrypt(String encryptedData) {
    try {
      byte[] combined = Base64.getUrlDecoder().decode(encryptedData);
      if (combined.length <= GCM_IV_LENGTH) {
        throw new EncryptionException("Ciphertext too short");
      }

      byte[] iv = new byte[GCM_IV_LENGTH];
      byte[] encrypted = new byte[combined.length - GCM_IV_LENGTH];
      System.arraycopy(combined, 0, iv, 0, GCM_IV_LENGTH);
      System.arraycopy(combined, GCM_IV_LENGTH, encrypted, 0, encrypted.length);

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));

      return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);

    } catch (EncryptionException e) {
      throw e;
    } catch (Exception e) {
      throw new EncryptionException("Failed to decrypt data", e);
    }
  }

  private static SecretKey loadKey(String keyBase64) {
    byte[] keyBytes;
    try {
      keyBytes = Base64.getDecoder().decode(keyBase64);
    } catch (IllegalArgumentException e) {
      throw new EncryptionException("Cookie key is not valid base64", e);
    }
    if (keyBytes.length != KEY_LENGTH_BYTES) {
      throw new EncryptionException("Invalid key length: expected 256 bits");
    }
    log.info("Cookie encryption key loaded");
    return new SecretKeySpec(keyBytes, "AES");
  }
}
