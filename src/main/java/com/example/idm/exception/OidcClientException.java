package com.example.idm.exception;

/**
 * OpenID Connect protocol client failure.
 * Carries the provider's OAuth error code when one was returned. A rejected request
 * (a 4xx answer such as {@code invalid_grant}) is the caller's problem, not the provider's.
 */
public class OidcClientException extends RuntimeException {

  private final String errorCode;
  private final boolean rejected;

  public OidcClientException(String message) {
    this(message, null, null);
  }

  public OidcClientException(String message, Throwable cause) {
    this(message, null, cause);
  }

  public OidcClientException(String message, String errorCode, Throwable cause) {
    this(message, errorCode, false, cause);
  }

  private OidcClientException(String message, String errorCode, boolean rejected, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
    this.rejected = rejected;
  }

  /**
   * The provider answered and refused the request.
   */
  public static OidcClientException rejected(String message, String errorCode) {
    return new OidcClientException(message, errorCode, true, null);
  }

  public String getErrorCode() {
    return errorCode;
  }

  public boolean isRejected() {
    return rejected;
  }
}
