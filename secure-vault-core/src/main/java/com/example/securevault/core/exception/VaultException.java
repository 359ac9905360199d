package com.example.securevault.core.exception;

import java.util.OptionalInt;

/** Raised for a non-success response from the vault, or when the vault could not be reached. */
public class VaultException extends SecureVaultException {

  private static final int NO_STATUS = -1;

  private final String key;
  private final int statusCode;

  public VaultException(final String message, final String key, final Throwable cause) {
    this(message, key, NO_STATUS, cause);
  }

  public VaultException(
      final String message, final String key, final int statusCode, final Throwable cause) {
    super(message, cause);
    this.key = key;
    this.statusCode = statusCode;
  }

  /**
   * @return the secret name the failed operation targeted
   */
  public String getKey() {
    return key;
  }

  /**
   * @return the HTTP status reported by the vault, empty when the request never got a response
   */
  public OptionalInt getStatusCode() {
    return statusCode == NO_STATUS ? OptionalInt.empty() : OptionalInt.of(statusCode);
  }
}
