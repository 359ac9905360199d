package com.example.securevault.core.exception;

/**
 * The vault answered 409 when writing a secret. Key Vault does this when a secret with the same
 * name sits in the soft-deleted state.
 */
public class SecretConflictException extends VaultException {

  public SecretConflictException(final String key, final Throwable cause) {
    super("Conflict writing secret: " + key, key, 409, cause);
  }
}
