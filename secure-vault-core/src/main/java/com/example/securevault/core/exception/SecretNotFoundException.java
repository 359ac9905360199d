package com.example.securevault.core.exception;

/** The vault answered 404 for the requested secret. */
public class SecretNotFoundException extends VaultException {

  public SecretNotFoundException(final String key, final Throwable cause) {
    super("Secret not found: " + key, key, 404, cause);
  }
}
