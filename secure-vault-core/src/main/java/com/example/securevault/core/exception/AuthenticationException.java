package com.example.securevault.core.exception;

/** Raised when a token cannot be acquired or the vault rejects the caller's identity. */
public class AuthenticationException extends SecureVaultException {

  public AuthenticationException(final String message) {
    super(message);
  }

  public AuthenticationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
