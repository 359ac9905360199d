package com.example.securevault.core.exception;

/** Root of the unchecked exceptions raised by secure-vault components. */
public class SecureVaultException extends RuntimeException {

  public SecureVaultException(final String message) {
    super(message);
  }

  public SecureVaultException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
