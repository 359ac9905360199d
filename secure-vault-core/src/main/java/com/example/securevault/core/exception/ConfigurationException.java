package com.example.securevault.core.exception;

import java.util.List;

/**
 * Raised when credentials or configuration are missing or invalid, and when secret hydration fails
 * for any reason other than a tolerated missing key.
 */
public class ConfigurationException extends SecureVaultException {

  private final List<String> errors;

  public ConfigurationException(final String message) {
    super(message);
    this.errors = List.of(message);
  }

  public ConfigurationException(final String message, final Throwable cause) {
    super(message, cause);
    this.errors = List.of(message);
  }

  /**
   * Creates an exception describing every validation failure at once.
   *
   * @param message summary message
   * @param errors ordered validation messages, one per failed check
   */
  public ConfigurationException(final String message, final List<String> errors) {
    super(message);
    this.errors = List.copyOf(errors);
  }

  /**
   * @return ordered validation messages; a single entry when raised without an explicit list
   */
  public List<String> getErrors() {
    return errors;
  }
}
