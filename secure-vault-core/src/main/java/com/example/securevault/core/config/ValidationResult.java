package com.example.securevault.core.config;

import java.util.List;

/**
 * Outcome of validating a credential.
 *
 * @param isValid true when no errors were found
 * @param errors one message per failed check, in check order
 */
public record ValidationResult(boolean isValid, List<String> errors) {

  public ValidationResult {
    errors = List.copyOf(errors);
  }

  static ValidationResult of(final List<String> errors) {
    return new ValidationResult(errors.isEmpty(), errors);
  }
}
