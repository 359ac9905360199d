package com.example.securevault.core.config;

import java.util.ArrayList;

/**
 * Managed identity credentials. Tokens come from the identity endpoint of the hosting platform, so
 * only the vault instance name is needed.
 *
 * @param keyVaultInstanceName vault instance name
 */
public record MsiConfig(String keyVaultInstanceName) implements VaultCredential {

  @Override
  public ValidationResult validate() {
    final var errors = new ArrayList<String>();
    if (VaultCredential.isMissing(keyVaultInstanceName)) errors.add("instance name must be set");
    return ValidationResult.of(errors);
  }

  @Override
  public String toString() {
    return "KeyVaultInstanceName: %s, Uri: %s".formatted(keyVaultInstanceName, uri());
  }
}
