package com.example.securevault.core.config;

import com.example.securevault.core.exception.ConfigurationException;

/**
 * Credentials for one Key Vault instance. Either an ambient managed identity ({@link MsiConfig}) or
 * an explicit service principal ({@link ServicePrincipleConfig}).
 */
public sealed interface VaultCredential permits MsiConfig, ServicePrincipleConfig {

  /** Suffix shared by every public-cloud vault endpoint. */
  String VAULT_HOST_SUFFIX = ".vault.azure.net";

  /**
   * @return the vault instance name, the first label of the vault host name
   */
  String keyVaultInstanceName();

  /**
   * Checks every required field.
   *
   * @return validation outcome listing each missing field
   */
  ValidationResult validate();

  /**
   * @return the vault endpoint, {@code https://{instanceName}.vault.azure.net}
   */
  default String uri() {
    return "https://" + keyVaultInstanceName() + VAULT_HOST_SUFFIX;
  }

  /**
   * Validates and throws when anything is missing.
   *
   * @throws ConfigurationException carrying every validation message
   */
  default void throwIfInvalid() {
    final var result = validate();
    if (!result.isValid())
      throw new ConfigurationException(
          "Invalid %s: %s"
              .formatted(getClass().getSimpleName(), String.join(", ", result.errors())),
          result.errors());
  }

  static boolean isMissing(final String value) {
    return value == null || value.isBlank();
  }
}
