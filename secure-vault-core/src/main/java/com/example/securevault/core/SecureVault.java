package com.example.securevault.core;

/**
 * Read and write access to named secrets held by a remote secret store.
 *
 * <p>Calls block the calling thread for the duration of the network round trip. Implementations are
 * safe for concurrent use.
 */
public interface SecureVault extends NamedInstance {

  /**
   * Reads the current value of a secret.
   *
   * @param key secret name
   * @return the plaintext secret value
   * @throws com.example.securevault.core.exception.SecretNotFoundException if no such secret exists
   * @throws com.example.securevault.core.exception.AuthenticationException if the caller cannot
   *     authenticate
   * @throws com.example.securevault.core.exception.VaultException for any other failure
   */
  String getSecret(String key);

  /**
   * Creates or updates a secret.
   *
   * @param key secret name
   * @param value plaintext value to store
   * @throws com.example.securevault.core.exception.AuthenticationException if the caller cannot
   *     authenticate
   * @throws com.example.securevault.core.exception.VaultException if the write fails
   */
  void setSecret(String key, String value);
}
