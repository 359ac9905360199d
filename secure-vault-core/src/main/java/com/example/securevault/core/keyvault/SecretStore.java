package com.example.securevault.core.keyvault;

/**
 * Authenticated secret operations against a single vault endpoint.
 *
 * <p>Implementations translate transport and HTTP failures into the {@code
 * com.example.securevault.core.exception} hierarchy. A 409 on {@link #setSecret} must surface as
 * {@link com.example.securevault.core.exception.SecretConflictException}.
 */
public interface SecretStore {

  String getSecret(String key);

  void setSecret(String key, String value);

  /** Starts recovery of a soft-deleted secret. Does not wait for recovery to finish. */
  void recoverDeletedSecret(String key);
}
