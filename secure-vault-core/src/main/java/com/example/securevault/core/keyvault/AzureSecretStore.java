package com.example.securevault.core.keyvault;

import com.azure.core.exception.ClientAuthenticationException;
import com.azure.core.exception.HttpResponseException;
import com.azure.core.http.HttpResponse;
import com.azure.security.keyvault.secrets.SecretClient;
import com.example.securevault.core.exception.AuthenticationException;
import com.example.securevault.core.exception.SecretConflictException;
import com.example.securevault.core.exception.SecretNotFoundException;
import com.example.securevault.core.exception.SecureVaultException;
import com.example.securevault.core.exception.VaultException;
import java.util.Optional;
import java.util.function.Supplier;

/** {@link SecretStore} over the Azure SDK {@link SecretClient}. */
final class AzureSecretStore implements SecretStore {

  private final SecretClient client;

  AzureSecretStore(final SecretClient client) {
    this.client = client;
  }

  @Override
  public String getSecret(final String key) {
    return call("getSecret", key, () -> client.getSecret(key).getValue());
  }

  @Override
  public void setSecret(final String key, final String value) {
    call("setSecret", key, () -> client.setSecret(key, value));
  }

  @Override
  public void recoverDeletedSecret(final String key) {
    // The poller's activation call issues the recover request; completion is not awaited here.
    call("recoverDeletedSecret", key, () -> client.beginRecoverDeletedSecret(key));
  }

  private static <T> T call(final String operation, final String key, final Supplier<T> op) {
    try {
      return op.get();
    } catch (final ClientAuthenticationException e) {
      throw new AuthenticationException(
          "%s failed for secret %s: %s".formatted(operation, key, e.getMessage()), e);
    } catch (final HttpResponseException e) {
      throw translate(operation, key, e);
    } catch (final SecureVaultException e) {
      throw e;
    } catch (final RuntimeException e) {
      throw new VaultException(
          "%s failed for secret %s: %s".formatted(operation, key, e.getMessage()), key, e);
    }
  }

  static SecureVaultException translate(
      final String operation, final String key, final HttpResponseException e) {
    final int status =
        Optional.ofNullable(e.getResponse()).map(HttpResponse::getStatusCode).orElse(-1);
    return switch (status) {
      case 401, 403 -> new AuthenticationException(
          "%s rejected for secret %s (HTTP %d): %s"
              .formatted(operation, key, status, e.getMessage()),
          e);
      case 404 -> new SecretNotFoundException(key, e);
      case 409 -> new SecretConflictException(key, e);
      default -> new VaultException(
          "%s failed for secret %s (HTTP %d): %s".formatted(operation, key, status, e.getMessage()),
          key,
          status,
          e);
    };
  }
}
