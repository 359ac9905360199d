package com.example.securevault.core.keyvault;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import com.azure.identity.ClientSecretCredentialBuilder;
import com.azure.identity.ManagedIdentityCredentialBuilder;
import com.azure.security.keyvault.secrets.SecretClientBuilder;
import com.example.securevault.core.config.MsiConfig;
import com.example.securevault.core.config.ServicePrincipleConfig;
import com.example.securevault.core.config.VaultCredential;
import com.example.securevault.core.exception.AuthenticationException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;

/**
 * Builds Key Vault sessions with Azure Identity.
 *
 * <ul>
 *   <li>Managed identity: the SDK credential refreshes its own tokens, so the session is simply
 *       rebuilt once a day.
 *   <li>Service principal: a client credentials token is acquired up front from {@code
 *       https://login.windows.net/{tenantId}} and the session expires with that token.
 * </ul>
 */
public final class AzureAuthenticator implements VaultAuthenticator {

  static final String LOGIN_AUTHORITY_HOST = "https://login.windows.net";
  static final String VAULT_SCOPE = "https://vault.azure.net/.default";
  static final Duration MSI_SESSION_LIFETIME = Duration.ofDays(1);

  private final Clock clock;
  private final Supplier<TokenCredential> managedIdentity;
  private final Function<ServicePrincipleConfig, TokenCredential> servicePrincipal;

  public AzureAuthenticator(final Clock clock) {
    this(
        clock,
        () -> new ManagedIdentityCredentialBuilder().build(),
        AzureAuthenticator::clientSecretCredential);
  }

  AzureAuthenticator(
      final Clock clock,
      final Supplier<TokenCredential> managedIdentity,
      final Function<ServicePrincipleConfig, TokenCredential> servicePrincipal) {
    this.clock = clock;
    this.managedIdentity = managedIdentity;
    this.servicePrincipal = servicePrincipal;
  }

  @Override
  public AuthenticatedSession authenticate(final VaultCredential credential) {
    return credential instanceof MsiConfig msi
        ? managedIdentitySession(msi)
        : servicePrincipalSession((ServicePrincipleConfig) credential);
  }

  private AuthenticatedSession managedIdentitySession(final MsiConfig config) {
    return new AuthenticatedSession(
        storeFor(config.uri(), managedIdentity.get()),
        clock.instant().plus(MSI_SESSION_LIFETIME));
  }

  private AuthenticatedSession servicePrincipalSession(final ServicePrincipleConfig config) {
    final var failure =
        "Could not authenticate to %s/%s using supplied AppId: %s"
            .formatted(LOGIN_AUTHORITY_HOST, config.tenantId(), config.appId());

    final Optional<AccessToken> acquired;
    try {
      acquired =
          servicePrincipal
              .apply(config)
              .getToken(new TokenRequestContext().addScopes(VAULT_SCOPE))
              .blockOptional();
    } catch (final RuntimeException e) {
      throw new AuthenticationException(failure, e);
    }

    final var token = acquired.orElseThrow(() -> new AuthenticationException(failure));
    final TokenCredential fixedToken = request -> Mono.just(token);
    return new AuthenticatedSession(
        storeFor(config.uri(), fixedToken), token.getExpiresAt().toInstant());
  }

  private static SecretStore storeFor(final String vaultUri, final TokenCredential credential) {
    return new AzureSecretStore(
        new SecretClientBuilder().vaultUrl(vaultUri).credential(credential).buildClient());
  }

  private static TokenCredential clientSecretCredential(final ServicePrincipleConfig config) {
    return new ClientSecretCredentialBuilder()
        .authorityHost(LOGIN_AUTHORITY_HOST)
        .tenantId(config.tenantId())
        .clientId(config.appId())
        .clientSecret(config.appSecret())
        .build();
  }
}
