package com.example.securevault.core.config;

import java.util.ArrayList;

/**
 * Service principal credentials, exchanged for a vault token through the OAuth2 client credentials
 * flow against the tenant's authority.
 *
 * <p>{@link #toString()} includes the application secret. Do not log instances.
 *
 * @param keyVaultInstanceName vault instance name
 * @param appId application (client) id
 * @param appSecret application (client) secret
 * @param tenantId directory (tenant) id
 */
public record ServicePrincipleConfig(
    String keyVaultInstanceName, String appId, String appSecret, String tenantId)
    implements VaultCredential {

  @Override
  public ValidationResult validate() {
    final var errors = new ArrayList<String>();
    if (VaultCredential.isMissing(keyVaultInstanceName)) errors.add("instance name must be set");
    if (VaultCredential.isMissing(appId)) errors.add("app id must be set");
    if (VaultCredential.isMissing(appSecret)) errors.add("app secret must be set");
    if (VaultCredential.isMissing(tenantId)) errors.add("tenant id must be set");
    return ValidationResult.of(errors);
  }

  @Override
  public String toString() {
    return "AppId: %s, AppSecret: %s, TenantId: %s, KeyVaultInstanceName: %s, Uri: %s"
        .formatted(appId, appSecret, tenantId, keyVaultInstanceName, uri());
  }
}
