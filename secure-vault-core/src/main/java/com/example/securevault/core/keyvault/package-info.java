/**
 * Azure Key Vault client.
 *
 * <p>{@link com.example.securevault.core.keyvault.KeyVault} owns a lazily built {@link
 * com.example.securevault.core.keyvault.AuthenticatedSession} produced by a {@link
 * com.example.securevault.core.keyvault.VaultAuthenticator}; {@link
 * com.example.securevault.core.keyvault.AzureAuthenticator} is the Azure Identity implementation.
 */
package com.example.securevault.core.keyvault;
