/**
 * Root package for the secure-vault library.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.securevault.core.SecureVault} – get/set access to named secrets.
 *   <li>{@link com.example.securevault.core.NamedInstanceFactory} – looks up one of several
 *       registered vaults by name.
 *   <li>{@link com.example.securevault.core.config} – managed identity and service principal
 *       credentials, each able to validate itself.
 *   <li>{@link com.example.securevault.core.keyvault.KeyVault} – Azure Key Vault client with lazy,
 *       expiring authentication and soft-delete recovery on write.
 *   <li>{@link com.example.securevault.core.exception} – unchecked error taxonomy.
 * </ul>
 */
package com.example.securevault.core;
