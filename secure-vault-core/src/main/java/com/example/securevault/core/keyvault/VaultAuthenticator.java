package com.example.securevault.core.keyvault;

import com.example.securevault.core.config.VaultCredential;

/** Exchanges credentials for an authenticated session against the credential's vault. */
@FunctionalInterface
public interface VaultAuthenticator {

  /**
   * @param credential validated credentials
   * @return a fresh session
   * @throws com.example.securevault.core.exception.AuthenticationException when no token can be
   *     acquired
   */
  AuthenticatedSession authenticate(VaultCredential credential);
}
