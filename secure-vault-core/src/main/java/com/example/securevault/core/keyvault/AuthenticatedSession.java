package com.example.securevault.core.keyvault;

import java.time.Instant;
import java.util.Objects;

/**
 * A secret store bound to one acquired token.
 *
 * @param store operations using the token
 * @param expiresAt instant at which the session must be rebuilt
 */
public record AuthenticatedSession(SecretStore store, Instant expiresAt) {

  public AuthenticatedSession {
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  /** Expired once {@code expiresAt} is at or before {@code now}. */
  boolean isExpired(final Instant now) {
    return !expiresAt.isAfter(now);
  }
}
