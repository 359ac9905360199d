package com.example.securevault.core.keyvault;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.securevault.core.SecureVault;
import com.example.securevault.core.config.MsiConfig;
import com.example.securevault.core.config.ServicePrincipleConfig;
import com.example.securevault.core.config.VaultCredential;
import com.example.securevault.core.exception.SecretConflictException;
import com.example.securevault.core.exception.SecretNotFoundException;
import com.example.securevault.core.exception.SecureVaultException;
import com.example.securevault.core.exception.VaultException;
import java.lang.System.Logger;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Azure Key Vault backed {@link SecureVault}.
 *
 * <p>Authentication is lazy: nothing touches the network until the first {@link #getSecret} or
 * {@link #setSecret}. The authenticated session is then reused until it expires and rebuilt on the
 * next call after that. There is no background refresh.
 *
 * <h2>Managed identity</h2>
 *
 * <pre>{@code
 * var vault = new KeyVault(new MsiConfig("my-vault"));
 * var password = vault.getSecret("db-password");
 * }</pre>
 *
 * <h2>Service principal, registered under a custom name</h2>
 *
 * <pre>{@code
 * var vault = KeyVault.builder()
 *     .credential(new ServicePrincipleConfig("tenant-a-vault", appId, appSecret, tenantId))
 *     .name("tenant-a")
 *     .build();
 * }</pre>
 *
 * <h2>Soft-deleted secrets</h2>
 *
 * <p>Writing a secret whose name is soft-deleted makes the vault answer 409. {@link #setSecret}
 * then recovers the deleted secret, waits {@value #RECOVERY_WAIT_SECONDS} seconds for the recovery
 * to land and retries the write once. Recoveries of the same key run one at a time; a writer that
 * queued behind another first retries the plain write. Any failure after the conflict surfaces as a
 * {@link VaultException} carrying the conflict as a suppressed exception.
 */
public final class KeyVault implements SecureVault {

  private static final Logger logger = System.getLogger(KeyVault.class.getName());

  static final long RECOVERY_WAIT_SECONDS = 15L;
  static final Duration RECOVERY_WAIT = Duration.ofSeconds(RECOVERY_WAIT_SECONDS);

  /** Lifecycle of the cached session. */
  public enum AuthenticationState {
    UNAUTHENTICATED,
    AUTHENTICATED,
    EXPIRED
  }

  private final VaultCredential credential;
  private final String instanceUri;
  private final String name;
  private final VaultAuthenticator authenticator;
  private final Clock clock;
  private final Sleeper sleeper;

  private final ReentrantLock authLock = new ReentrantLock();
  private final ConcurrentHashMap<String, RecoveryLock> recoveryLocks = new ConcurrentHashMap<>();
  private volatile AuthenticatedSession session;

  /**
   * Creates a vault client using the managed identity of the host.
   *
   * @param config managed identity settings
   * @throws com.example.securevault.core.exception.ConfigurationException if the instance name is
   *     missing
   */
  public KeyVault(final MsiConfig config) {
    this(builder().credential(config));
  }

  /**
   * Creates a vault client authenticating as a service principal.
   *
   * @param config service principal settings
   * @throws com.example.securevault.core.exception.ConfigurationException if any field is missing
   */
  public KeyVault(final ServicePrincipleConfig config) {
    this(builder().credential(config));
  }

  private KeyVault(final Builder builder) {
    Objects.requireNonNull(builder.credential, "credential is required");
    builder.credential.throwIfInvalid();

    this.credential = builder.credential;
    this.instanceUri = builder.credential.uri();
    this.name =
        builder.name == null || builder.name.isBlank()
            ? builder.credential.keyVaultInstanceName()
            : builder.name;
    this.clock = builder.clock;
    this.sleeper = builder.sleeper;
    this.authenticator =
        builder.authenticator != null ? builder.authenticator : new AzureAuthenticator(clock);
  }

  /**
   * Creates a vault client from either credential variant.
   *
   * @param credential validated on construction
   * @return new vault client
   */
  public static KeyVault of(final VaultCredential credential) {
    return builder().credential(credential).build();
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Fluent configuration for {@link KeyVault}. */
  public static class Builder {
    private VaultCredential credential;
    private String name;
    private VaultAuthenticator authenticator;
    private Clock clock = Clock.systemUTC();
    private Sleeper sleeper = Sleeper.THREAD;

    private Builder() {}

    /**
     * Sets the credentials (required).
     *
     * @param credential managed identity or service principal settings
     * @return this builder
     */
    public Builder credential(final VaultCredential credential) {
      this.credential = credential;
      return this;
    }

    /**
     * Overrides the lookup name. Defaults to the vault instance name; blank keeps the default.
     *
     * @param name lookup name used by {@link com.example.securevault.core.NamedInstanceFactory}
     * @return this builder
     */
    public Builder name(final String name) {
      this.name = name;
      return this;
    }

    Builder authenticator(final VaultAuthenticator authenticator) {
      this.authenticator = authenticator;
      return this;
    }

    Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    Builder sleeper(final Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Builds the vault client. No network call is made.
     *
     * @return configured vault client
     * @throws IllegalStateException if no credential was set
     * @throws com.example.securevault.core.exception.ConfigurationException if the credential is
     *     invalid
     */
    public KeyVault build() {
      if (credential == null) throw new IllegalStateException("credential is required");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      if (sleeper == null) throw new IllegalStateException("sleeper cannot be null");
      return new KeyVault(this);
    }
  }

  @Override
  public String getName() {
    return name;
  }

  /**
   * @return the vault endpoint this client talks to
   */
  public String getInstanceUri() {
    return instanceUri;
  }

  /**
   * @return the credentials this client was built with
   */
  public VaultCredential getCredential() {
    return credential;
  }

  /**
   * @return the state of the cached session as of now
   */
  public AuthenticationState getAuthenticationState() {
    final var current = session;
    if (current == null) return AuthenticationState.UNAUTHENTICATED;
    return current.isExpired(clock.instant())
        ? AuthenticationState.EXPIRED
        : AuthenticationState.AUTHENTICATED;
  }

  @Override
  public String getSecret(final String key) {
    Objects.requireNonNull(key, "key");
    return store().getSecret(key);
  }

  @Override
  public void setSecret(final String key, final String value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    try {
      store().setSecret(key, value);
    } catch (final SecretConflictException conflict) {
      recoverAndRetry(key, value, conflict);
    }
  }

  private void recoverAndRetry(
      final String key, final String value, final SecretConflictException conflict) {
    final var recovery = acquireRecoveryLock(key);
    final var waited = !recovery.lock.tryLock();
    if (waited) recovery.lock.lock();
    try {
      // another writer may have finished recovering this key while we waited
      if (waited && writeUnlessConflicting(key, value, conflict)) return;

      logger.log(
          INFO,
          "Secret {0} conflicts on {1}, recovering soft-deleted secret and retrying in {2}s",
          key,
          name,
          RECOVERY_WAIT_SECONDS);
      if (recover(key, conflict)) pause(key, conflict);
      try {
        store().setSecret(key, value);
      } catch (final SecureVaultException retryFailure) {
        logger.log(WARNING, "Retry of setSecret for {0} failed after recovery", key);
        throw failure(
            "setSecret failed for secret %s after recovering soft-deleted secret: %s"
                .formatted(key, retryFailure.getMessage()),
            key,
            retryFailure,
            conflict);
      }
    } finally {
      recovery.lock.unlock();
      releaseRecoveryLock(key);
    }
  }

  /** Returns false when the write still conflicts. */
  private boolean writeUnlessConflicting(
      final String key, final String value, final SecretConflictException conflict) {
    try {
      store().setSecret(key, value);
      logger.log(DEBUG, "Secret {0} was recovered by another writer", key);
      return true;
    } catch (final SecretConflictException stillConflicting) {
      return false;
    } catch (final SecureVaultException writeFailure) {
      throw failure(
          "setSecret failed for secret %s: %s".formatted(key, writeFailure.getMessage()),
          key,
          writeFailure,
          conflict);
    }
  }

  /** Returns false when the secret is not soft-deleted, leaving nothing to wait for. */
  private boolean recover(final String key, final SecretConflictException conflict) {
    try {
      store().recoverDeletedSecret(key);
      return true;
    } catch (final SecretNotFoundException notDeleted) {
      logger.log(DEBUG, "Secret {0} is not soft-deleted, retrying without waiting", key);
      return false;
    } catch (final SecureVaultException recoveryFailure) {
      throw failure(
          "Recovery of soft-deleted secret %s failed: %s"
              .formatted(key, recoveryFailure.getMessage()),
          key,
          recoveryFailure,
          conflict);
    }
  }

  private static VaultException failure(
      final String message,
      final String key,
      final SecureVaultException cause,
      final SecretConflictException conflict) {
    final var failure =
        cause instanceof VaultException vaultFailure
            ? new VaultException(message, key, vaultFailure.getStatusCode().orElse(409), cause)
            : new VaultException(message, key, cause);
    failure.addSuppressed(conflict);
    return failure;
  }

  private void pause(final String key, final SecretConflictException conflict) {
    try {
      sleeper.sleep(RECOVERY_WAIT);
    } catch (final InterruptedException ie) {
      Thread.currentThread().interrupt();
      final var failure =
          new VaultException(
              "Interrupted while waiting for recovery of secret " + key, key, 409, ie);
      failure.addSuppressed(conflict);
      throw failure;
    }
  }

  private RecoveryLock acquireRecoveryLock(final String key) {
    return recoveryLocks.compute(
        key,
        (k, existing) -> {
          final var recovery = existing != null ? existing : new RecoveryLock();
          recovery.holders++;
          return recovery;
        });
  }

  private void releaseRecoveryLock(final String key) {
    recoveryLocks.computeIfPresent(key, (k, recovery) -> --recovery.holders == 0 ? null : recovery);
  }

  int recoveryLockCount() {
    return recoveryLocks.size();
  }

  /** Per-key lock, dropped once no writer holds or waits for it. */
  private static final class RecoveryLock {
    private final ReentrantLock lock = new ReentrantLock();
    // only touched inside ConcurrentHashMap.compute for the key
    private int holders;
  }

  /** Returns the current store, authenticating first when there is no session or it expired. */
  private SecretStore store() {
    final var current = session;
    if (current != null && !current.isExpired(clock.instant())) return current.store();

    authLock.lock();
    try {
      final var latest = session;
      if (latest != null && !latest.isExpired(clock.instant())) return latest.store();

      logger.log(
          DEBUG,
          latest == null
              ? "Authenticating to {0} ({1})"
              : "Session for {0} ({1}) expired, re-authenticating",
          instanceUri,
          credential.getClass().getSimpleName());
      final var renewed = authenticator.authenticate(credential);
      session = renewed;
      logger.log(DEBUG, "Session for {0} valid until {1}", instanceUri, renewed.expiresAt());
      return renewed.store();
    } finally {
      authLock.unlock();
    }
  }

  @Override
  public String toString() {
    return "KeyVault[name=%s, uri=%s]".formatted(name, instanceUri);
  }
}
