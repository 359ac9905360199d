package com.example.securevault.spring;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.securevault.core.SecureVault;
import com.example.securevault.core.config.MsiConfig;
import com.example.securevault.core.config.VaultCredential;
import com.example.securevault.core.exception.ConfigurationException;
import com.example.securevault.core.exception.SecretNotFoundException;
import com.example.securevault.core.keyvault.KeyVault;
import java.lang.System.Logger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

/**
 * Loads named secrets from a vault into a Spring {@link ConfigurableEnvironment} at startup.
 *
 * <p>Found secrets are added as one {@link MapPropertySource} in front of every existing source, so
 * they override any other value for the same key. Keys the vault does not have are logged and
 * skipped unless {@code throwNotFoundErrors} is set.
 *
 * <p>An instance remembers the last vault it loaded from; {@link
 * KeyVaultRegistrations#addKeyVaultFromConfiguration} uses it to expose that vault as a bean.
 *
 * <pre>{@code
 * var secrets = new KeyVaultSecrets();
 * secrets.addKeyVaultSecrets(environment, "my-vault", List.of("db-password", "api-key"));
 * KeyVaultRegistrations.addKeyVaultFromConfiguration(context, secrets);
 * }</pre>
 */
public class KeyVaultSecrets {

  private static final Logger logger = System.getLogger(KeyVaultSecrets.class.getName());

  /** Property the vault instance name is inferred from. */
  public static final String INSTANCE_NAME_PROPERTY = "KeyVaultInstanceName";

  static final String INSTANCE_NAME_SOURCE = "keyVaultInstanceName";
  static final String SECRETS_SOURCE_PREFIX = "keyVaultSecrets";

  private final Function<VaultCredential, ? extends SecureVault> vaultFactory;
  private final AtomicReference<SecureVault> vault = new AtomicReference<>();

  public KeyVaultSecrets() {
    this(KeyVault::of);
  }

  /**
   * @param vaultFactory builds the vault for a credential; must validate the credential
   */
  public KeyVaultSecrets(final Function<VaultCredential, ? extends SecureVault> vaultFactory) {
    this.vaultFactory = Objects.requireNonNull(vaultFactory, "vaultFactory");
  }

  /**
   * @return the vault used by the most recent successful load, empty if none succeeded
   */
  public Optional<SecureVault> getVault() {
    return Optional.ofNullable(vault.get());
  }

  /**
   * Sets {@value #INSTANCE_NAME_PROPERTY} in the environment, then loads secrets with managed
   * identity credentials for that instance.
   *
   * @param environment environment to add the secrets to
   * @param instanceName vault instance name
   * @param keys secret names to load
   * @return loaded secrets and skipped keys
   * @throws ConfigurationException if the instance name is blank or loading fails
   */
  public HydrationResult addKeyVaultSecrets(
      final ConfigurableEnvironment environment,
      final String instanceName,
      final List<String> keys) {
    requireInstanceName(instanceName);
    final var source = new HashMap<String, Object>();
    source.put(INSTANCE_NAME_PROPERTY, instanceName);
    environment.getPropertySources().addFirst(new MapPropertySource(INSTANCE_NAME_SOURCE, source));
    return addKeyVaultSecrets(environment, keys, false);
  }

  /**
   * Loads secrets with managed identity credentials, skipping missing keys.
   *
   * @see #addKeyVaultSecrets(ConfigurableEnvironment, List, boolean)
   */
  public HydrationResult addKeyVaultSecrets(
      final ConfigurableEnvironment environment, final List<String> keys) {
    return addKeyVaultSecrets(environment, keys, false);
  }

  /**
   * Loads secrets with managed identity credentials for the instance named by the {@value
   * #INSTANCE_NAME_PROPERTY} property.
   *
   * @param environment environment to read the instance name from and add the secrets to
   * @param keys secret names to load
   * @param throwNotFoundErrors fail the whole load when any key is missing
   * @return loaded secrets and skipped keys
   * @throws ConfigurationException if the property is not set, before any vault is contacted, or
   *     if loading fails
   */
  public HydrationResult addKeyVaultSecrets(
      final ConfigurableEnvironment environment,
      final List<String> keys,
      final boolean throwNotFoundErrors) {
    final var instanceName = environment.getProperty(INSTANCE_NAME_PROPERTY);
    requireInstanceName(instanceName);

    return addKeyVaultSecrets(
        environment, new MsiConfig(instanceName), keys, throwNotFoundErrors);
  }

  /**
   * Loads secrets using explicit credentials, skipping missing keys.
   *
   * @see #addKeyVaultSecrets(ConfigurableEnvironment, VaultCredential, List, boolean)
   */
  public HydrationResult addKeyVaultSecrets(
      final ConfigurableEnvironment environment,
      final VaultCredential credential,
      final List<String> keys) {
    return addKeyVaultSecrets(environment, credential, keys, false);
  }

  /**
   * Loads secrets using explicit credentials.
   *
   * @param environment environment to add the secrets to
   * @param credential managed identity or service principal credentials
   * @param keys secret names to load
   * @param throwNotFoundErrors fail the whole load when any key is missing
   * @return loaded secrets and skipped keys
   * @throws ConfigurationException if the credential is invalid or loading fails
   */
  public HydrationResult addKeyVaultSecrets(
      final ConfigurableEnvironment environment,
      final VaultCredential credential,
      final List<String> keys,
      final boolean throwNotFoundErrors) {
    Objects.requireNonNull(credential, "credential");
    final var method = credential instanceof MsiConfig ? "Managed Identity" : "Service Principle";
    return load(
        environment, () -> vaultFactory.apply(credential), method, keys, throwNotFoundErrors);
  }

  /**
   * Loads secrets from an existing vault client.
   *
   * @param environment environment to add the secrets to
   * @param secureVault vault to read from
   * @param keys secret names to load
   * @param throwNotFoundErrors fail the whole load when any key is missing
   * @return loaded secrets and skipped keys
   * @throws ConfigurationException if loading fails
   */
  public HydrationResult addKeyVaultSecrets(
      final ConfigurableEnvironment environment,
      final SecureVault secureVault,
      final List<String> keys,
      final boolean throwNotFoundErrors) {
    Objects.requireNonNull(secureVault, "secureVault");
    return load(
        environment, () -> secureVault, secureVault.getName(), keys, throwNotFoundErrors);
  }

  private HydrationResult load(
      final ConfigurableEnvironment environment,
      final Supplier<? extends SecureVault> vaultSupplier,
      final String method,
      final List<String> keys,
      final boolean throwNotFoundErrors) {
    Objects.requireNonNull(environment, "environment");
    Objects.requireNonNull(keys, "keys");
    try {
      final var source = vaultSupplier.get();
      final var secrets = new LinkedHashMap<String, String>();
      final var skipped = new ArrayList<String>();

      for (final var key : keys) {
        try {
          secrets.put(key, source.getSecret(key));
          logger.log(DEBUG, "Staged secret {0} from {1}", key, source.getName());
        } catch (final SecretNotFoundException e) {
          if (throwNotFoundErrors)
            throw new ConfigurationException(
                "Secret %s not found in vault %s".formatted(key, source.getName()), e);
          logger.log(
              WARNING,
              "Failed to find key vault setting: {0}, exception: {1}",
              key,
              e.getMessage());
          skipped.add(key);
        }
      }

      final var sourceName = addPropertySource(environment, source.getName(), secrets);
      vault.set(source);
      logger.log(
          INFO,
          "Loaded {0} of {1} secrets from {2} into property source {3}",
          secrets.size(),
          keys.size(),
          source.getName(),
          sourceName);
      return new HydrationResult(source, secrets, skipped, sourceName);
    } catch (final ConfigurationException e) {
      throw e;
    } catch (final RuntimeException e) {
      throw new ConfigurationException(
          "Problem occurred retrieving secrets from KeyVault using " + method, e);
    }
  }

  private static void requireInstanceName(final String instanceName) {
    if (instanceName == null || instanceName.isBlank())
      throw new ConfigurationException(
          "Expecting setting \"%s\" to infer instance name".formatted(INSTANCE_NAME_PROPERTY));
  }

  private static String addPropertySource(
      final ConfigurableEnvironment environment,
      final String vaultName,
      final LinkedHashMap<String, String> secrets) {
    final var sources = environment.getPropertySources();
    final var base = "%s[%s]".formatted(SECRETS_SOURCE_PREFIX, vaultName);
    var name = base;
    for (int n = 2; sources.contains(name); n++) name = base + "#" + n;
    sources.addFirst(new MapPropertySource(name, new LinkedHashMap<String, Object>(secrets)));
    return name;
  }
}
