package com.example.securevault.spring;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.securevault.core.NamedInstanceFactory;
import com.example.securevault.core.SecureVault;
import com.example.securevault.core.config.MsiConfig;
import com.example.securevault.core.config.ServicePrincipleConfig;
import com.example.securevault.core.config.VaultCredential;
import com.example.securevault.core.keyvault.KeyVault;
import java.lang.System.Logger;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.support.RootBeanDefinition;
import org.springframework.context.support.GenericApplicationContext;
import org.springframework.core.ResolvableType;

/**
 * Registers vault clients as {@link SecureVault} beans.
 *
 * <p>Every vault is registered under {@code secureVault:<name>}, with a {@code #n} suffix when that
 * bean name is already taken, so vaults sharing a name are all kept. The first registration also
 * adds a {@link NamedInstanceFactory} bean ({@value #FACTORY_BEAN_NAME}) that resolves any
 * registered vault by name:
 *
 * <pre>{@code
 * KeyVaultRegistrations.addKeyVaultSingletonNamed(context, "tenant-a", "tenant-a-kv");
 * KeyVaultRegistrations.addKeyVaultSingletonNamed(context, "tenant-b", tenantBPrincipal);
 * context.refresh();
 *
 * var vault = KeyVaultRegistrations.namedVaults(context).get("tenant-b");
 * }</pre>
 */
public final class KeyVaultRegistrations {

  private static final Logger logger = System.getLogger(KeyVaultRegistrations.class.getName());

  public static final String FACTORY_BEAN_NAME = "secureVaultNamedInstanceFactory";
  static final String VAULT_BEAN_PREFIX = "secureVault:";

  private KeyVaultRegistrations() {}

  /**
   * Registers the vault that {@code secrets} last loaded from.
   *
   * @param context context to register into
   * @param secrets hydration helper that already ran
   * @return the registered vault
   * @throws IllegalStateException if {@code secrets} never loaded successfully
   */
  public static SecureVault addKeyVaultFromConfiguration(
      final GenericApplicationContext context, final KeyVaultSecrets secrets) {
    final var vault =
        secrets
            .getVault()
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "KeyVault instance has not been initialised, ensure you've called"
                            + " addKeyVaultSecrets before registering it"));
    register(context, vault);
    return vault;
  }

  /** Registers a managed identity vault named after its instance. */
  public static KeyVault addKeyVaultSingleton(
      final GenericApplicationContext context, final MsiConfig config) {
    return register(context, new KeyVault(config));
  }

  /** Registers a service principal vault named after its instance. */
  public static KeyVault addKeyVaultSingleton(
      final GenericApplicationContext context, final ServicePrincipleConfig config) {
    return register(context, new KeyVault(config));
  }

  /** Registers a managed identity vault for {@code instanceName}. */
  public static KeyVault addKeyVaultSingleton(
      final GenericApplicationContext context, final String instanceName) {
    return register(context, new KeyVault(new MsiConfig(instanceName)));
  }

  /**
   * Registers a managed identity vault under a custom name.
   *
   * @param context context to register into
   * @param name lookup name; blank keeps the instance name
   * @param instanceName vault instance name
   * @return the registered vault
   */
  public static KeyVault addKeyVaultSingletonNamed(
      final GenericApplicationContext context, final String name, final String instanceName) {
    return addKeyVaultSingletonNamed(context, name, new MsiConfig(instanceName));
  }

  /**
   * Registers a vault under a custom name.
   *
   * @param context context to register into
   * @param name lookup name; blank keeps the instance name
   * @param credential managed identity or service principal credentials
   * @return the registered vault
   */
  public static KeyVault addKeyVaultSingletonNamed(
      final GenericApplicationContext context,
      final String name,
      final VaultCredential credential) {
    return register(context, KeyVault.builder().credential(credential).name(name).build());
  }

  /**
   * Returns the named-instance factory registered by this class.
   *
   * @param beanFactory refreshed context or bean factory
   * @return factory resolving vaults by name
   */
  @SuppressWarnings("unchecked")
  public static NamedInstanceFactory<SecureVault> namedVaults(final BeanFactory beanFactory) {
    return beanFactory.getBean(FACTORY_BEAN_NAME, NamedInstanceFactory.class);
  }

  private static <T extends SecureVault> T register(
      final GenericApplicationContext context, final T vault) {
    final var base = VAULT_BEAN_PREFIX + vault.getName();
    var beanName = base;
    for (int n = 2; context.containsBeanDefinition(beanName); n++) beanName = base + "#" + n;
    context.registerBean(beanName, SecureVault.class, () -> vault);
    logger.log(DEBUG, "Registered {0} as bean {1}", vault, beanName);
    addFactoryIfNotAdded(context);
    return vault;
  }

  private static void addFactoryIfNotAdded(final GenericApplicationContext context) {
    if (context.containsBeanDefinition(FACTORY_BEAN_NAME)) return;
    final var definition =
        new RootBeanDefinition(
            ResolvableType.forClassWithGenerics(NamedInstanceFactory.class, SecureVault.class));
    definition.setInstanceSupplier(
        () ->
            new NamedInstanceFactory<SecureVault>(
                () -> context.getBeansOfType(SecureVault.class).values()));
    context.registerBeanDefinition(FACTORY_BEAN_NAME, definition);
  }
}
