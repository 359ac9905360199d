package com.example.securevault.spring;

import static org.junit.jupiter.api.Assertions.*;

import com.example.securevault.core.NamedInstanceFactory;
import com.example.securevault.core.SecureVault;
import com.example.securevault.core.config.MsiConfig;
import com.example.securevault.core.config.ServicePrincipleConfig;
import com.example.securevault.core.keyvault.KeyVault;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.support.GenericApplicationContext;
import org.springframework.core.ResolvableType;
import org.springframework.core.env.AbstractEnvironment;

public class KeyVaultRegistrationsTest {

  private GenericApplicationContext context;

  @BeforeEach
  void setUp() {
    context = new GenericApplicationContext();
  }

  @AfterEach
  void tearDown() {
    context.close();
  }

  @Test
  @DisplayName("Should fail when no vault was loaded")
  void shouldFailWithoutHydration() {
    final var ex =
        assertThrows(
            IllegalStateException.class,
            () ->
                KeyVaultRegistrations.addKeyVaultFromConfiguration(context, new KeyVaultSecrets()));

    assertTrue(ex.getMessage().contains("not been initialised"));
  }

  @Test
  @DisplayName("Should register the vault used for hydration")
  void shouldRegisterHydratedVault() {
    final var vault = new FakeVault("hydrated").with("a", "alpha");
    final var secrets = new KeyVaultSecrets(credential -> vault);
    secrets.addKeyVaultSecrets(new AbstractEnvironment() {}, new MsiConfig("kv"), List.of("a"));

    KeyVaultRegistrations.addKeyVaultFromConfiguration(context, secrets);
    context.refresh();

    assertSame(vault, context.getBean(SecureVault.class));
  }

  @Test
  @DisplayName("Should resolve each named vault by its own name")
  void shouldResolveNamedVaults() {
    final var a = KeyVaultRegistrations.addKeyVaultSingletonNamed(context, "tenant-a", "kv-a");
    final var b =
        KeyVaultRegistrations.addKeyVaultSingletonNamed(
            context, "tenant-b", new ServicePrincipleConfig("kv-b", "app", "secret", "tenant"));
    context.refresh();

    final NamedInstanceFactory<SecureVault> factory = KeyVaultRegistrations.namedVaults(context);

    assertSame(a, factory.get("tenant-a"));
    assertSame(b, factory.get("tenant-b"));
    assertEquals(
        "https://kv-b.vault.azure.net", ((KeyVault) factory.get("tenant-b")).getInstanceUri());
    assertTrue(factory.find("kv-a").isEmpty());
    assertEquals(Set.of("tenant-a", "tenant-b"), factory.names());
  }

  @Test
  @DisplayName("Should register the named-instance factory only once")
  void shouldRegisterFactoryOnce() {
    KeyVaultRegistrations.addKeyVaultSingleton(context, new MsiConfig("kv-1"));
    KeyVaultRegistrations.addKeyVaultSingleton(
        context, new ServicePrincipleConfig("kv-2", "app", "secret", "tenant"));
    KeyVaultRegistrations.addKeyVaultSingleton(context, "kv-3");
    KeyVaultRegistrations.addKeyVaultSingletonNamed(context, "named", "kv-4");
    context.refresh();

    assertEquals(1, context.getBeanNamesForType(NamedInstanceFactory.class).length);
    assertEquals(4, context.getBeansOfType(SecureVault.class).size());
    assertEquals(
        Set.of("kv-1", "kv-2", "kv-3", "named"),
        KeyVaultRegistrations.namedVaults(context).names());
  }

  @Test
  void shouldNameSingletonsAfterTheirInstance() {
    final var vault = KeyVaultRegistrations.addKeyVaultSingleton(context, "orders-kv");
    context.refresh();

    assertEquals("orders-kv", vault.getName());
    assertSame(vault, context.getBean("secureVault:orders-kv"));
    assertEquals(KeyVault.AuthenticationState.UNAUTHENTICATED, vault.getAuthenticationState());
  }

  @Test
  @DisplayName("Should keep every vault registered when two share a name")
  void shouldKeepVaultsSharingAName() {
    final var msi = KeyVaultRegistrations.addKeyVaultSingleton(context, new MsiConfig("kv"));
    final var principal =
        KeyVaultRegistrations.addKeyVaultSingleton(
            context, new ServicePrincipleConfig("kv", "app", "secret", "tenant"));
    context.refresh();

    final var beans = context.getBeansOfType(SecureVault.class);
    assertEquals(2, beans.size());
    assertTrue(beans.containsValue(msi));
    assertTrue(beans.containsValue(principal));
    assertSame(msi, context.getBean("secureVault:kv"));
    assertSame(principal, context.getBean("secureVault:kv#2"));
    assertSame(msi, KeyVaultRegistrations.namedVaults(context).get("kv"));
  }

  @Test
  @DisplayName("Should register a shared name without overriding when overriding is disabled")
  void shouldNotRelyOnBeanOverriding() {
    context.setAllowBeanDefinitionOverriding(false);
    final var vault = new FakeVault("kv").with("a", "alpha");
    final var secrets = new KeyVaultSecrets(credential -> vault);
    secrets.addKeyVaultSecrets(new AbstractEnvironment() {}, new MsiConfig("kv"), List.of("a"));

    KeyVaultRegistrations.addKeyVaultFromConfiguration(context, secrets);
    final var singleton = KeyVaultRegistrations.addKeyVaultSingleton(context, "kv");
    context.refresh();

    assertEquals(2, context.getBeansOfType(SecureVault.class).size());
    assertSame(vault, KeyVaultRegistrations.namedVaults(context).get("kv"));
    assertNotSame(vault, singleton);
  }

  @Test
  void shouldExposeTypedFactory() {
    KeyVaultRegistrations.addKeyVaultSingleton(context, "kv");
    context.refresh();

    final var type =
        ResolvableType.forClassWithGenerics(NamedInstanceFactory.class, SecureVault.class);
    assertArrayEquals(
        new String[] {KeyVaultRegistrations.FACTORY_BEAN_NAME},
        context.getBeanNamesForType(type));
  }

  @Test
  void shouldKeepInstanceNameWhenNamedWithBlank() {
    final var vault = KeyVaultRegistrations.addKeyVaultSingletonNamed(context, "", "orders-kv");

    assertEquals("orders-kv", vault.getName());
  }
}
