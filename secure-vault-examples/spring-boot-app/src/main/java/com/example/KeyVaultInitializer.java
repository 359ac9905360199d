package com.example;

import com.example.securevault.spring.KeyVaultRegistrations;
import com.example.securevault.spring.KeyVaultSecrets;
import java.util.List;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.support.GenericApplicationContext;

/** Loads vault secrets into the environment and registers the vault, before bean creation. */
public class KeyVaultInitializer
    implements ApplicationContextInitializer<GenericApplicationContext> {

  static final String KEYS_PROPERTY = "secure-vault.keys";
  static final String STRICT_PROPERTY = "secure-vault.fail-on-missing";

  private final KeyVaultSecrets secrets;

  public KeyVaultInitializer() {
    this(new KeyVaultSecrets());
  }

  KeyVaultInitializer(final KeyVaultSecrets secrets) {
    this.secrets = secrets;
  }

  @Override
  public void initialize(final GenericApplicationContext context) {
    final var environment = context.getEnvironment();
    final var keys = environment.getProperty(KEYS_PROPERTY, String[].class, new String[0]);
    final var strict = environment.getProperty(STRICT_PROPERTY, Boolean.class, false);

    secrets.addKeyVaultSecrets(environment, List.of(keys), strict);
    KeyVaultRegistrations.addKeyVaultFromConfiguration(context, secrets);
  }
}
