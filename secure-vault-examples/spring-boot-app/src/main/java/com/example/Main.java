package com.example;

import static java.lang.System.Logger.Level.INFO;

import com.example.securevault.core.SecureVault;
import com.example.securevault.spring.KeyVaultRegistrations;
import java.lang.System.Logger;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

/**
 * Spring Boot example: secrets listed in {@code secure-vault.keys} are loaded from the vault named
 * by {@code KeyVaultInstanceName} before any bean is created, and the vault itself is available as
 * a {@link SecureVault} bean.
 */
@SpringBootApplication
public class Main {

  private static final Logger logger = System.getLogger(Main.class.getName());

  public static void main(String[] args) {
    final var app = new SpringApplication(Main.class);
    app.addInitializers(new KeyVaultInitializer());
    app.run(args);
  }

  @Bean
  public CommandLineRunner reportSecrets(
      final Environment environment, final ApplicationContext context) {
    return args -> {
      final var keys =
          environment.getProperty(KeyVaultInitializer.KEYS_PROPERTY, String[].class, new String[0]);
      for (final var key : keys) {
        logger.log(INFO, "{0} resolved: {1}", key, environment.containsProperty(key));
      }
      final var vaults = KeyVaultRegistrations.namedVaults(context);
      logger.log(INFO, "Registered vaults: {0}", vaults.names());
    };
  }
}
