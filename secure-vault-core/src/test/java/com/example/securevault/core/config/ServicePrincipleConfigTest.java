package com.example.securevault.core.config;

import static org.junit.jupiter.api.Assertions.*;

import com.example.securevault.core.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class ServicePrincipleConfigTest {

  private static final List<String> ALL_ERRORS =
      List.of(
          "instance name must be set",
          "app id must be set",
          "app secret must be set",
          "tenant id must be set");

  @Test
  void shouldBeValidWhenAllFieldsAreSet() {
    final var result = new ServicePrincipleConfig("vault", "app", "secret", "tenant").validate();

    assertTrue(result.isValid());
    assertEquals(List.of(), result.errors());
  }

  @Test
  @DisplayName("Should report one error per missing field, in field order, for every combination")
  void shouldReportOneErrorPerMissingField() {
    for (int mask = 0; mask < 16; mask++) {
      final var config =
          new ServicePrincipleConfig(
              (mask & 1) != 0 ? null : "vault",
              (mask & 2) != 0 ? "" : "app",
              (mask & 4) != 0 ? null : "secret",
              (mask & 8) != 0 ? " " : "tenant");

      final var expected = new ArrayList<String>();
      for (int bit = 0; bit < 4; bit++) {
        if ((mask & (1 << bit)) != 0) expected.add(ALL_ERRORS.get(bit));
      }

      final var result = config.validate();
      assertEquals(expected, result.errors(), "mask %d".formatted(mask));
      assertEquals(expected.isEmpty(), result.isValid(), "mask %d".formatted(mask));
    }
  }

  @Test
  void shouldCarryAllErrorsWhenThrowing() {
    final var ex =
        assertThrows(
            ConfigurationException.class,
            () -> new ServicePrincipleConfig(null, null, null, null).throwIfInvalid());

    assertEquals(ALL_ERRORS, ex.getErrors());
  }

  @Test
  void shouldDeriveVaultUri() {
    assertEquals(
        "https://tenant-a-kv.vault.azure.net",
        new ServicePrincipleConfig("tenant-a-kv", "app", "secret", "tenant").uri());
  }

  @Test
  @DisplayName("Should render every field including the secret")
  void shouldRenderEveryField() {
    final var text =
        new ServicePrincipleConfig("vault-x", "app-id-1", "s3cr3t", "tenant-9").toString();

    assertTrue(text.contains("vault-x"));
    assertTrue(text.contains("app-id-1"));
    assertTrue(text.contains("s3cr3t"));
    assertTrue(text.contains("tenant-9"));
    assertTrue(text.contains("https://vault-x.vault.azure.net"));
  }

  @Test
  void shouldRenderPartiallyPopulatedConfig() {
    assertTrue(new ServicePrincipleConfig("test", null, null, null).toString().contains("test"));
  }
}
