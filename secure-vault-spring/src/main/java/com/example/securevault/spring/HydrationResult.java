package com.example.securevault.spring;

import com.example.securevault.core.SecureVault;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one {@link KeyVaultSecrets} call.
 *
 * @param vault the vault the secrets were read from, reusable for later direct access
 * @param secrets secrets that were found, in request order; values are plaintext
 * @param skippedKeys requested keys the vault did not have
 * @param propertySourceName name of the property source the secrets were added under
 */
public record HydrationResult(
    SecureVault vault,
    Map<String, String> secrets,
    List<String> skippedKeys,
    String propertySourceName) {

  public HydrationResult {
    secrets = Collections.unmodifiableMap(new LinkedHashMap<>(secrets));
    skippedKeys = List.copyOf(skippedKeys);
  }

  @Override
  public String toString() {
    return "HydrationResult[vault=%s, keys=%s, skippedKeys=%s, propertySourceName=%s]"
        .formatted(vault.getName(), secrets.keySet(), skippedKeys, propertySourceName);
  }
}
