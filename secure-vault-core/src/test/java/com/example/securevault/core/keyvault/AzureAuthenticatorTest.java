package com.example.securevault.core.keyvault;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import com.azure.core.exception.ClientAuthenticationException;
import com.example.securevault.core.config.MsiConfig;
import com.example.securevault.core.config.ServicePrincipleConfig;
import com.example.securevault.core.exception.AuthenticationException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;

public class AzureAuthenticatorTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
  private static final ServicePrincipleConfig PRINCIPAL =
      new ServicePrincipleConfig("sp-vault", "app-1", "secret-1", "tenant-1");

  private Clock clock;
  private TokenCredential tokenCredential;
  private AtomicInteger managedIdentityBuilds;
  private AzureAuthenticator authenticator;

  @BeforeEach
  void setUp() {
    clock = Clock.fixed(NOW, ZoneOffset.UTC);
    tokenCredential = mock(TokenCredential.class);
    managedIdentityBuilds = new AtomicInteger();
    authenticator =
        new AzureAuthenticator(
            clock,
            () -> {
              managedIdentityBuilds.incrementAndGet();
              return tokenCredential;
            },
            config -> tokenCredential);
  }

  @Test
  @DisplayName("Managed identity sessions should last one day")
  void shouldExpireManagedIdentitySessionAfterOneDay() {
    final var session = authenticator.authenticate(new MsiConfig("msi-vault"));

    assertNotNull(session.store());
    assertEquals(NOW.plus(Duration.ofDays(1)), session.expiresAt());
    assertEquals(1, managedIdentityBuilds.get());
    verifyNoInteractions(tokenCredential);
  }

  @Test
  @DisplayName("Service principal sessions should expire with the acquired token")
  void shouldUseTokenExpiryForServicePrincipal() {
    final var expiry = OffsetDateTime.of(2024, 5, 1, 11, 5, 0, 0, ZoneOffset.UTC);
    when(tokenCredential.getToken(any())).thenReturn(Mono.just(new AccessToken("jwt", expiry)));

    final var session = authenticator.authenticate(PRINCIPAL);

    assertEquals(expiry.toInstant(), session.expiresAt());
    final var context = ArgumentCaptor.forClass(TokenRequestContext.class);
    verify(tokenCredential).getToken(context.capture());
    assertEquals(
        List.of("https://vault.azure.net/.default"), context.getValue().getScopes());
    assertEquals(0, managedIdentityBuilds.get());
  }

  @Test
  void shouldFailWhenAuthorityReturnsNoToken() {
    when(tokenCredential.getToken(any())).thenReturn(Mono.empty());

    final var ex =
        assertThrows(AuthenticationException.class, () -> authenticator.authenticate(PRINCIPAL));
    assertTrue(ex.getMessage().contains("https://login.windows.net/tenant-1"));
    assertTrue(ex.getMessage().contains("app-1"));
    assertFalse(ex.getMessage().contains("secret-1"));
  }

  @Test
  void shouldWrapAuthorityRejection() {
    when(tokenCredential.getToken(any()))
        .thenReturn(Mono.error(new ClientAuthenticationException("AADSTS7000215", null)));

    final var ex =
        assertThrows(AuthenticationException.class, () -> authenticator.authenticate(PRINCIPAL));
    assertInstanceOf(ClientAuthenticationException.class, ex.getCause());
  }
}
