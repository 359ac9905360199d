/**
 * Spring integration: {@link com.example.securevault.spring.KeyVaultSecrets} loads secrets into a
 * {@link org.springframework.core.env.ConfigurableEnvironment}, {@link
 * com.example.securevault.spring.KeyVaultRegistrations} publishes vault clients as beans.
 */
package com.example.securevault.spring;
