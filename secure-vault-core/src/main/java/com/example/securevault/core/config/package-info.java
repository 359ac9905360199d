/** Credential parameter sets for connecting to a Key Vault instance. */
package com.example.securevault.core.config;
