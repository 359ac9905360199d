/**
 * Unchecked exception hierarchy rooted at {@link
 * com.example.securevault.core.exception.SecureVaultException}.
 */
package com.example.securevault.core.exception;
