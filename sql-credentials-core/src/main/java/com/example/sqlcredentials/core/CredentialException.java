package com.example.sqlcredentials.core;

/**
 * Base type for every failure raised by a credential lifecycle operation.
 *
 * <p>Failures are never retried internally. Re-running account DDL such as {@code CREATE USER} can
 * fail or have side effects of its own, so retrying is left to the caller.
 */
public class CredentialException extends Exception {

  public CredentialException(final String message) {
    super(message);
  }

  public CredentialException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
