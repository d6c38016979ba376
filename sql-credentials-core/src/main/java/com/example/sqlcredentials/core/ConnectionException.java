package com.example.sqlcredentials.core;

/**
 * The live connection could not be obtained or closed.
 *
 * <p>When raised by root rotation after commit, the new password is already in effect and has
 * been recorded; only closing the old pool failed.
 */
public class ConnectionException extends CredentialException {

  public ConnectionException(final String message) {
    super(message);
  }

  public ConnectionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
