package com.example.sqlcredentials.core;

/** Missing or invalid connection settings. Raised before any database I/O. */
public class ConfigurationException extends CredentialException {

  public ConfigurationException(final String message) {
    super(message);
  }

  public ConfigurationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
