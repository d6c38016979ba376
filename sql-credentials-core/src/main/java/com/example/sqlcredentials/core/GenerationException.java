package com.example.sqlcredentials.core;

/** Username, password or expiration could not be generated under the configured policy. */
public class GenerationException extends CredentialException {

  public GenerationException(final String message) {
    super(message);
  }
}
