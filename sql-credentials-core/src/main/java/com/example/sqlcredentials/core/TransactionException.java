package com.example.sqlcredentials.core;

import java.sql.SQLException;

/** Begin, commit or rollback failed at the connection level. */
public class TransactionException extends CredentialException {

  public TransactionException(final String message, final SQLException cause) {
    super(message, cause);
  }
}
