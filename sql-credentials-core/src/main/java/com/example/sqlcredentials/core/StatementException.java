package com.example.sqlcredentials.core;

import java.sql.SQLException;

/**
 * A statement of a batch failed to prepare or execute.
 *
 * <p>The rendered SQL is deliberately not part of the message: it usually carries a generated
 * password. The position of the statement within the rendered batch is kept instead.
 */
public class StatementException extends CredentialException {

  private final int statementIndex;

  public StatementException(final int statementIndex, final SQLException cause) {
    super("statement " + statementIndex + " failed: " + cause.getMessage(), cause);
    this.statementIndex = statementIndex;
  }

  public StatementException(final int statementIndex, final String message) {
    super("statement " + statementIndex + " failed: " + message);
    this.statementIndex = statementIndex;
  }

  /**
   * Zero-based position of the failing statement in the rendered batch.
   *
   * @return statement index
   */
  public int statementIndex() {
    return statementIndex;
  }

  /**
   * The driver exception, when the failure came from the database.
   *
   * @return the underlying {@link SQLException} or {@code null}
   */
  public SQLException sqlException() {
    return getCause() instanceof SQLException sql ? sql : null;
  }
}
