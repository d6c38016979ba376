package com.example.sqlcredentials.core.jdbc;

import java.sql.SQLException;
import java.util.function.Predicate;

/**
 * Recognizes the engine error meaning "this statement cannot be used with the prepared statement
 * protocol".
 *
 * <p>{@link TransactionalExecutor} falls back to direct execution when this detector matches a
 * prepare failure, which keeps the executor itself engine agnostic.
 */
@FunctionalInterface
public interface UnsupportedPreparedStatementDetector {

  /** MySQL/MariaDB {@code ER_UNSUPPORTED_PS}. */
  int MYSQL_UNSUPPORTED_PS = 1295;

  /**
   * Determines if the prepare failure means the statement must be executed directly.
   *
   * @param e the exception raised while preparing
   * @return true if direct execution should be attempted
   */
  boolean isUnsupported(final SQLException e);

  /**
   * Detector for MySQL and MariaDB, matching vendor code 1295 anywhere in the cause or
   * next-exception chain.
   *
   * @return MySQL detector
   */
  static UnsupportedPreparedStatementDetector mysql() {
    return e -> hasErrorCode(e, MYSQL_UNSUPPORTED_PS);
  }

  /**
   * Detector that never falls back.
   *
   * @return detector always returning false
   */
  static UnsupportedPreparedStatementDetector never() {
    return e -> false;
  }

  /**
   * Creates a custom detector from a predicate.
   *
   * @param predicate the predicate to use for detection
   * @return custom detector
   */
  static UnsupportedPreparedStatementDetector custom(final Predicate<SQLException> predicate) {
    return predicate::test;
  }

  /**
   * Combines this detector with another using OR logic.
   *
   * @param other the other detector to combine with
   * @return combined detector
   */
  default UnsupportedPreparedStatementDetector or(final UnsupportedPreparedStatementDetector other) {
    return e -> this.isUnsupported(e) || other.isUnsupported(e);
  }

  private static boolean hasErrorCode(final Throwable t, final int errorCode) {
    Throwable cur = t;
    while (cur != null) {
      if (cur instanceof SQLException sql) {
        for (var next = sql; next != null; next = next.getNextException()) {
          if (next.getErrorCode() == errorCode) return true;
        }
      }
      cur = cur.getCause();
    }
    return false;
  }
}
