package com.example.sqlcredentials.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.sqlcredentials.core.CredentialException;
import com.example.sqlcredentials.core.StatementException;
import com.example.sqlcredentials.core.TransactionException;
import java.lang.System.Logger;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Runs rendered statement batches inside a single JDBC transaction.
 *
 * <p>Either every statement of a batch is committed or none is: any failure rolls the transaction
 * back before the error is rethrown. Auto-commit is restored only once the transaction has been
 * committed or rolled back; after a failed rollback the connection is left in manual-commit mode so
 * the pool discards its pending work on close instead of committing it.
 *
 * <p>A running statement is aborted by {@link #cancel()}, typically called from another thread, or
 * by the query timeout. Thread interruption is only observed between statements, and begin, commit
 * and rollback are not bounded by the timeout.
 *
 * <pre>{@code
 * var executor = new TransactionalExecutor(UnsupportedPreparedStatementDetector.mysql(), Duration.ZERO);
 * executor.inTransaction(conn, c -> {
 *   executor.executeBatch(c, statements, ExecutionMode.PREPARED_WITH_FALLBACK);
 *   return null;
 * });
 * }</pre>
 */
public final class TransactionalExecutor {

  private static final Logger logger = System.getLogger(TransactionalExecutor.class.getName());

  private final UnsupportedPreparedStatementDetector detector;
  private final Duration statementTimeout;
  private volatile Statement active;
  private volatile boolean cancelled;

  /**
   * Creates an executor.
   *
   * @param detector decides when a prepare failure allows direct execution
   * @param statementTimeout per-statement query timeout, {@link Duration#ZERO} for none
   */
  public TransactionalExecutor(
      final UnsupportedPreparedStatementDetector detector, final Duration statementTimeout) {
    this.detector = Objects.requireNonNull(detector, "detector");
    this.statementTimeout = Objects.requireNonNull(statementTimeout, "statementTimeout");
    if (statementTimeout.isNegative())
      throw new IllegalArgumentException("statementTimeout must be non-negative");
  }

  /**
   * Work run inside a transaction.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface TransactionalWork<T> {
    /**
     * Runs the work on the transaction's connection.
     *
     * @param conn connection with auto-commit disabled
     * @return work result
     * @throws CredentialException on failure, which rolls the transaction back
     */
    T execute(final Connection conn) throws CredentialException;
  }

  /**
   * Runs {@code work} in a transaction on {@code conn}, committing on success and rolling back on
   * any failure. The connection's auto-commit mode is restored afterwards.
   *
   * @param conn an open connection
   * @param work the work to run
   * @param <T> result type
   * @return the work result
   * @throws TransactionException if the transaction cannot be started or committed
   * @throws CredentialException whatever the work throws
   */
  public <T> T inTransaction(final Connection conn, final TransactionalWork<T> work)
      throws CredentialException {
    final boolean autoCommit;
    try {
      autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
    } catch (final SQLException e) {
      throw new TransactionException("failed to begin transaction", e);
    }

    cancelled = false;
    var settled = false;
    try {
      final var result = work.execute(conn);
      commit(conn);
      settled = true;
      return result;
    } catch (final Throwable t) {
      settled = rollback(conn, t);
      throw t;
    } finally {
      if (settled) restoreAutoCommit(conn, autoCommit);
      else logger.log(WARNING, "Transaction outcome unknown, leaving auto-commit disabled");
    }
  }

  /**
   * Aborts the transaction currently running: the statement in flight is cancelled through {@link
   * Statement#cancel()} and no further statement of the batch is started. Safe to call from any
   * thread; does nothing when no transaction is running.
   *
   * @throws SQLException if the driver fails to cancel the running statement
   */
  public void cancel() throws SQLException {
    cancelled = true;
    final var current = active;
    if (current != null) {
      logger.log(DEBUG, "Cancelling running statement");
      current.cancel();
    }
  }

  /**
   * Executes the statements in order on {@code conn}. Must be called inside {@link
   * #inTransaction}; the first failure stops the batch.
   *
   * @param conn connection carrying the transaction
   * @param statements rendered statements
   * @param mode prepared with fallback, or direct only
   * @throws StatementException on the first statement that fails, or if the thread is interrupted
   */
  public void executeBatch(
      final Connection conn, final List<String> statements, final ExecutionMode mode)
      throws StatementException {
    logger.log(DEBUG, "Executing {0} statements ({1})", statements.size(), mode);

    for (var i = 0; i < statements.size(); i++) {
      if (Thread.currentThread().isInterrupted())
        throw new StatementException(i, "interrupted before execution");
      if (cancelled) throw new StatementException(i, "cancelled before execution");

      final var sql = statements.get(i);
      switch (mode) {
        case PREPARED_WITH_FALLBACK -> executePrepared(conn, i, sql);
        case DIRECT_ONLY -> executeDirect(conn, i, sql);
      }
    }
  }

  private void executePrepared(final Connection conn, final int index, final String sql)
      throws StatementException {
    final PreparedStatement prepared;
    try {
      prepared = conn.prepareStatement(sql);
    } catch (final SQLException e) {
      if (!detector.isUnsupported(e)) throw new StatementException(index, e);

      logger.log(DEBUG, "Statement {0} is not supported as prepared, executing directly", index);
      executeDirect(conn, index, sql);
      return;
    }

    try (prepared) {
      applyTimeout(prepared);
      run(prepared, prepared::execute);
    } catch (final SQLException e) {
      throw new StatementException(index, e);
    }
  }

  private void executeDirect(final Connection conn, final int index, final String sql)
      throws StatementException {
    try (final var statement = conn.createStatement()) {
      applyTimeout(statement);
      run(statement, () -> statement.execute(sql));
    } catch (final SQLException e) {
      throw new StatementException(index, e);
    }
  }

  private void run(final Statement statement, final Execution execution) throws SQLException {
    active = statement;
    try {
      if (cancelled) throw new SQLException("statement cancelled");
      execution.execute();
    } finally {
      active = null;
    }
  }

  private void applyTimeout(final Statement statement) throws SQLException {
    if (!statementTimeout.isZero())
      statement.setQueryTimeout(
          (int) Math.min(Integer.MAX_VALUE, Math.max(1L, statementTimeout.toSeconds())));
  }

  private static void commit(final Connection conn) throws TransactionException {
    try {
      conn.commit();
    } catch (final SQLException e) {
      throw new TransactionException("failed to commit transaction", e);
    }
  }

  private static boolean rollback(final Connection conn, final Throwable cause) {
    try {
      conn.rollback();
      return true;
    } catch (final SQLException | RuntimeException e) {
      logger.log(WARNING, "Rollback failed", e);
      cause.addSuppressed(e);
      return false;
    }
  }

  @FunctionalInterface
  private interface Execution {
    boolean execute() throws SQLException;
  }

  private static void restoreAutoCommit(final Connection conn, final boolean autoCommit) {
    try {
      conn.setAutoCommit(autoCommit);
    } catch (final SQLException e) {
      logger.log(WARNING, "Failed to restore auto-commit", e);
    }
  }
}
