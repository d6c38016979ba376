package com.example.sqlcredentials.core.jdbc;

/** How {@link TransactionalExecutor} runs each statement of a batch. */
public enum ExecutionMode {

  /**
   * Prepare every statement first. Statements the engine refuses to prepare are executed directly
   * instead, as decided by the {@link UnsupportedPreparedStatementDetector}.
   */
  PREPARED_WITH_FALLBACK,

  /** Execute every statement directly without preparing it. */
  DIRECT_ONLY
}
