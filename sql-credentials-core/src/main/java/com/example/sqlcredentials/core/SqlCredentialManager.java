package com.example.sqlcredentials.core;

import static com.example.sqlcredentials.core.template.StatementTemplate.EXPIRATION;
import static com.example.sqlcredentials.core.template.StatementTemplate.NAME;
import static com.example.sqlcredentials.core.template.StatementTemplate.PASSWORD;
import static com.example.sqlcredentials.core.template.StatementTemplate.USERNAME;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.sqlcredentials.core.config.ConnectionConfig;
import com.example.sqlcredentials.core.config.ConnectionSettings;
import com.example.sqlcredentials.core.credentials.CredentialGenerator;
import com.example.sqlcredentials.core.credentials.DatabaseUser;
import com.example.sqlcredentials.core.credentials.SqlCredentialGenerator;
import com.example.sqlcredentials.core.credentials.UsernameConfig;
import com.example.sqlcredentials.core.credentials.UsernamePolicy;
import com.example.sqlcredentials.core.jdbc.ConnectionProducer;
import com.example.sqlcredentials.core.jdbc.DataSourceFactory;
import com.example.sqlcredentials.core.jdbc.ExecutionMode;
import com.example.sqlcredentials.core.jdbc.HikariDataSourceFactory;
import com.example.sqlcredentials.core.jdbc.TransactionalExecutor;
import com.example.sqlcredentials.core.jdbc.UnsupportedPreparedStatementDetector;
import com.example.sqlcredentials.core.secrets.SecretSettings;
import com.example.sqlcredentials.core.template.StatementTemplate;
import java.lang.System.Logger;
import java.security.SecureRandom;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Creates, revokes and rotates database accounts for one database target.
 *
 * <p>Every state-changing operation holds an exclusive, fair lock for its whole duration,
 * connection borrow and transaction included, so account DDL never interleaves on the target.
 * Statements of one operation run in a single transaction: the operation either commits all of
 * them or none.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var manager = SqlCredentialManager.builder()
 *     .settings(Map.of(
 *         "connection_url", "jdbc:mysql://db:3306/",
 *         "username", "root",
 *         "password", "secret"))
 *     .build();
 *
 * var user = manager.createUser(
 *     List.of("CREATE USER '{{name}}'@'%' IDENTIFIED BY '{{password}}';"
 *         + "GRANT SELECT ON *.* TO '{{name}}'@'%'"),
 *     new UsernameConfig("token", "readonly"),
 *     Instant.now().plus(Duration.ofHours(1)));
 *
 * manager.revokeUser(List.of(), user.username());
 * }</pre>
 *
 * <h2>Legacy Username Lengths</h2>
 *
 * <pre>{@code
 * var manager = SqlCredentialManager.builder()
 *     .settingsFromSecret("prod/mysql/root")
 *     .usernamePolicy(UsernamePolicy.LEGACY)
 *     .statementTimeout(Duration.ofSeconds(30))
 *     .build();
 * }</pre>
 */
public final class SqlCredentialManager implements AutoCloseable {

  private static final Logger logger = System.getLogger(SqlCredentialManager.class.getName());

  /** Revocation used when the caller supplies none. */
  public static final String DEFAULT_REVOCATION_STATEMENTS =
      """
      REVOKE ALL PRIVILEGES, GRANT OPTION FROM '{{name}}'@'%';
      DROP USER '{{name}}'@'%'
      """;

  /** Root rotation used when the caller supplies none. */
  public static final String DEFAULT_ROTATE_ROOT_STATEMENTS =
      "ALTER USER '{{username}}'@'%' IDENTIFIED BY '{{password}}'";

  private final ReentrantLock guard = new ReentrantLock(true);
  private final String engineType;
  private final ConnectionProducer producer;
  private final CredentialGenerator generator;
  private final TransactionalExecutor executor;

  private SqlCredentialManager(final Builder builder, final ConnectionConfig config) {
    this.engineType = builder.engineType;
    this.producer = new ConnectionProducer(builder.dataSourceFactory, config);
    this.generator =
        builder.credentialGenerator != null
            ? builder.credentialGenerator
            : new SqlCredentialGenerator(
                builder.usernamePolicy, builder.clock, ZoneOffset.UTC, new SecureRandom());
    this.executor = new TransactionalExecutor(builder.detector, builder.statementTimeout);
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for {@link SqlCredentialManager}.
   *
   * <p>Connection settings may be given here or later through {@link #initialize(Map, boolean)}.
   */
  public static class Builder {
    private Map<String, ?> settings;
    private String settingsSecretId;
    private UsernamePolicy usernamePolicy = UsernamePolicy.CURRENT;
    private CredentialGenerator credentialGenerator;
    private DataSourceFactory dataSourceFactory = new HikariDataSourceFactory();
    private UnsupportedPreparedStatementDetector detector =
        UnsupportedPreparedStatementDetector.mysql();
    private Duration statementTimeout = Duration.ZERO;
    private String engineType = "mysql";
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    /**
     * Sets the connection settings map ({@code connection_url}, {@code username}, {@code
     * password}, pool limits). Unknown keys are ignored.
     *
     * @param settings settings map
     * @return this builder
     */
    public Builder settings(final Map<String, ?> settings) {
      this.settings = settings;
      return this;
    }

    /**
     * Reads the connection settings from an AWS Secrets Manager secret at build time.
     *
     * @param secretId secret identifier
     * @return this builder
     */
    public Builder settingsFromSecret(final String secretId) {
      this.settingsSecretId = secretId;
      return this;
    }

    /**
     * Sets the username length profile.
     *
     * <p>Default: {@link UsernamePolicy#CURRENT}
     *
     * @param usernamePolicy username policy
     * @return this builder
     */
    public Builder usernamePolicy(final UsernamePolicy usernamePolicy) {
      this.usernamePolicy = usernamePolicy;
      return this;
    }

    /**
     * Replaces the credential generator. Takes precedence over {@link #usernamePolicy}.
     *
     * @param credentialGenerator generator to use
     * @return this builder
     */
    public Builder credentialGenerator(final CredentialGenerator credentialGenerator) {
      this.credentialGenerator = credentialGenerator;
      return this;
    }

    /**
     * Sets the factory building the live data source.
     *
     * <p>Default: {@link HikariDataSourceFactory}
     *
     * @param dataSourceFactory data source factory
     * @return this builder
     */
    public Builder dataSourceFactory(final DataSourceFactory dataSourceFactory) {
      this.dataSourceFactory = dataSourceFactory;
      return this;
    }

    /**
     * Sets how prepare failures that allow direct execution are recognized.
     *
     * <p>Default: {@link UnsupportedPreparedStatementDetector#mysql()}
     *
     * @param detector detector
     * @return this builder
     */
    public Builder unsupportedPreparedStatementDetector(
        final UnsupportedPreparedStatementDetector detector) {
      this.detector = detector;
      return this;
    }

    /**
     * Sets the per-statement query timeout.
     *
     * <p>Default: ZERO (no timeout)
     *
     * @param statementTimeout timeout
     * @return this builder
     */
    public Builder statementTimeout(final Duration statementTimeout) {
      this.statementTimeout = statementTimeout;
      return this;
    }

    /**
     * Sets the engine name reported by {@link #type()}.
     *
     * <p>Default: {@code mysql}
     *
     * @param engineType engine name
     * @return this builder
     */
    public Builder engineType(final String engineType) {
      this.engineType = engineType;
      return this;
    }

    /**
     * Sets the clock used for the timestamp part of generated usernames.
     *
     * @param clock clock
     * @return this builder
     */
    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the manager.
     *
     * @return configured manager
     * @throws ConfigurationException if the settings cannot be loaded or decoded
     * @throws IllegalStateException if required fields are missing or conflict
     */
    public SqlCredentialManager build() throws ConfigurationException {
      if (settings != null && settingsSecretId != null)
        throw new IllegalStateException("settings and settingsFromSecret are mutually exclusive");
      if (usernamePolicy == null) throw new IllegalStateException("usernamePolicy cannot be null");
      if (dataSourceFactory == null)
        throw new IllegalStateException("dataSourceFactory cannot be null");
      if (detector == null) throw new IllegalStateException("detector cannot be null");
      if (engineType == null || engineType.isBlank())
        throw new IllegalStateException("engineType is required");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      if (statementTimeout == null || statementTimeout.isNegative())
        throw new IllegalArgumentException("statementTimeout must be non-negative");

      final var source = settingsSecretId != null ? SecretSettings.load(settingsSecretId) : settings;
      final var config = source != null ? ConnectionSettings.decode(source) : null;
      return new SqlCredentialManager(this, config);
    }
  }

  /**
   * Engine name of the target.
   *
   * @return engine type, {@code mysql} by default
   */
  public String type() {
    return engineType;
  }

  /**
   * Current connection configuration.
   *
   * @return configuration, or {@code null} if not initialized
   */
  public ConnectionConfig config() {
    guard.lock();
    try {
      return producer.config();
    } finally {
      guard.unlock();
    }
  }

  /**
   * Replaces the connection settings, closing the live pool.
   *
   * @param settings raw settings map
   * @param verifyConnection borrow and validate a connection before returning
   * @return the decoded settings
   * @throws ConfigurationException if the settings are invalid
   * @throws ConnectionException if verification fails
   */
  public Map<String, Object> initialize(
      final Map<String, ?> settings, final boolean verifyConnection) throws CredentialException {
    return guarded(() -> producer.initialize(settings, verifyConnection));
  }

  /**
   * Creates a new account by running the creation statements in one transaction.
   *
   * <p>Placeholders: {@code {{name}}}, {@code {{password}}}, {@code {{expiration}}}. Statements
   * are prepared, falling back to direct execution for statements the engine cannot prepare.
   *
   * @param statements creation statements, each possibly holding several {@code ;}-separated
   *     statements
   * @param usernameConfig display and role name hints
   * @param expiration when the account is meant to expire
   * @return generated username and password
   * @throws EmptyStatementException if no usable statement was supplied
   * @throws GenerationException if credentials cannot be generated
   * @throws StatementException if a statement fails; nothing is committed
   * @throws CredentialException on connection or transaction failures
   */
  public DatabaseUser createUser(
      final List<String> statements, final UsernameConfig usernameConfig, final Instant expiration)
      throws CredentialException {
    Objects.requireNonNull(usernameConfig, "usernameConfig");

    return guarded(
        () -> {
          if (statements == null || statements.isEmpty()) throw new EmptyStatementException();

          final var credential = generator.generate(usernameConfig, expiration);
          final var rendered =
              StatementTemplate.renderAll(
                  statements,
                  Map.of(
                      NAME, credential.username(),
                      PASSWORD, credential.password(),
                      EXPIRATION, credential.expiration()));
          if (rendered.isEmpty()) throw new EmptyStatementException();

          runInTransaction(rendered, ExecutionMode.PREPARED_WITH_FALLBACK);
          logger.log(INFO, "Created database user {0}", credential.username());
          return new DatabaseUser(credential.username(), credential.password());
        });
  }

  /**
   * Does nothing: account expiration is enforced by the caller's lease handling.
   *
   * @param statements ignored
   * @param username ignored
   * @param expiration ignored
   */
  public void renewUser(
      final List<String> statements, final String username, final Instant expiration) {}

  /**
   * Revokes an account by running the revocation statements in one transaction.
   *
   * <p>Placeholder: {@code {{name}}}. Statements are executed directly, never prepared. Without
   * statements, {@link #DEFAULT_REVOCATION_STATEMENTS} is used.
   *
   * @param statements revocation statements, may be empty
   * @param username account to revoke
   * @throws StatementException if a statement fails; nothing is committed
   * @throws CredentialException on connection or transaction failures
   */
  public void revokeUser(final List<String> statements, final String username)
      throws CredentialException {
    if (username == null || username.isBlank())
      throw new IllegalArgumentException("username is required");

    guarded(
        () -> {
          final var context = Map.of(NAME, username);
          runInTransaction(
              renderOrDefault(statements, DEFAULT_REVOCATION_STATEMENTS, context),
              ExecutionMode.DIRECT_ONLY);
          logger.log(INFO, "Revoked database user {0}", username);
          return null;
        });
  }

  /**
   * Sets a new password on the privileged account this manager connects with.
   *
   * <p>Placeholders: {@code {{username}}}, {@code {{password}}}. Without statements, {@link
   * #DEFAULT_ROTATE_ROOT_STATEMENTS} is used. After commit the live pool is closed so the next
   * operation reconnects with the new password.
   *
   * @param statements rotation statements, may be empty
   * @return the configuration holding the new password
   * @throws ConfigurationException if no username and password are configured
   * @throws StatementException if a statement fails; the old password stays in effect
   * @throws ConnectionException if closing the old pool fails after commit; the new password has
   *     been recorded regardless
   * @throws CredentialException on other connection or transaction failures
   */
  public ConnectionConfig rotateRootCredentials(final List<String> statements)
      throws CredentialException {
    return guarded(
        () -> {
          final var current = producer.config();
          if (current == null || !current.hasRootCredentials())
            throw new ConfigurationException("username and password are required to rotate");

          final var password = generator.generatePassword();
          final var context = Map.of(USERNAME, current.username(), PASSWORD, password);
          runInTransaction(
              renderOrDefault(statements, DEFAULT_ROTATE_ROOT_STATEMENTS, context),
              ExecutionMode.DIRECT_ONLY);

          final var updated = current.withPassword(password);
          try {
            producer.close();
          } finally {
            producer.updateConfig(updated);
          }
          logger.log(INFO, "Rotated credentials of {0}", current.username());
          return updated;
        });
  }

  /**
   * Aborts the operation currently holding the guard, if any. Its running statement is cancelled
   * and its transaction rolled back; the operation then fails with {@link StatementException}.
   * Does not wait for the guard, so it can be called while another thread is inside an operation.
   *
   * @throws ConnectionException if the driver fails to cancel the running statement
   */
  public void cancel() throws ConnectionException {
    try {
      executor.cancel();
    } catch (final SQLException e) {
      throw new ConnectionException("failed to cancel running statement", e);
    }
  }

  /**
   * Closes the live pool. Later operations reconnect on demand.
   *
   * @throws ConnectionException if closing fails or the wait for the guard is interrupted
   */
  @Override
  public void close() throws CredentialException {
    guarded(
        () -> {
          producer.close();
          return null;
        });
  }

  private void runInTransaction(final List<String> rendered, final ExecutionMode mode)
      throws CredentialException {
    final var conn = producer.getConnection();
    try {
      executor.inTransaction(
          conn,
          c -> {
            executor.executeBatch(c, rendered, mode);
            return null;
          });
    } finally {
      try {
        conn.close();
      } catch (final SQLException e) {
        logger.log(WARNING, "Failed to release connection", e);
      }
    }
  }

  private static List<String> renderOrDefault(
      final List<String> statements, final String defaults, final Map<String, String> context) {
    final var rendered =
        statements == null ? List.<String>of() : StatementTemplate.renderAll(statements, context);
    if (!rendered.isEmpty()) return rendered;

    logger.log(DEBUG, "No statements supplied, using defaults");
    return StatementTemplate.render(defaults, context);
  }

  private <T> T guarded(final GuardedOperation<T> operation) throws CredentialException {
    try {
      guard.lockInterruptibly();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConnectionException("interrupted while waiting for exclusive access", e);
    }

    try {
      return operation.run();
    } finally {
      guard.unlock();
    }
  }

  @FunctionalInterface
  private interface GuardedOperation<T> {
    T run() throws CredentialException;
  }
}
