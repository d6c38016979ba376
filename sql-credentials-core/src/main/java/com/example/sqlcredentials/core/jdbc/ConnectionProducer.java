package com.example.sqlcredentials.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.sqlcredentials.core.ConfigurationException;
import com.example.sqlcredentials.core.ConnectionException;
import com.example.sqlcredentials.core.CredentialException;
import com.example.sqlcredentials.core.config.ConnectionConfig;
import com.example.sqlcredentials.core.config.ConnectionSettings;
import java.lang.System.Logger;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;
import javax.sql.DataSource;

/**
 * Owns the live {@link DataSource} for one database target and lends connections from it.
 *
 * <p>The data source is created lazily from the current {@link ConnectionConfig} and kept until
 * {@link #close()}, after which the next borrow builds a new one from whatever configuration is
 * current then. Root rotation relies on this to reconnect with the new password.
 *
 * <p>Not thread-safe: callers serialize access, which {@code SqlCredentialManager} does with its
 * exclusivity guard.
 */
public final class ConnectionProducer {

  private static final Logger logger = System.getLogger(ConnectionProducer.class.getName());
  private static final int VALIDATION_TIMEOUT_SECONDS = 5;

  private final DataSourceFactory factory;
  private ConnectionConfig config;
  private DataSource dataSource;

  /**
   * Creates a producer.
   *
   * @param factory builds the live data source
   * @param config initial configuration, or {@code null} until {@link #initialize} is called
   */
  public ConnectionProducer(final DataSourceFactory factory, final ConnectionConfig config) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.config = config;
  }

  /**
   * Current configuration.
   *
   * @return configuration, or {@code null} if never initialized
   */
  public ConnectionConfig config() {
    return config;
  }

  /**
   * Whether a live data source currently exists.
   *
   * @return true if a data source has been created and not closed
   */
  public boolean isOpen() {
    return dataSource != null;
  }

  /**
   * Replaces the configuration from a settings map, closing any live data source.
   *
   * @param settings raw settings
   * @param verifyConnection borrow and validate a connection before returning
   * @return the decoded settings
   * @throws ConfigurationException if the settings are invalid
   * @throws ConnectionException if verification fails
   */
  public Map<String, Object> initialize(
      final Map<String, ?> settings, final boolean verifyConnection) throws CredentialException {
    final var decoded = ConnectionSettings.decode(settings);
    ConnectionSettings.requireConnectionUrl(decoded);

    close();
    config = decoded;
    logger.log(DEBUG, "Initialized connection settings for {0}", decoded.connectionUrl());

    if (verifyConnection) verify();
    return ConnectionSettings.encode(decoded);
  }

  /**
   * Records a new configuration without touching the live data source.
   *
   * @param newConfig configuration used the next time a data source is built
   */
  public void updateConfig(final ConnectionConfig newConfig) {
    this.config = Objects.requireNonNull(newConfig, "newConfig");
  }

  /**
   * Borrows a connection, building the data source first if needed.
   *
   * @return an open connection; the caller closes it to hand it back
   * @throws ConnectionException if no connection can be obtained
   */
  public Connection getConnection() throws ConnectionException {
    if (config == null || config.connectionUrl() == null || config.connectionUrl().isBlank())
      throw new ConnectionException("connection settings have not been initialized");

    if (dataSource == null) {
      try {
        dataSource = factory.create(config);
      } catch (final RuntimeException e) {
        throw new ConnectionException("failed to create data source", e);
      }
    }

    try {
      return dataSource.getConnection();
    } catch (final SQLException e) {
      throw new ConnectionException("failed to obtain connection", e);
    }
  }

  /**
   * Closes the live data source, if any. The next borrow builds a new one.
   *
   * @throws ConnectionException if closing fails; the data source is dropped regardless
   */
  public void close() throws ConnectionException {
    final var current = dataSource;
    dataSource = null;
    if (current instanceof AutoCloseable ac) {
      try {
        ac.close();
        logger.log(INFO, "Closed data source");
      } catch (final Exception e) {
        throw new ConnectionException("failed to close data source", e);
      }
    }
  }

  private void verify() throws ConnectionException {
    try (final var conn = getConnection()) {
      if (!conn.isValid(VALIDATION_TIMEOUT_SECONDS))
        throw new ConnectionException("connection did not validate");
    } catch (final SQLException e) {
      throw new ConnectionException("failed to verify connection", e);
    }
  }
}
