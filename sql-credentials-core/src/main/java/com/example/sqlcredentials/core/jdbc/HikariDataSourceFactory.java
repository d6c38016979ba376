package com.example.sqlcredentials.core.jdbc;

import com.example.sqlcredentials.core.config.ConnectionConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import javax.sql.DataSource;

/**
 * Builds HikariCP pools.
 *
 * <p>Pools are created lazily: no connection is opened until the first borrow, so building a pool
 * never performs I/O.
 */
public final class HikariDataSourceFactory implements DataSourceFactory {

  static final int DEFAULT_MAX_OPEN_CONNECTIONS = 4;

  private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

  @Override
  public DataSource create(final ConnectionConfig config) {
    return new HikariDataSource(toHikariConfig(config));
  }

  HikariConfig toHikariConfig(final ConnectionConfig config) {
    final var maxOpen =
        Optional.ofNullable(config.maxOpenConnections())
            .filter(v -> v > 0)
            .orElse(DEFAULT_MAX_OPEN_CONNECTIONS);
    final var maxIdle =
        Optional.ofNullable(config.maxIdleConnections())
            .filter(v -> v > 0)
            .map(v -> Math.min(v, maxOpen))
            .orElse(maxOpen);

    final var hikari = new HikariConfig();
    hikari.setPoolName("sql-credentials-" + POOL_COUNTER.incrementAndGet());
    hikari.setJdbcUrl(config.connectionUrl());
    hikari.setUsername(config.username());
    hikari.setPassword(config.password());
    hikari.setMaximumPoolSize(maxOpen);
    hikari.setMinimumIdle(maxIdle);
    hikari.setInitializationFailTimeout(-1);
    Optional.ofNullable(config.maxConnectionLifetime())
        .filter(v -> v > 0)
        .map(seconds -> Duration.ofSeconds(seconds).toMillis())
        .ifPresent(hikari::setMaxLifetime);
    return hikari;
  }
}
