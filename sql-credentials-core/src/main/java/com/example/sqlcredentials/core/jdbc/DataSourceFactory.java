package com.example.sqlcredentials.core.jdbc;

import com.example.sqlcredentials.core.config.ConnectionConfig;
import javax.sql.DataSource;

/**
 * Factory that creates a {@link DataSource} from a {@link ConnectionConfig}. Implementations
 * typically configure a connection pool using values from the configuration.
 */
@FunctionalInterface
public interface DataSourceFactory {
  /**
   * Creates a new {@link DataSource} configured for the provided settings.
   *
   * @param config connection URL, credentials and pool limits
   * @return a new {@link DataSource}
   */
  DataSource create(final ConnectionConfig config);
}
