package com.example.sqlcredentials.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connection settings for one database target.
 *
 * <p>Property names follow the snake_case keys of the settings map the configuration is decoded
 * from. Keys not listed here are ignored.
 *
 * @param connectionUrl JDBC URL of the target
 * @param username privileged account used to manage other accounts
 * @param password password of the privileged account
 * @param maxOpenConnections maximum pool size, {@code null} for the default
 * @param maxIdleConnections minimum idle connections kept in the pool, {@code null} for the default
 * @param maxConnectionLifetime maximum lifetime of a pooled connection in seconds, {@code null} or
 *     0 for the pool default
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConnectionConfig(
    @JsonProperty("connection_url") String connectionUrl,
    @JsonProperty("username") String username,
    @JsonProperty("password") String password,
    @JsonProperty("max_open_connections") Integer maxOpenConnections,
    @JsonProperty("max_idle_connections") Integer maxIdleConnections,
    @JsonProperty("max_connection_lifetime") Long maxConnectionLifetime) {

  /**
   * Creates a configuration holding only URL and credentials.
   *
   * @param connectionUrl JDBC URL
   * @param username account name
   * @param password account password
   * @return configuration with pool defaults
   */
  public static ConnectionConfig of(
      final String connectionUrl, final String username, final String password) {
    return new ConnectionConfig(connectionUrl, username, password, null, null, null);
  }

  /**
   * Whether both username and password are present, which root rotation requires.
   *
   * @return true when the privileged account is fully configured
   */
  public boolean hasRootCredentials() {
    return username != null && !username.isEmpty() && password != null && !password.isEmpty();
  }

  /**
   * Copy of this configuration with the password replaced.
   *
   * @param newPassword the new password
   * @return updated configuration
   */
  public ConnectionConfig withPassword(final String newPassword) {
    return new ConnectionConfig(
        connectionUrl,
        username,
        newPassword,
        maxOpenConnections,
        maxIdleConnections,
        maxConnectionLifetime);
  }

  @Override
  public String toString() {
    return "ConnectionConfig[connectionUrl="
        + connectionUrl
        + ", username="
        + username
        + ", password="
        + (password == null ? "null" : "****")
        + ", maxOpenConnections="
        + maxOpenConnections
        + ", maxIdleConnections="
        + maxIdleConnections
        + ", maxConnectionLifetime="
        + maxConnectionLifetime
        + "]";
  }
}
