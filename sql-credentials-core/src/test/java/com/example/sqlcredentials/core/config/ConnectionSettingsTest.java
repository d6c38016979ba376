package com.example.sqlcredentials.core.config;

import static org.junit.jupiter.api.Assertions.*;

import com.example.sqlcredentials.core.ConfigurationException;
import java.util.Map;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class ConnectionSettingsTest {

  @AfterEach
  void restoreMapper() {
    ConnectionSettings.setMapperSupplier(null);
  }

  @Test
  @DisplayName("Should decode known keys and ignore unknown ones")
  void shouldDecodeKnownKeys() throws ConfigurationException {
    final var config =
        ConnectionSettings.decode(
            Map.of(
                "connection_url", "jdbc:mysql://localhost:3306/",
                "username", "root",
                "password", "secret",
                "max_open_connections", 8,
                "max_idle_connections", 2,
                "max_connection_lifetime", 300,
                "plugin_name", "mysql-database-plugin"));

    assertEquals("jdbc:mysql://localhost:3306/", config.connectionUrl());
    assertEquals("root", config.username());
    assertEquals("secret", config.password());
    assertEquals(8, config.maxOpenConnections());
    assertEquals(2, config.maxIdleConnections());
    assertEquals(300L, config.maxConnectionLifetime());
  }

  @Test
  @DisplayName("Should leave missing keys null")
  void shouldLeaveMissingKeysNull() throws ConfigurationException {
    final var config = ConnectionSettings.decode(Map.of("connection_url", "jdbc:mysql://db/"));

    assertNull(config.username());
    assertNull(config.password());
    assertNull(config.maxOpenConnections());
    assertFalse(config.hasRootCredentials());
  }

  @Test
  @DisplayName("Should reject string values for numeric keys")
  void shouldRejectTypeMismatch() {
    assertThrows(
        ConfigurationException.class,
        () -> ConnectionSettings.decode(Map.of("max_open_connections", "ten")));
    assertThrows(
        ConfigurationException.class,
        () -> ConnectionSettings.decode(Map.of("max_open_connections", "10")));
  }

  @Test
  @DisplayName("Should reject negative pool limits")
  void shouldRejectNegativeLimits() {
    assertThrows(
        ConfigurationException.class,
        () -> ConnectionSettings.decode(Map.of("max_idle_connections", -1)));
    assertThrows(
        ConfigurationException.class,
        () -> ConnectionSettings.decode(Map.of("max_connection_lifetime", -5)));
  }

  @Test
  @DisplayName("Should reject null settings")
  void shouldRejectNullSettings() {
    assertThrows(ConfigurationException.class, () -> ConnectionSettings.decode(null));
  }

  @Test
  @DisplayName("Should require a connection URL when asked")
  void shouldRequireConnectionUrl() {
    assertThrows(
        ConfigurationException.class,
        () -> ConnectionSettings.requireConnectionUrl(ConnectionConfig.of(" ", "root", "pw")));
    assertDoesNotThrow(
        () ->
            ConnectionSettings.requireConnectionUrl(
                ConnectionConfig.of("jdbc:mysql://db/", "root", "pw")));
  }

  @Test
  @DisplayName("Should encode back to snake_case keys without nulls")
  void shouldEncode() {
    final var settings =
        ConnectionSettings.encode(
            new ConnectionConfig("jdbc:mysql://db/", "root", "secret", 4, null, 60L));

    assertEquals("jdbc:mysql://db/", settings.get("connection_url"));
    assertEquals("root", settings.get("username"));
    assertEquals("secret", settings.get("password"));
    assertEquals(4, settings.get("max_open_connections"));
    assertEquals(60, ((Number) settings.get("max_connection_lifetime")).intValue());
    assertFalse(settings.containsKey("max_idle_connections"));
  }

  @Test
  @DisplayName("Should replace only the password")
  void shouldReplacePassword() {
    final var config = new ConnectionConfig("jdbc:mysql://db/", "root", "old", 4, 2, 60L);
    final var updated = config.withPassword("new");

    assertEquals("new", updated.password());
    assertEquals(config.connectionUrl(), updated.connectionUrl());
    assertEquals(config.username(), updated.username());
    assertEquals(config.maxOpenConnections(), updated.maxOpenConnections());
    assertEquals(config.maxIdleConnections(), updated.maxIdleConnections());
    assertEquals(config.maxConnectionLifetime(), updated.maxConnectionLifetime());
  }

  @Test
  @DisplayName("Should not print the password")
  void shouldRedactPassword() {
    assertFalse(ConnectionConfig.of("jdbc:mysql://db/", "root", "hunter2").toString().contains("hunter2"));
  }
}
