package com.example.sqlcredentials.core.jdbc;

import static org.junit.jupiter.api.Assertions.*;

import com.example.sqlcredentials.core.config.ConnectionConfig;
import org.junit.jupiter.api.*;

public class HikariDataSourceFactoryTest {

  private final HikariDataSourceFactory factory = new HikariDataSourceFactory();

  @Test
  @DisplayName("Should copy URL and credentials")
  void shouldCopyUrlAndCredentials() {
    final var hikari =
        factory.toHikariConfig(ConnectionConfig.of("jdbc:mysql://db:3306/", "root", "secret"));

    assertEquals("jdbc:mysql://db:3306/", hikari.getJdbcUrl());
    assertEquals("root", hikari.getUsername());
    assertEquals("secret", hikari.getPassword());
    assertEquals(-1, hikari.getInitializationFailTimeout());
  }

  @Test
  @DisplayName("Should default pool limits")
  void shouldDefaultPoolLimits() {
    final var hikari = factory.toHikariConfig(ConnectionConfig.of("jdbc:mysql://db/", "u", "p"));

    assertEquals(HikariDataSourceFactory.DEFAULT_MAX_OPEN_CONNECTIONS, hikari.getMaximumPoolSize());
    assertEquals(HikariDataSourceFactory.DEFAULT_MAX_OPEN_CONNECTIONS, hikari.getMinimumIdle());
  }

  @Test
  @DisplayName("Should cap idle connections at the pool size")
  void shouldCapIdleConnections() {
    final var hikari =
        factory.toHikariConfig(new ConnectionConfig("jdbc:mysql://db/", "u", "p", 3, 10, null));

    assertEquals(3, hikari.getMaximumPoolSize());
    assertEquals(3, hikari.getMinimumIdle());
  }

  @Test
  @DisplayName("Should convert the connection lifetime to milliseconds")
  void shouldConvertLifetime() {
    final var hikari =
        factory.toHikariConfig(new ConnectionConfig("jdbc:mysql://db/", "u", "p", 2, 1, 600L));

    assertEquals(2, hikari.getMaximumPoolSize());
    assertEquals(1, hikari.getMinimumIdle());
    assertEquals(600_000L, hikari.getMaxLifetime());
  }

  @Test
  @DisplayName("Should give every pool its own name")
  void shouldNamePools() {
    final var config = ConnectionConfig.of("jdbc:mysql://db/", "u", "p");
    assertNotEquals(
        factory.toHikariConfig(config).getPoolName(), factory.toHikariConfig(config).getPoolName());
  }
}
