package com.example.sqlcredentials.core.config;

import com.example.sqlcredentials.core.ConfigurationException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Converts between generic settings maps and {@link ConnectionConfig} using Jackson.
 *
 * <p>Unknown keys are ignored, but values of a known key must already have the right type: scalar
 * coercion is disabled, so {@code "10"} for {@code max_open_connections} is rejected rather than
 * parsed.
 */
public final class ConnectionSettings {

  private static final TypeReference<Map<String, Object>> SETTINGS_TYPE = new TypeReference<>() {};

  private static Supplier<ObjectMapper> mapperSupplier = ConnectionSettings::defaultMapper;

  private ConnectionSettings() {}

  /**
   * Sets the supplier of the {@link ObjectMapper} used for conversion.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = Optional.ofNullable(supplier).orElse(ConnectionSettings::defaultMapper);
  }

  /**
   * Mapper that ignores unknown properties and refuses scalar coercion.
   *
   * @return a new mapper
   */
  public static ObjectMapper defaultMapper() {
    return JsonMapper.builder()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
        .build();
  }

  /**
   * Decodes a settings map.
   *
   * @param settings raw settings, typically from the orchestrator or a secret
   * @return decoded configuration
   * @throws ConfigurationException if the map is missing or a value has the wrong type or range
   */
  public static ConnectionConfig decode(final Map<String, ?> settings)
      throws ConfigurationException {
    if (settings == null) throw new ConfigurationException("settings are required");

    final ConnectionConfig config;
    try {
      config = mapperSupplier.get().convertValue(settings, ConnectionConfig.class);
    } catch (final IllegalArgumentException e) {
      throw new ConfigurationException("invalid connection settings: " + e.getMessage(), e);
    }

    requireNonNegative("max_open_connections", config.maxOpenConnections());
    requireNonNegative("max_idle_connections", config.maxIdleConnections());
    requireNonNegative("max_connection_lifetime", config.maxConnectionLifetime());
    return config;
  }

  /**
   * Encodes a configuration back into the settings shape it was decoded from.
   *
   * @param config configuration to encode
   * @return settings map without {@code null} entries
   */
  public static Map<String, Object> encode(final ConnectionConfig config) {
    return mapperSupplier.get().convertValue(config, SETTINGS_TYPE);
  }

  /**
   * Fails unless the configuration names a JDBC URL.
   *
   * @param config configuration to check
   * @throws ConfigurationException if {@code connection_url} is missing or blank
   */
  public static void requireConnectionUrl(final ConnectionConfig config)
      throws ConfigurationException {
    if (config.connectionUrl() == null || config.connectionUrl().isBlank())
      throw new ConfigurationException("connection_url cannot be empty");
  }

  private static void requireNonNegative(final String key, final Number value)
      throws ConfigurationException {
    if (value != null && value.longValue() < 0)
      throw new ConfigurationException(key + " must be >= 0");
  }
}
