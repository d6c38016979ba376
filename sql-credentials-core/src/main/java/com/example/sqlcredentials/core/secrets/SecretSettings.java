package com.example.sqlcredentials.core.secrets;

import com.example.sqlcredentials.core.ConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Loads connection settings stored as a JSON secret in AWS Secrets Manager.
 *
 * <p>The secret is either a settings document ({@code connection_url}, {@code username}, {@code
 * password}, ...) or the RDS secret layout ({@code engine}, {@code host}, {@code port}, {@code
 * dbname}, {@code username}, {@code password}). For the latter a {@code connection_url} is derived
 * when none is present.
 */
public final class SecretSettings {

  private static final TypeReference<Map<String, Object>> SETTINGS_TYPE = new TypeReference<>() {};

  private static Supplier<ObjectMapper> mapperSupplier = ObjectMapper::new;

  private SecretSettings() {}

  /**
   * Sets the supplier of the {@link ObjectMapper} to use for parsing.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = Optional.ofNullable(supplier).orElse(ObjectMapper::new);
  }

  /**
   * Reads and parses the settings secret.
   *
   * @param secretId the identifier/name of the secret in AWS Secrets Manager
   * @return settings map
   * @throws ConfigurationException if the secret cannot be fetched or is not a JSON object
   */
  public static Map<String, Object> load(final String secretId) throws ConfigurationException {
    final String secret;
    try {
      secret = SecretsManagerProvider.getSecret(secretId);
    } catch (final SdkException e) {
      throw new ConfigurationException("failed to load settings secret " + secretId, e);
    }
    if (secret == null || secret.isBlank())
      throw new ConfigurationException("settings secret " + secretId + " has no string value");

    return parse(secret);
  }

  /**
   * Parses a settings document, deriving {@code connection_url} from RDS fields when needed.
   *
   * @param json secret string
   * @return settings map
   * @throws ConfigurationException if the document is not a JSON object
   */
  static Map<String, Object> parse(final String json) throws ConfigurationException {
    final Map<String, Object> settings;
    try {
      settings = new LinkedHashMap<>(mapperSupplier.get().readValue(json, SETTINGS_TYPE));
    } catch (final JsonProcessingException e) {
      throw new ConfigurationException("settings secret is not a JSON object", e);
    }

    if (!settings.containsKey("connection_url") && settings.get("host") != null)
      settings.put("connection_url", jdbcUrl(settings));
    return settings;
  }

  private static String jdbcUrl(final Map<String, Object> settings) {
    final var engine =
        String.valueOf(settings.getOrDefault("engine", "mysql")).toLowerCase(Locale.ROOT);
    final var subprotocol = "postgres".equals(engine) ? "postgresql" : engine;
    final var url = new StringBuilder("jdbc:").append(subprotocol).append("://");
    url.append(settings.get("host"));
    if (settings.get("port") != null) url.append(':').append(settings.get("port"));
    url.append('/');
    if (settings.get("dbname") != null) url.append(settings.get("dbname"));
    return url.toString();
  }
}
