package com.example.rdsiamdatasource.core.iam;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Loads {@link RdsIamConfig} from system properties, environment variables or a JSON document.
 *
 * <p>Keys, system property first, then environment variable:
 *
 * <ul>
 *   <li>rds.iam.enabled / RDS_IAM_ENABLED
 *   <li>rds.iam.region / RDS_IAM_REGION
 *   <li>rds.iam.dbuser / RDS_IAM_DBUSER
 *   <li>rds.iam.tokenrefreshinterval / RDS_IAM_TOKENREFRESHINTERVAL
 * </ul>
 *
 * <p>Durations are accepted as ISO-8601 ({@code PT14M}), with a unit suffix ({@code 500ms}, {@code
 * 90s}, {@code 14m}, {@code 1h}) or as a bare number of seconds.
 */
public final class RdsIamConfigLoader {

  static final String ENABLED = "rds.iam.enabled";
  static final String REGION = "rds.iam.region";
  static final String DB_USER = "rds.iam.dbuser";
  static final String TOKEN_REFRESH_INTERVAL = "rds.iam.tokenrefreshinterval";

  private static Supplier<ObjectMapper> mapperSupplier = ObjectMapper::new;

  private RdsIamConfigLoader() {}

  /**
   * Sets the supplier of the {@link ObjectMapper} used by {@link #fromJson(String)}.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier;
  }

  /**
   * Reads the configuration from system properties and environment variables. Missing keys take
   * their defaults: disabled, SDK region, connection-string user, 14 minute refresh.
   *
   * @return configuration
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  public static RdsIamConfig fromSystem() {
    return new RdsIamConfig(
        lookup(ENABLED).map(v -> parseBoolean(ENABLED, v)).orElse(false),
        lookup(REGION).orElse(""),
        lookup(DB_USER).orElse(""),
        lookup(TOKEN_REFRESH_INTERVAL)
            .map(v -> parseDuration(TOKEN_REFRESH_INTERVAL, v))
            .orElse(null));
  }

  /**
   * Reads the configuration from a JSON document such as:
   *
   * <pre>{@code
   * {"enabled": true, "region": "eu-west-1", "dbUser": "iam_user", "tokenRefreshInterval": "14m"}
   * }</pre>
   *
   * <p>Unknown keys are rejected.
   *
   * @param json JSON document
   * @return configuration
   * @throws IllegalArgumentException if the document cannot be read
   */
  public static RdsIamConfig fromJson(final String json) {
    final ConfigDocument document;
    try {
      document = mapperSupplier.get().readValue(json, ConfigDocument.class);
    } catch (final Exception exception) {
      throw new IllegalArgumentException("Failed to read RDS IAM configuration", exception);
    }
    if (document == null) {
      throw new IllegalArgumentException("Failed to read RDS IAM configuration: empty document");
    }
    return new RdsIamConfig(
        Optional.ofNullable(document.enabled()).orElse(false),
        document.region(),
        document.dbUser(),
        Optional.ofNullable(document.tokenRefreshInterval())
            .filter(v -> !v.isBlank())
            .map(v -> parseDuration("tokenRefreshInterval", v))
            .orElse(null));
  }

  /**
   * Parses a duration in one of the accepted notations.
   *
   * @param key configuration key, used in the error message
   * @param value text to parse
   * @return the duration
   * @throws IllegalArgumentException if the value is not a duration
   */
  static Duration parseDuration(final String key, final String value) {
    final var text = value.trim().toLowerCase(Locale.ROOT);
    try {
      if (text.startsWith("p")) return Duration.parse(text.toUpperCase(Locale.ROOT));
      if (text.endsWith("ms")) return Duration.ofMillis(number(text, 2));
      if (text.endsWith("s")) return Duration.ofSeconds(number(text, 1));
      if (text.endsWith("m")) return Duration.ofMinutes(number(text, 1));
      if (text.endsWith("h")) return Duration.ofHours(number(text, 1));
      return Duration.ofSeconds(Long.parseLong(text));
    } catch (final NumberFormatException | DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid duration for " + key + ": " + value, e);
    }
  }

  private static long number(final String text, final int suffixLength) {
    return Long.parseLong(text.substring(0, text.length() - suffixLength).trim());
  }

  private static boolean parseBoolean(final String key, final String value) {
    final var text = value.trim().toLowerCase(Locale.ROOT);
    if (text.equals("true")) return true;
    if (text.equals("false")) return false;
    throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
  }

  private static Optional<String> lookup(final String key) {
    return Optional.ofNullable(System.getProperty(key))
        .or(() -> Optional.ofNullable(System.getenv(toEnvName(key))))
        .filter(v -> !v.isBlank())
        .map(String::trim);
  }

  static String toEnvName(final String key) {
    return key.replace('.', '_').toUpperCase(Locale.ROOT);
  }

  /** JSON shape accepted by {@link #fromJson(String)}. */
  record ConfigDocument(
      Boolean enabled, String region, String dbUser, String tokenRefreshInterval) {}
}
