package com.example.rdsiamdatasource.core.url;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/** Connection-string schemes that can authenticate with RDS IAM tokens. */
public enum Scheme {
  POSTGRES("postgres", 5432, "postgresql", "postgresql"),
  MYSQL("mysql", 3306, "mysql", "mysql");

  private final String prefix;
  private final int defaultPort;
  private final String jdbcSubprotocol;
  private final String r2dbcDriver;

  Scheme(
      final String prefix,
      final int defaultPort,
      final String jdbcSubprotocol,
      final String r2dbcDriver) {
    this.prefix = prefix;
    this.defaultPort = defaultPort;
    this.jdbcSubprotocol = jdbcSubprotocol;
    this.r2dbcDriver = r2dbcDriver;
  }

  /** Scheme name as it appears before {@code ://}. */
  public String prefix() {
    return prefix;
  }

  public int defaultPort() {
    return defaultPort;
  }

  /** Sub-protocol used in {@code jdbc:<subprotocol>://} URLs. */
  public String jdbcSubprotocol() {
    return jdbcSubprotocol;
  }

  /** Value of the R2DBC {@code driver} option. */
  public String r2dbcDriver() {
    return r2dbcDriver;
  }

  /**
   * Finds the scheme a raw connection string starts with.
   *
   * @param connectionString raw connection string
   * @return the matching scheme, or empty when the string uses another scheme
   */
  public static Optional<Scheme> of(final String connectionString) {
    if (connectionString == null) return Optional.empty();
    return Arrays.stream(values())
        .filter(s -> connectionString.startsWith(s.prefix + "://"))
        .findFirst();
  }

  /**
   * Resolves a driver name such as {@code postgres}, {@code postgresql} or {@code mysql}.
   *
   * @param driverName driver name, case-insensitive
   * @return the matching scheme, or empty if the name is unknown
   */
  public static Optional<Scheme> forDriverName(final String driverName) {
    if (driverName == null) return Optional.empty();
    final var name = driverName.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(s -> s.prefix.equals(name) || s.jdbcSubprotocol.equals(name))
        .findFirst();
  }

  /** Human-readable list of accepted prefixes, e.g. {@code postgres:// and mysql://}. */
  static String supportedPrefixes() {
    return Arrays.stream(values())
        .map(s -> s.prefix + "://")
        .collect(Collectors.joining(" and "));
  }
}
