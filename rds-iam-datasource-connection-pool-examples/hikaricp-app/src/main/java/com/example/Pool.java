package com.example;

import com.example.rdsiamdatasource.core.jdbc.RdsIamDataSource;
import com.example.rdsiamdatasource.core.url.ConnectionStringCodec;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Duration;

public class Pool {

  /** RDS IAM tokens expire after 15 minutes; connections are replaced well before that. */
  static final Duration MAX_LIFETIME = Duration.ofMinutes(10);

  /** HikariCP pool whose physical connections are opened with a fresh IAM token. */
  public static HikariDataSource hikariDataSource(final RdsIamDataSource dataSource) {
    final var config = new HikariConfig();
    config.setPoolName("rds-iam-" + dataSource.authenticator().endpoint());
    config.setDataSource(dataSource);
    config.setMaximumPoolSize(10);
    config.setMaxLifetime(MAX_LIFETIME.toMillis());
    return new HikariDataSource(config);
  }

  /** HikariCP pool using the static password of a postgres:// connection string. */
  public static HikariDataSource hikariDataSource(final String connectionString) {
    return new HikariDataSource(staticConfig(connectionString));
  }

  static HikariConfig staticConfig(final String connectionString) {
    final var descriptor = ConnectionStringCodec.parse(connectionString);
    final var config = new HikariConfig();
    config.setJdbcUrl(descriptor.jdbcUrl());
    config.setUsername(descriptor.username());
    config.setPassword(descriptor.password());
    config.setMaximumPoolSize(10);
    return config;
  }
}
