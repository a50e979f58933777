package com.example;

import com.example.rdsiamdatasource.core.url.Scheme;
import io.r2dbc.pool.ConnectionPool;
import io.r2dbc.pool.ConnectionPoolConfiguration;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import java.time.Duration;

public class Pool {

  /** RDS IAM tokens expire after 15 minutes; connections are replaced well before that. */
  static final Duration MAX_LIFETIME = Duration.ofMinutes(10);

  /** r2dbc ConnectionPool over a connection factory, typically an RdsIamConnectionFactory. */
  public static ConnectionPool r2dbcPool(final ConnectionFactory connectionFactory) {
    return r2dbcPool(connectionFactory, MAX_LIFETIME);
  }

  static ConnectionPool r2dbcPool(
      final ConnectionFactory connectionFactory, final Duration maxLifeTime) {
    final var poolConfig =
        ConnectionPoolConfiguration.builder(connectionFactory)
            .initialSize(2)
            .maxSize(10)
            .maxLifeTime(maxLifeTime)
            .maxIdleTime(Duration.ofMinutes(5))
            .maxAcquireTime(Duration.ofSeconds(3))
            .build();
    return new ConnectionPool(poolConfig);
  }

  /** ConnectionFactory using the static password of a postgres:// connection string. */
  public static ConnectionFactory staticConnectionFactory(final String connectionString) {
    final var scheme =
        Scheme.of(connectionString)
            .orElseThrow(() -> new IllegalArgumentException("Unsupported connection string"));
    return ConnectionFactories.get(
        "r2dbc:" + scheme.r2dbcDriver() + connectionString.substring(scheme.prefix().length()));
  }
}
