package com.example.rdsiamdatasource.core.reactive;

import static io.r2dbc.spi.ConnectionFactoryOptions.DATABASE;
import static io.r2dbc.spi.ConnectionFactoryOptions.DRIVER;
import static io.r2dbc.spi.ConnectionFactoryOptions.HOST;
import static io.r2dbc.spi.ConnectionFactoryOptions.PASSWORD;
import static io.r2dbc.spi.ConnectionFactoryOptions.PORT;
import static io.r2dbc.spi.ConnectionFactoryOptions.USER;
import static java.lang.System.Logger.Level.DEBUG;

import com.example.rdsiamdatasource.core.iam.RdsIamAuthenticator;
import com.example.rdsiamdatasource.core.url.ConnectionDescriptor;
import com.example.rdsiamdatasource.core.url.ConnectionStringCodec;
import com.example.rdsiamdatasource.core.url.Scheme;
import io.r2dbc.spi.Connection;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.ConnectionFactoryMetadata;
import io.r2dbc.spi.ConnectionFactoryOptions;
import io.r2dbc.spi.Option;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * R2DBC ConnectionFactory that opens every connection with a currently valid RDS IAM token,
 * mirroring {@link com.example.rdsiamdatasource.core.jdbc.RdsIamDataSource} for reactive pools.
 *
 * <p>The token is looked up on {@link Schedulers#boundedElastic()} because a refresh may block on
 * AWS. Cancelling the subscription abandons the open.
 *
 * <pre>{@code
 * var connectionFactory = RdsIamConnectionFactory.forDriver("postgres", prepared.authenticator());
 * var pool = new ConnectionPool(ConnectionPoolConfiguration.builder(connectionFactory)
 *     .maxLifetime(Duration.ofMinutes(10))
 *     .build());
 * }</pre>
 */
public final class RdsIamConnectionFactory implements ConnectionFactory {

  private static final System.Logger logger =
      System.getLogger(RdsIamConnectionFactory.class.getName());

  private static final Set<String> RESERVED_OPTIONS =
      Set.of("driver", "host", "port", "database", "user", "password");

  private final RdsIamAuthenticator authenticator;
  private final String driver;
  private final Function<ConnectionFactoryOptions, ConnectionFactory> driverLookup;

  /**
   * Creates a factory for the driver matching the authenticator's connection-string scheme.
   *
   * @param authenticator token holder for the target database
   */
  public RdsIamConnectionFactory(final RdsIamAuthenticator authenticator) {
    this(
        authenticator,
        ConnectionStringCodec.parse(authenticator.baseConnectionString()).scheme().r2dbcDriver(),
        ConnectionFactories::get);
  }

  RdsIamConnectionFactory(
      final RdsIamAuthenticator authenticator,
      final String driver,
      final Function<ConnectionFactoryOptions, ConnectionFactory> driverLookup) {
    this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
    this.driver = Objects.requireNonNull(driver, "driver");
    this.driverLookup = Objects.requireNonNull(driverLookup, "driverLookup");
  }

  /**
   * Binds an authenticator to the R2DBC driver for {@code driverName}.
   *
   * @param driverName {@code postgres}, {@code postgresql} or {@code mysql}
   * @param authenticator token holder for the target database
   * @return ConnectionFactory for a connection pool
   * @throws IllegalArgumentException if the driver name is unknown
   */
  public static RdsIamConnectionFactory forDriver(
      final String driverName, final RdsIamAuthenticator authenticator) {
    final var scheme =
        Scheme.forDriverName(driverName)
            .orElseThrow(
                () ->
                    new IllegalArgumentException(
                        "Unsupported driver name for RDS IAM authentication: "
                            + driverName
                            + " (expected postgres or mysql)"));
    return new RdsIamConnectionFactory(
        authenticator, scheme.r2dbcDriver(), ConnectionFactories::get);
  }

  /**
   * Looks up a fresh token, then opens a connection through the underlying driver.
   *
   * @return a Mono emitting the new Connection, or an error if the token cannot be obtained
   */
  @Override
  public Mono<Connection> create() {
    return Mono.fromCallable(authenticator::getCurrentConnectionString)
        .subscribeOn(Schedulers.boundedElastic())
        .map(
            connectionString -> {
              logger.log(
                  DEBUG,
                  "Opening RDS IAM authenticated {0} connection: {1}",
                  driver,
                  ConnectionStringCodec.redact(connectionString));
              return toOptions(ConnectionStringCodec.parse(connectionString));
            })
        .flatMap(options -> Mono.<Connection>from(driverLookup.apply(options).create()));
  }

  @Override
  public ConnectionFactoryMetadata getMetadata() {
    return () -> "RDS IAM (" + driver + ")";
  }

  /** Stops the authenticator's background refresh, if any. */
  public Mono<Void> shutdown() {
    return Mono.fromRunnable(authenticator::close);
  }

  ConnectionFactoryOptions toOptions(final ConnectionDescriptor descriptor) {
    final var builder =
        ConnectionFactoryOptions.builder()
            .option(DRIVER, driver)
            .option(HOST, descriptor.host())
            .option(PORT, descriptor.effectivePort());
    descriptor.database().ifPresent(database -> builder.option(DATABASE, database));
    if (descriptor.username() != null) builder.option(USER, descriptor.username());
    if (descriptor.password() != null) builder.option(PASSWORD, descriptor.password());

    for (final var parameter : descriptor.query()) {
      final var name = URLDecoder.decode(parameter.name(), StandardCharsets.UTF_8);
      if (name.isEmpty() || RESERVED_OPTIONS.contains(name)) continue;
      final var value =
          parameter.value() == null
              ? ""
              : URLDecoder.decode(parameter.value(), StandardCharsets.UTF_8);
      builder.option(Option.valueOf(name), value);
    }
    return builder.build();
  }
}
