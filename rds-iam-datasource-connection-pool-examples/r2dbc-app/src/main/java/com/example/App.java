package com.example;

import static java.lang.System.Logger.Level.INFO;

import com.example.rdsiamdatasource.core.iam.CredentialResolver;
import com.example.rdsiamdatasource.core.iam.PreparedConnection;
import com.example.rdsiamdatasource.core.iam.RdsIamAuthentication;
import com.example.rdsiamdatasource.core.iam.RdsIamAuthenticator;
import com.example.rdsiamdatasource.core.iam.RdsIamConfig;
import com.example.rdsiamdatasource.core.iam.RdsIamConfigLoader;
import com.example.rdsiamdatasource.core.iam.TokenSigner;
import com.example.rdsiamdatasource.core.reactive.RdsIamConnectionFactory;
import io.r2dbc.pool.ConnectionPool;
import java.time.Duration;
import reactor.core.publisher.Mono;

/** Demo application querying a database through an r2dbc-pool authenticated with RDS IAM. */
public class App {
  private final PreparedConnection prepared;
  private final ConnectionPool pool;

  /**
   * Constructs the application with the AWS SDK credential chain and token signer.
   *
   * @param connectionString {@code postgres://user@host:port/db} connection string
   * @param config RDS IAM configuration
   */
  public App(final String connectionString, final RdsIamConfig config) {
    this(
        connectionString, config, CredentialResolver.defaultResolver(), TokenSigner.rdsSigner());
  }

  /**
   * Constructs the application with explicit AWS collaborators.
   *
   * @param connectionString {@code postgres://user@host:port/db} connection string
   * @param config RDS IAM configuration
   * @param credentialResolver resolver for signing credentials
   * @param tokenSigner token signer
   */
  public App(
      final String connectionString,
      final RdsIamConfig config,
      final CredentialResolver credentialResolver,
      final TokenSigner tokenSigner) {
    this(connectionString, config, credentialResolver, tokenSigner, Pool.MAX_LIFETIME);
  }

  App(
      final String connectionString,
      final RdsIamConfig config,
      final CredentialResolver credentialResolver,
      final TokenSigner tokenSigner,
      final Duration maxLifeTime) {
    this.prepared =
        RdsIamAuthentication.build(connectionString, config, credentialResolver, tokenSigner);
    this.pool =
        Pool.r2dbcPool(
            prepared.iamEnabled()
                ? RdsIamConnectionFactory.forDriver("postgres", prepared.authenticator())
                : Pool.staticConnectionFactory(prepared.connectionString()),
            maxLifeTime);
  }

  /**
   * Entry point. Reads the connection string from the first argument or {@code DATABASE_URL} and
   * the RDS IAM settings from system properties and environment, then prints the DB time.
   *
   * @param args optional connection string
   */
  public static void main(String[] args) {
    final var logger = System.getLogger(App.class.getName());

    final var connectionString = args.length > 0 ? args[0] : System.getenv("DATABASE_URL");
    if (connectionString == null || connectionString.isBlank())
      throw new IllegalArgumentException("Pass a connection string or set DATABASE_URL");

    final var app = new App(connectionString, RdsIamConfigLoader.fromSystem());
    try {
      logger.log(INFO, "DB Time = {0}", app.getString());
    } finally {
      app.shutdown();
    }
  }

  /**
   * Queries the database for the current time using the pool.
   *
   * @return the time string returned by the database
   */
  public String getString() {
    return Mono.usingWhen(
            pool.create(),
            conn ->
                Mono.from(conn.createStatement("SELECT CAST(NOW() AS TEXT)").execute())
                    .flatMap(
                        result -> Mono.from(result.map((row, md) -> row.get(0, String.class)))),
            conn -> Mono.from(conn.close()))
        .block();
  }

  /** Disposes the pool and stops the authenticator. */
  public void shutdown() {
    pool.dispose();
    prepared.authenticatorIfEnabled().ifPresent(RdsIamAuthenticator::close);
  }
}
