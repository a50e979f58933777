package com.example;

import static java.lang.System.Logger.Level.INFO;

import com.example.rdsiamdatasource.core.iam.CredentialResolver;
import com.example.rdsiamdatasource.core.iam.PreparedConnection;
import com.example.rdsiamdatasource.core.iam.RdsIamAuthentication;
import com.example.rdsiamdatasource.core.iam.RdsIamAuthenticator;
import com.example.rdsiamdatasource.core.iam.RdsIamConfig;
import com.example.rdsiamdatasource.core.iam.RdsIamConfigLoader;
import com.example.rdsiamdatasource.core.iam.TokenSigner;
import com.example.rdsiamdatasource.core.jdbc.RdsIamDataSource;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.SQLException;

/** Demo application querying a database through a HikariCP pool authenticated with RDS IAM. */
public class App {
  private final PreparedConnection prepared;
  private final HikariDataSource pool;

  /**
   * Constructs the application with the AWS SDK credential chain and token signer.
   *
   * @param connectionString {@code postgres://user@host:port/db} connection string
   * @param config RDS IAM configuration
   * @throws SQLException if no PostgreSQL driver is registered
   */
  public App(final String connectionString, final RdsIamConfig config) throws SQLException {
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
   * @throws SQLException if no PostgreSQL driver is registered
   */
  public App(
      final String connectionString,
      final RdsIamConfig config,
      final CredentialResolver credentialResolver,
      final TokenSigner tokenSigner)
      throws SQLException {
    this.prepared =
        RdsIamAuthentication.build(connectionString, config, credentialResolver, tokenSigner);
    this.pool =
        prepared.iamEnabled()
            ? Pool.hikariDataSource(
                RdsIamDataSource.forDriver("postgres", prepared.authenticator()))
            : Pool.hikariDataSource(prepared.connectionString());
  }

  /**
   * Entry point. Reads the connection string from the first argument or {@code DATABASE_URL} and
   * the RDS IAM settings from system properties and environment, then prints the DB time.
   *
   * @param args optional connection string
   * @throws Exception on unexpected failures
   */
  public static void main(String[] args) throws Exception {
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
   * Queries the database for the current time.
   *
   * @return the time string returned by the database
   * @throws SQLException if the query fails
   */
  public String getString() throws SQLException {
    try (final var conn = pool.getConnection();
        final var stmt = conn.createStatement();
        final var rs = stmt.executeQuery("SELECT NOW()")) {
      rs.next();
      return rs.getString(1);
    }
  }

  /** Closes every pooled connection so the next borrow opens a new one with a current token. */
  public void evictConnections() {
    pool.getHikariPoolMXBean().softEvictConnections();
  }

  public HikariDataSource pool() {
    return pool;
  }

  /** Closes the pool and stops the authenticator. */
  public void shutdown() {
    pool.close();
    prepared.authenticatorIfEnabled().ifPresent(RdsIamAuthenticator::close);
  }
}
