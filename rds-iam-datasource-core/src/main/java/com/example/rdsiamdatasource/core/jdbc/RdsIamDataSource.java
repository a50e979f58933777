package com.example.rdsiamdatasource.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.TRACE;

import com.example.rdsiamdatasource.core.RdsIamException;
import com.example.rdsiamdatasource.core.iam.RdsIamAuthenticator;
import com.example.rdsiamdatasource.core.url.ConnectionDescriptor;
import com.example.rdsiamdatasource.core.url.ConnectionStringCodec;
import com.example.rdsiamdatasource.core.url.Scheme;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Objects;
import java.util.Properties;
import javax.sql.DataSource;

/**
 * DataSource that opens every physical connection with a currently valid RDS IAM token.
 *
 * <p>Each {@link #getConnection()} asks the {@link RdsIamAuthenticator} for a fresh connection
 * string right before dialing, so connections opened long after the pool was created (scale-up,
 * eviction, max-lifetime replacement) never use an expired token. Nothing is cached between opens.
 *
 * <h2>HikariCP</h2>
 *
 * <pre>{@code
 * var prepared = RdsIamAuthentication.build(connectionString, config);
 * var hikariConfig = new HikariConfig();
 * hikariConfig.setDataSource(RdsIamDataSource.forDriver("postgres", prepared.authenticator()));
 * hikariConfig.setMaxLifetime(Duration.ofMinutes(10).toMillis());
 * var pool = new HikariDataSource(hikariConfig);
 * }</pre>
 */
public final class RdsIamDataSource implements DataSource {

  private static final System.Logger logger = System.getLogger(RdsIamDataSource.class.getName());

  private final RdsIamAuthenticator authenticator;
  private final Driver driver;

  private volatile PrintWriter logWriter;
  private volatile int loginTimeout;

  /**
   * Creates a DataSource that dials through {@code driver}.
   *
   * @param authenticator token holder for the target database
   * @param driver JDBC driver used to open physical connections
   */
  public RdsIamDataSource(final RdsIamAuthenticator authenticator, final Driver driver) {
    this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
    this.driver = Objects.requireNonNull(driver, "driver");
  }

  /**
   * Binds an authenticator to the JDBC driver registered for {@code driverName}.
   *
   * @param driverName {@code postgres}, {@code postgresql} or {@code mysql}
   * @param authenticator token holder for the target database
   * @return DataSource for a connection pool
   * @throws SQLException if the name is unknown or no matching driver is registered
   */
  public static RdsIamDataSource forDriver(
      final String driverName, final RdsIamAuthenticator authenticator) throws SQLException {
    final var scheme =
        Scheme.forDriverName(driverName)
            .orElseThrow(
                () ->
                    new SQLException(
                        "Unsupported driver name for RDS IAM authentication: "
                            + driverName
                            + " (expected postgres or mysql)"));
    final var driver =
        DriverManager.getDriver("jdbc:" + scheme.jdbcSubprotocol() + "://localhost/");
    return new RdsIamDataSource(authenticator, driver);
  }

  @Override
  public Connection getConnection() throws SQLException {
    final ConnectionDescriptor descriptor;
    try {
      final var connectionString = authenticator.getCurrentConnectionString();
      logger.log(TRACE, "Opening connection with {0}", connectionString);
      descriptor = ConnectionStringCodec.parse(connectionString);
    } catch (final RdsIamException e) {
      throw new SQLException(
          "Failed to obtain RDS IAM credentials for " + authenticator.endpoint(), "08001", e);
    }

    final var url = descriptor.jdbcUrl();
    final var properties = new Properties();
    if (descriptor.username() != null) properties.setProperty("user", descriptor.username());
    if (descriptor.password() != null) properties.setProperty("password", descriptor.password());

    logger.log(DEBUG, "Opening RDS IAM authenticated connection to {0}", url);
    final var connection = driver.connect(url, properties);
    if (connection == null)
      throw new SQLException(
          "Driver " + driver.getClass().getName() + " does not accept " + url, "08001");
    return connection;
  }

  @Override
  public Connection getConnection(final String username, final String password) {
    throw new UnsupportedOperationException(
        "Credentials are managed by the RDS IAM authenticator");
  }

  /** Stops the authenticator's background refresh, if any. Call when the owning pool shuts down. */
  public void shutdown() {
    authenticator.close();
  }

  public RdsIamAuthenticator authenticator() {
    return authenticator;
  }

  @Override
  public PrintWriter getLogWriter() {
    return logWriter;
  }

  @Override
  public void setLogWriter(final PrintWriter out) {
    this.logWriter = out;
  }

  @Override
  public void setLoginTimeout(final int seconds) {
    this.loginTimeout = seconds;
  }

  @Override
  public int getLoginTimeout() {
    return loginTimeout;
  }

  @Override
  public java.util.logging.Logger getParentLogger() throws SQLFeatureNotSupportedException {
    throw new SQLFeatureNotSupportedException("java.util.logging is not used");
  }

  @Override
  public <T> T unwrap(final Class<T> clazz) throws SQLException {
    if (clazz.isInstance(this)) return clazz.cast(this);
    throw new SQLException("Not a wrapper for " + clazz.getName());
  }

  @Override
  public boolean isWrapperFor(final Class<?> iface) {
    return iface.isInstance(this);
  }
}
