package com.example.rdsiamdatasource.core.iam;

import static com.example.rdsiamdatasource.core.RdsIamException.Reason.MALFORMED_CONNECTION_STRING;
import static java.lang.System.Logger.Level.INFO;

import com.example.rdsiamdatasource.core.RdsIamException;
import com.example.rdsiamdatasource.core.url.ConnectionStringCodec;
import com.example.rdsiamdatasource.core.url.Scheme;
import java.util.Objects;

/**
 * Entry point that prepares a connection string for AWS RDS IAM authentication.
 *
 * <pre>{@code
 * var prepared = RdsIamAuthentication.build(connectionString, RdsIamConfigLoader.fromSystem());
 * if (prepared.iamEnabled()) {
 *   var dataSource = RdsIamDataSource.forDriver("postgres", prepared.authenticator());
 *   // hand dataSource to the pool
 * }
 * }</pre>
 */
public final class RdsIamAuthentication {

  private static final System.Logger logger =
      System.getLogger(RdsIamAuthentication.class.getName());

  private RdsIamAuthentication() {}

  /**
   * Prepares a connection string using the AWS SDK collaborators.
   *
   * @param connectionString raw {@code postgres://} or {@code mysql://} connection string
   * @param config feature configuration
   * @return rewritten connection string and authenticator handle
   * @see #build(String, RdsIamConfig, CredentialResolver, TokenSigner)
   */
  public static PreparedConnection build(final String connectionString, final RdsIamConfig config) {
    return build(
        connectionString, config, CredentialResolver.defaultResolver(), TokenSigner.rdsSigner());
  }

  /**
   * Prepares a connection string for IAM authentication.
   *
   * <p>When the feature is disabled the string is returned unchanged with no authenticator and no
   * AWS call is made. Otherwise the password is stripped, an initial token is fetched
   * synchronously and injected, and the authenticator is returned for use by a connector adapter.
   *
   * @param connectionString raw {@code postgres://} or {@code mysql://} connection string
   * @param config feature configuration
   * @param credentialResolver resolver for signing credentials
   * @param tokenSigner token signer
   * @return rewritten connection string and authenticator handle
   * @throws RdsIamException if the string is not supported, has no user, or the first token cannot
   *     be obtained
   */
  public static PreparedConnection build(
      final String connectionString,
      final RdsIamConfig config,
      final CredentialResolver credentialResolver,
      final TokenSigner tokenSigner) {
    Objects.requireNonNull(config, "config");
    if (!config.enabled()) return new PreparedConnection(connectionString, null);

    final var swap =
        ConnectionStringCodec.parseForCredentialSwap(connectionString, config.dbUser());
    if (swap.username() == null || swap.username().isBlank())
      throw new RdsIamException(
          MALFORMED_CONNECTION_STRING,
          "RDS IAM authentication needs a database user: set dbUser or put a user in the"
              + " connection string");

    final var authenticator =
        RdsIamAuthenticator.builder()
            .config(config)
            .endpoint(swap.endpoint())
            .dbUser(swap.username())
            .baseConnectionString(swap.connectionString())
            .credentialResolver(credentialResolver)
            .tokenSigner(tokenSigner)
            .build();

    final String rewritten;
    try {
      authenticator.refresh();
      rewritten = authenticator.getCurrentConnectionString();
    } catch (final RdsIamException e) {
      authenticator.close();
      throw new RdsIamException(
          e.reason(), "Failed to generate initial RDS IAM token for " + swap.endpoint(), e);
    }

    logger.log(
        INFO,
        "AWS RDS IAM authentication enabled for {0} database at {1}",
        Scheme.of(swap.connectionString()).map(Scheme::prefix).orElse("unknown"),
        swap.endpoint());

    return new PreparedConnection(rewritten, authenticator);
  }
}
