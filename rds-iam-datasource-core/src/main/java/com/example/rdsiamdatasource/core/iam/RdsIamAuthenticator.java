package com.example.rdsiamdatasource.core.iam;

import static com.example.rdsiamdatasource.core.RdsIamException.Reason.CANCELLED;
import static com.example.rdsiamdatasource.core.RdsIamException.Reason.CREDENTIAL_RESOLUTION_FAILED;
import static com.example.rdsiamdatasource.core.RdsIamException.Reason.SECRET_INJECTION_FAILED;
import static com.example.rdsiamdatasource.core.RdsIamException.Reason.TOKEN_SIGNING_FAILED;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.TRACE;
import static java.lang.System.Logger.Level.WARNING;

import com.example.rdsiamdatasource.core.RdsIamException;
import com.example.rdsiamdatasource.core.url.ConnectionStringCodec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current RDS IAM token for one database target and hands out connection strings that
 * carry it.
 *
 * <p>Refresh is lazy: {@link #getCurrentConnectionString()} fetches a new token when none exists
 * yet or when the cached one is older than {@link RdsIamConfig#tokenRefreshInterval()}. The caller
 * that finds the token stale pays for the refresh. Concurrent callers may each refresh; the last
 * token written wins, which is harmless because any token inside its validity window works.
 *
 * <p>Token and issue time are replaced together as one value, so no caller can observe a token
 * paired with another token's timestamp.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var authenticator = RdsIamAuthenticator.builder()
 *     .config(config)
 *     .endpoint("mydb.abc.eu-west-1.rds.amazonaws.com:5432")
 *     .dbUser("iam_user")
 *     .baseConnectionString("postgres://iam_user@mydb.abc.eu-west-1.rds.amazonaws.com:5432/app")
 *     .build();
 *
 * var connectionString = authenticator.getCurrentConnectionString();
 * }</pre>
 *
 * <h2>Proactive Refresh</h2>
 *
 * <pre>{@code
 * var authenticator = RdsIamAuthenticator.builder()
 *     // ...
 *     .backgroundRefresh(true)
 *     .build();
 * // ...
 * authenticator.close();
 * }</pre>
 *
 * <p>Interrupting a thread that is refreshing aborts the refresh with {@link
 * RdsIamException.Reason#CANCELLED}; the cached token is left as it was.
 */
public final class RdsIamAuthenticator implements AutoCloseable {

  private static final System.Logger logger = System.getLogger(RdsIamAuthenticator.class.getName());

  private final RdsIamConfig config;
  private final String endpoint;
  private final String dbUser;
  private final String baseConnectionString;
  private final CredentialResolver credentialResolver;
  private final TokenSigner tokenSigner;
  private final Clock clock;

  private final AtomicReference<IssuedToken> current = new AtomicReference<>();

  private ScheduledExecutorService scheduler;

  private RdsIamAuthenticator(final Builder builder) {
    this.config = builder.config;
    this.endpoint = builder.endpoint;
    this.dbUser = builder.dbUser;
    this.baseConnectionString = builder.baseConnectionString;
    this.credentialResolver = builder.credentialResolver;
    this.tokenSigner = builder.tokenSigner;
    this.clock = builder.clock;

    if (builder.backgroundRefresh) {
      final var intervalMillis = config.tokenRefreshInterval().toMillis();
      scheduler =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                final var t = new Thread(r, "RdsIamAuthenticator-" + endpoint);
                t.setDaemon(true);
                return t;
              });
      scheduler.scheduleAtFixedRate(
          this::refreshInBackground, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link RdsIamAuthenticator}. */
  public static class Builder {
    private RdsIamConfig config;
    private String endpoint;
    private String dbUser;
    private String baseConnectionString;
    private CredentialResolver credentialResolver = CredentialResolver.defaultResolver();
    private TokenSigner tokenSigner = TokenSigner.rdsSigner();
    private Clock clock = Clock.systemUTC();
    private boolean backgroundRefresh;

    private Builder() {}

    /**
     * Sets the feature configuration (required).
     *
     * @param config RDS IAM configuration
     * @return this builder
     */
    public Builder config(final RdsIamConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the {@code host:port} the token is signed for (required).
     *
     * @param endpoint literal host and port of the RDS instance
     * @return this builder
     */
    public Builder endpoint(final String endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    /**
     * Sets the database user the token is issued for (required).
     *
     * @param dbUser database user
     * @return this builder
     */
    public Builder dbUser(final String dbUser) {
      this.dbUser = dbUser;
      return this;
    }

    /**
     * Sets the password-less connection string tokens are injected into (required).
     *
     * @param baseConnectionString connection string without password
     * @return this builder
     */
    public Builder baseConnectionString(final String baseConnectionString) {
      this.baseConnectionString = baseConnectionString;
      return this;
    }

    /**
     * Sets the credential resolver.
     *
     * <p>Default: {@link CredentialResolver#defaultResolver()}
     *
     * @param credentialResolver resolver for signing credentials
     * @return this builder
     */
    public Builder credentialResolver(final CredentialResolver credentialResolver) {
      this.credentialResolver = credentialResolver;
      return this;
    }

    /**
     * Sets the token signer.
     *
     * <p>Default: {@link TokenSigner#rdsSigner()}
     *
     * @param tokenSigner signer producing RDS IAM tokens
     * @return this builder
     */
    public Builder tokenSigner(final TokenSigner tokenSigner) {
      this.tokenSigner = tokenSigner;
      return this;
    }

    /**
     * Sets the clock token ages are measured with.
     *
     * <p>Default: {@link Clock#systemUTC()}
     *
     * @param clock time source
     * @return this builder
     */
    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Enables a daemon thread that refreshes the token every refresh interval, so callers rarely
     * find it stale. Lazy refresh stays in place either way.
     *
     * <p>Default: false
     *
     * @param backgroundRefresh whether to refresh proactively
     * @return this builder
     */
    public Builder backgroundRefresh(final boolean backgroundRefresh) {
      this.backgroundRefresh = backgroundRefresh;
      return this;
    }

    /**
     * Builds the authenticator. No token is fetched until the first refresh.
     *
     * @return configured authenticator
     * @throws IllegalStateException if required fields are not set
     */
    public RdsIamAuthenticator build() {
      if (config == null) throw new IllegalStateException("config is required");
      if (endpoint == null || endpoint.isBlank())
        throw new IllegalStateException("endpoint is required");
      if (dbUser == null || dbUser.isBlank()) throw new IllegalStateException("dbUser is required");
      if (baseConnectionString == null || baseConnectionString.isBlank())
        throw new IllegalStateException("baseConnectionString is required");
      if (credentialResolver == null)
        throw new IllegalStateException("credentialResolver cannot be null");
      if (tokenSigner == null) throw new IllegalStateException("tokenSigner cannot be null");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      return new RdsIamAuthenticator(this);
    }
  }

  /**
   * Fetches a new token unconditionally.
   *
   * <p>On failure the previously cached token and refresh time are left untouched.
   *
   * @throws RdsIamException with {@code CREDENTIAL_RESOLUTION_FAILED}, {@code
   *     TOKEN_SIGNING_FAILED} or {@code CANCELLED}
   */
  public void refresh() {
    ensureNotInterrupted("resolving AWS credentials");
    final SigningCredentials credentials;
    try {
      credentials = credentialResolver.resolve(config.region());
    } catch (final RuntimeException e) {
      throw failure(CREDENTIAL_RESOLUTION_FAILED, "Failed to load AWS config", e);
    }

    ensureNotInterrupted("signing RDS IAM token");
    final String token;
    try {
      token = tokenSigner.sign(endpoint, credentials.region(), dbUser, credentials.provider());
    } catch (final RuntimeException e) {
      throw failure(TOKEN_SIGNING_FAILED, "Failed to build auth token", e);
    }
    if (token == null || token.isBlank())
      throw new RdsIamException(
          TOKEN_SIGNING_FAILED, "Token signer returned an empty token for " + endpoint);

    final var issued = new IssuedToken(token, clock.instant());
    current.set(issued);

    logger.log(
        DEBUG,
        "Refreshed RDS IAM token for {0} as {1} at {2}",
        endpoint,
        dbUser,
        issued.issuedAt());
    logger.log(TRACE, "RDS IAM token for {0}: {1}", endpoint, token);
  }

  /**
   * Returns the current token, refreshing it first if it is missing or stale.
   *
   * @return token
   * @throws RdsIamException if a needed refresh fails
   */
  public String getToken() {
    return freshToken().token();
  }

  /**
   * Returns the base connection string carrying a currently usable token as its password,
   * refreshing the token first if it is missing or stale.
   *
   * @return connection string with token
   * @throws RdsIamException if a needed refresh fails, or with {@code SECRET_INJECTION_FAILED} if
   *     the token cannot be written into the connection string
   */
  public String getCurrentConnectionString() {
    final var token = freshToken();
    try {
      return ConnectionStringCodec.injectSecret(baseConnectionString, token.token());
    } catch (final RdsIamException e) {
      throw new RdsIamException(
          SECRET_INJECTION_FAILED,
          "Failed to inject RDS IAM token into connection string for " + endpoint,
          e);
    }
  }

  public RdsIamConfig config() {
    return config;
  }

  public String endpoint() {
    return endpoint;
  }

  public String dbUser() {
    return dbUser;
  }

  /** Password-less connection string tokens are injected into. */
  public String baseConnectionString() {
    return baseConnectionString;
  }

  /** Time of the last successful refresh, empty before the first one. */
  public Optional<Instant> lastRefresh() {
    return Optional.ofNullable(current.get()).map(IssuedToken::issuedAt);
  }

  /** Whether the background refresh thread is running. */
  public boolean isBackgroundRefreshActive() {
    return scheduler != null && !scheduler.isShutdown();
  }

  /** Stops the background refresh thread, if any. The lazy refresh path keeps working. */
  public void shutdown() {
    if (scheduler != null) {
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) scheduler.shutdownNow();
      } catch (final InterruptedException e) {
        scheduler.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  private IssuedToken freshToken() {
    final var token = current.get();
    if (token != null && !isStale(token)) return token;

    if (token != null) logger.log(DEBUG, "RDS IAM token for {0} is stale, refreshing", endpoint);
    try {
      refresh();
    } catch (final RdsIamException e) {
      throw new RdsIamException(
          e.reason(), "Failed to refresh RDS IAM token for " + endpoint, e);
    }
    return current.get();
  }

  private boolean isStale(final IssuedToken token) {
    final var age = Duration.between(token.issuedAt(), clock.instant());
    // a negative age means the wall clock stepped back; the issue time can no longer be trusted
    return age.isNegative() || age.compareTo(config.tokenRefreshInterval()) > 0;
  }

  private void refreshInBackground() {
    try {
      refresh();
    } catch (final Exception e) {
      logger.log(WARNING, "Background RDS IAM token refresh failed for " + endpoint, e);
    }
  }

  private void ensureNotInterrupted(final String operation) {
    if (Thread.currentThread().isInterrupted())
      throw new RdsIamException(CANCELLED, "Interrupted before " + operation + " for " + endpoint);
  }

  private RdsIamException failure(
      final RdsIamException.Reason reason, final String operation, final RuntimeException cause) {
    if (Thread.currentThread().isInterrupted())
      return new RdsIamException(
          CANCELLED, operation + " for " + endpoint + ": interrupted", cause);
    if (cause instanceof RdsIamException rdsIamException) return rdsIamException;
    return new RdsIamException(reason, operation + " for " + endpoint, cause);
  }

  /** A token together with the instant it was issued. */
  private record IssuedToken(String token, Instant issuedAt) {
    @Override
    public String toString() {
      return "IssuedToken[issuedAt=" + issuedAt + "]";
    }
  }
}
