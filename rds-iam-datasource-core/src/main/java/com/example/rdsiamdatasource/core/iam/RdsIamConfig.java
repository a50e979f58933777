package com.example.rdsiamdatasource.core.iam;

import java.time.Duration;

/**
 * Settings for AWS RDS IAM authentication of one database target.
 *
 * <p>A {@code null} or zero {@code tokenRefreshInterval} resolves to {@link
 * #DEFAULT_TOKEN_REFRESH_INTERVAL}. RDS tokens are valid for 15 minutes, so the default leaves one
 * minute of margin.
 *
 * <pre>{@code
 * var config = RdsIamConfig.builder()
 *     .enabled(true)
 *     .region("eu-west-1")
 *     .dbUser("iam_user")
 *     .build();
 * }</pre>
 *
 * @param enabled whether to replace the password with an IAM token
 * @param region AWS region of the instance; blank means "use the SDK default region"
 * @param dbUser database user to authenticate as; blank means "use the user in the connection
 *     string"
 * @param tokenRefreshInterval age after which a cached token is refreshed
 */
public record RdsIamConfig(
    boolean enabled, String region, String dbUser, Duration tokenRefreshInterval) {

  public static final Duration DEFAULT_TOKEN_REFRESH_INTERVAL = Duration.ofMinutes(14);

  public RdsIamConfig {
    region = region == null ? "" : region.trim();
    dbUser = dbUser == null ? "" : dbUser.trim();
    if (tokenRefreshInterval == null || tokenRefreshInterval.isZero())
      tokenRefreshInterval = DEFAULT_TOKEN_REFRESH_INTERVAL;
    if (tokenRefreshInterval.isNegative())
      throw new IllegalArgumentException("tokenRefreshInterval must be non-negative");
  }

  /** A configuration with IAM authentication switched off. */
  public static RdsIamConfig disabled() {
    return new RdsIamConfig(false, "", "", null);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Fluent builder for {@link RdsIamConfig}. */
  public static class Builder {
    private boolean enabled;
    private String region = "";
    private String dbUser = "";
    private Duration tokenRefreshInterval = DEFAULT_TOKEN_REFRESH_INTERVAL;

    private Builder() {}

    public Builder enabled(final boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder region(final String region) {
      this.region = region;
      return this;
    }

    public Builder dbUser(final String dbUser) {
      this.dbUser = dbUser;
      return this;
    }

    /**
     * Sets how old a token may get before it is refreshed.
     *
     * <p>Default: 14 minutes. Zero also means the default.
     *
     * @param tokenRefreshInterval refresh interval, must not be negative
     * @return this builder
     */
    public Builder tokenRefreshInterval(final Duration tokenRefreshInterval) {
      this.tokenRefreshInterval = tokenRefreshInterval;
      return this;
    }

    public RdsIamConfig build() {
      return new RdsIamConfig(enabled, region, dbUser, tokenRefreshInterval);
    }
  }
}
