package com.example.rdsiamdatasource.core;

import java.util.Objects;

/**
 * Raised when a connection string cannot be prepared for RDS IAM authentication or when a token
 * cannot be obtained.
 *
 * <p>Messages name the failing operation and, where known, the endpoint. They never carry a token
 * or a password.
 */
public class RdsIamException extends RuntimeException {

  /** Failure categories. */
  public enum Reason {
    /** The connection string uses a scheme other than {@code postgres://} or {@code mysql://}. */
    UNSUPPORTED_SCHEME(false),
    /** The connection string cannot be parsed, or has no user to authenticate as. */
    MALFORMED_CONNECTION_STRING(false),
    /** AWS credentials for signing could not be resolved. */
    CREDENTIAL_RESOLUTION_FAILED(true),
    /** The authentication token could not be generated. */
    TOKEN_SIGNING_FAILED(true),
    /** A freshly issued token could not be written into the stored connection string. */
    SECRET_INJECTION_FAILED(false),
    /** The calling thread was interrupted while talking to AWS. */
    CANCELLED(true);

    private final boolean transientFailure;

    Reason(final boolean transientFailure) {
      this.transientFailure = transientFailure;
    }

    /**
     * Whether a later attempt may succeed without a configuration change.
     *
     * @return true for transient failures
     */
    public boolean isTransient() {
      return transientFailure;
    }
  }

  private final Reason reason;

  public RdsIamException(final Reason reason, final String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public RdsIamException(final Reason reason, final String message, final Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public Reason reason() {
    return reason;
  }

  public boolean isTransient() {
    return reason.isTransient();
  }
}
