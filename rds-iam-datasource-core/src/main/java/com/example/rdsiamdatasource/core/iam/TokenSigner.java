package com.example.rdsiamdatasource.core.iam;

import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.regions.Region;

/** Produces time-limited RDS IAM authentication tokens. */
@FunctionalInterface
public interface TokenSigner {

  /**
   * Generates a token for connecting as {@code dbUser} to {@code endpoint}.
   *
   * @param endpoint literal {@code host:port} the token is bound to
   * @param region AWS region of the database
   * @param dbUser database user
   * @param credentials credentials to sign with
   * @return opaque token, valid for about 15 minutes
   */
  String sign(
      final String endpoint,
      final Region region,
      final String dbUser,
      final AwsCredentialsProvider credentials);

  /**
   * Returns the signer backed by the AWS SDK {@code RdsUtilities}.
   *
   * @return default signer
   */
  static TokenSigner rdsSigner() {
    return new RdsTokenSigner();
  }
}
