package com.example.rdsiamdatasource.core.iam;

/** Resolves the AWS credentials used to sign RDS IAM tokens. */
@FunctionalInterface
public interface CredentialResolver {

  /**
   * Resolves signing credentials for a region.
   *
   * @param region configured AWS region; blank means "use the default region"
   * @return region and credentials provider
   */
  SigningCredentials resolve(final String region);

  /**
   * Returns the AWS SDK backed resolver: system properties, environment variables, then the SDK
   * default provider chain.
   *
   * @return default resolver
   */
  static CredentialResolver defaultResolver() {
    return AwsCredentialResolver.INSTANCE;
  }
}
