package com.example.rdsiamdatasource.core.iam;

import java.util.Objects;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.regions.Region;

/**
 * Credentials resolved for signing RDS IAM tokens. The provider is reusable across refreshes and
 * may itself cache or rotate the underlying AWS credentials.
 *
 * @param region region the token is signed for
 * @param provider AWS credentials provider
 */
public record SigningCredentials(Region region, AwsCredentialsProvider provider) {

  public SigningCredentials {
    Objects.requireNonNull(region, "region");
    Objects.requireNonNull(provider, "provider");
  }
}
