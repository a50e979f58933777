package com.example.rdsiamdatasource.core.iam;

import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.rds.RdsUtilities;

/** {@link TokenSigner} that presigns tokens with the AWS SDK {@link RdsUtilities}. */
public class RdsTokenSigner implements TokenSigner {

  @Override
  public String sign(
      final String endpoint,
      final Region region,
      final String dbUser,
      final AwsCredentialsProvider credentials) {
    final var colon = endpoint.lastIndexOf(':');
    if (colon <= 0 || colon == endpoint.length() - 1)
      throw new IllegalArgumentException("endpoint must be host:port");

    final var hostname = endpoint.substring(0, colon);
    final var port = Integer.parseInt(endpoint.substring(colon + 1));

    final var utilities =
        RdsUtilities.builder().credentialsProvider(credentials).region(region).build();
    return utilities.generateAuthenticationToken(
        builder -> builder.hostname(hostname).port(port).username(dbUser));
  }
}
