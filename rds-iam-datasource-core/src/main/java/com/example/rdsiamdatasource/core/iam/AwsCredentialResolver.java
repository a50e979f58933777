package com.example.rdsiamdatasource.core.iam;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.regions.providers.DefaultAwsRegionProviderChain;

/**
 * {@link CredentialResolver} backed by the AWS SDK.
 *
 * <p>Region: the configured value, else {@code aws.region} / {@code AWS_REGION}, else the SDK
 * {@link DefaultAwsRegionProviderChain}.
 *
 * <p>Credentials: {@code aws.accessKeyId} / {@code AWS_ACCESS_KEY_ID} together with {@code
 * aws.secretAccessKey} / {@code AWS_SECRET_ACCESS_KEY} when both are set, else {@link
 * DefaultCredentialsProvider} (environment, profile file, web identity, container and instance
 * metadata, in the SDK's order).
 *
 * <p>Providers are built once per region and reused, so the SDK can cache instance or container
 * credentials between refreshes.
 */
public final class AwsCredentialResolver implements CredentialResolver {

  static final AwsCredentialResolver INSTANCE = new AwsCredentialResolver();

  private static final System.Logger logger =
      System.getLogger(AwsCredentialResolver.class.getName());

  private final ConcurrentHashMap<Region, AwsCredentialsProvider> providers =
      new ConcurrentHashMap<>();

  AwsCredentialResolver() {}

  @Override
  public SigningCredentials resolve(final String region) {
    final var resolvedRegion = resolveRegion(region);
    final var provider = providers.computeIfAbsent(resolvedRegion, r -> buildProvider());
    return new SigningCredentials(resolvedRegion, provider);
  }

  /** Closes cached providers; the next {@link #resolve(String)} builds new ones. */
  public synchronized void reset() {
    providers
        .values()
        .forEach(
            p -> {
              if (p instanceof AutoCloseable closeable) {
                try {
                  closeable.close();
                } catch (final Exception e) {
                  logger.log(WARNING, "Failed to close AWS credentials provider", e);
                }
              }
            });
    providers.clear();
  }

  static Region resolveRegion(final String configured) {
    return Optional.ofNullable(configured)
        .filter(r -> !r.isBlank())
        .or(() -> Optional.ofNullable(System.getProperty("aws.region")))
        .or(() -> Optional.ofNullable(System.getenv("AWS_REGION")))
        .filter(r -> !r.isBlank())
        .map(String::trim)
        .map(Region::of)
        .orElseGet(() -> new DefaultAwsRegionProviderChain().getRegion());
  }

  private static AwsCredentialsProvider buildProvider() {
    return Optional.ofNullable(
            System.getProperty("aws.accessKeyId", System.getenv("AWS_ACCESS_KEY_ID")))
        .flatMap(
            accessKey ->
                Optional.ofNullable(
                        System.getProperty(
                            "aws.secretAccessKey", System.getenv("AWS_SECRET_ACCESS_KEY")))
                    .map(secretKey -> AwsBasicCredentials.create(accessKey, secretKey)))
        .<AwsCredentialsProvider>map(
            credentials -> {
              logger.log(DEBUG, "Using static AWS credentials for RDS IAM signing");
              return StaticCredentialsProvider.create(credentials);
            })
        .orElseGet(
            () -> {
              logger.log(
                  DEBUG, "Using default AWS credentials provider chain for RDS IAM signing");
              return DefaultCredentialsProvider.builder().build();
            });
  }
}
