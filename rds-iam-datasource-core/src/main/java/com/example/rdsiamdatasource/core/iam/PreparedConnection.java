package com.example.rdsiamdatasource.core.iam;

import java.util.Optional;

/**
 * Result of {@link RdsIamAuthentication#build(String, RdsIamConfig)}.
 *
 * @param connectionString connection string to hand to the database layer; the original string
 *     when IAM authentication is disabled
 * @param authenticator handle that keeps the token fresh, {@code null} when disabled
 */
public record PreparedConnection(String connectionString, RdsIamAuthenticator authenticator) {

  public boolean iamEnabled() {
    return authenticator != null;
  }

  public Optional<RdsIamAuthenticator> authenticatorIfEnabled() {
    return Optional.ofNullable(authenticator);
  }

  @Override
  public String toString() {
    return "PreparedConnection[iamEnabled=" + iamEnabled() + "]";
  }
}
