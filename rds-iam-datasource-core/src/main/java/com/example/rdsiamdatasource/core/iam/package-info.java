/**
 * RDS IAM token lifecycle: configuration, AWS credential resolution, token signing and the
 * authenticator that caches tokens.
 *
 * <p>{@link com.example.rdsiamdatasource.core.iam.CredentialResolver} and {@link
 * com.example.rdsiamdatasource.core.iam.TokenSigner} are the seams to AWS. Replace them to run
 * without network access.
 */
package com.example.rdsiamdatasource.core.iam;
