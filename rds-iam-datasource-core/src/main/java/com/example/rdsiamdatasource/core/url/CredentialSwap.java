package com.example.rdsiamdatasource.core.url;

/**
 * Result of {@link ConnectionStringCodec#parseForCredentialSwap(String, String)}.
 *
 * @param endpoint literal {@code host:port} the token must be signed for
 * @param connectionString connection string with the password removed
 * @param username effective database username, or {@code null} when none is known
 */
public record CredentialSwap(String endpoint, String connectionString, String username) {}
