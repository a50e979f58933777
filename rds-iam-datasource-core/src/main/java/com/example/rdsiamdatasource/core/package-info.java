/**
 * Root package for the rds-iam-datasource library.
 *
 * <p>The library replaces the static password of a {@code postgres://} or {@code mysql://}
 * connection string with a short-lived AWS RDS IAM token and keeps that token fresh for every new
 * physical connection a pool opens.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.rdsiamdatasource.core.RdsIamException} – the single failure type, with a
 *       {@link com.example.rdsiamdatasource.core.RdsIamException.Reason Reason} per failure mode.
 *   <li>{@link com.example.rdsiamdatasource.core.url.ConnectionStringCodec} – parses connection
 *       strings and rewrites their credentials.
 *   <li>{@link com.example.rdsiamdatasource.core.iam.RdsIamConfig} and {@link
 *       com.example.rdsiamdatasource.core.iam.RdsIamConfigLoader} – feature configuration.
 *   <li>{@link com.example.rdsiamdatasource.core.iam.RdsIamAuthenticator} – holds the current token
 *       and refreshes it when stale.
 *   <li>{@link com.example.rdsiamdatasource.core.iam.RdsIamAuthentication} – entry point that
 *       prepares a connection string and fetches the first token.
 *   <li>{@link com.example.rdsiamdatasource.core.jdbc.RdsIamDataSource} – JDBC DataSource for
 *       connection pools.
 *   <li>{@link com.example.rdsiamdatasource.core.reactive.RdsIamConnectionFactory} – R2DBC
 *       ConnectionFactory for reactive pools.
 * </ul>
 */
package com.example.rdsiamdatasource.core;
