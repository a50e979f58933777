/** JDBC adapter that opens each physical connection with a fresh RDS IAM token. */
package com.example.rdsiamdatasource.core.jdbc;
