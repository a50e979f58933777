/** R2DBC adapter that opens each connection with a fresh RDS IAM token. */
package com.example.rdsiamdatasource.core.reactive;
