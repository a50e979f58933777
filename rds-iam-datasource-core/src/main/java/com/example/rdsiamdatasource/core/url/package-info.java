/** Connection-string parsing and credential rewriting. */
package com.example.rdsiamdatasource.core.url;
