package com.example.rdsiamdatasource.core.url;

import java.util.Objects;

/**
 * A single query parameter, kept exactly as written (still percent-encoded).
 *
 * @param name raw parameter name
 * @param value raw parameter value, or {@code null} when the parameter has no {@code =}
 */
public record QueryParameter(String name, String value) {

  public QueryParameter {
    Objects.requireNonNull(name, "name");
  }

  /** Raw {@code name=value} form as it appears in the connection string. */
  public String format() {
    return value == null ? name : name + "=" + value;
  }
}
