package io.intellixity.entigen.types;

import java.util.Objects;

/**
 * Mapped column type.\n
 *
 * @param name       base SQL type name, e.g. {@code INTEGER} or {@code VARCHAR(255)}
 * @param nullable   whether the column accepts NULL; not part of {@link #render()}
 * @param arrayDepth number of array dimensions
 */
public record SqlType(String name, boolean nullable, int arrayDepth) {
  public SqlType {
    Objects.requireNonNull(name, "name");
    if (arrayDepth < 0) throw new IllegalArgumentException("arrayDepth < 0: " + arrayDepth);
  }

  public boolean isArray() {
    return arrayDepth > 0;
  }

  /** Type name followed by one {@code []} per array dimension. */
  public String render() {
    return name + "[]".repeat(arrayDepth);
  }
}
