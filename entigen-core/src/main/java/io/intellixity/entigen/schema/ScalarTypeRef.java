package io.intellixity.entigen.schema;

import java.util.Objects;

public record ScalarTypeRef(String scalarId) implements TypeRef {
  public ScalarTypeRef {
    Objects.requireNonNull(scalarId, "scalarId");
    if (scalarId.isBlank()) throw new IllegalArgumentException("scalarId is blank");
  }

  public boolean isKnown() {
    return ScalarIds.isKnown(scalarId);
  }
}
