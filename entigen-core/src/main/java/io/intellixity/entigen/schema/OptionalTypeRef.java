package io.intellixity.entigen.schema;

import java.util.Objects;

public record OptionalTypeRef(TypeRef inner) implements TypeRef {
  public OptionalTypeRef {
    Objects.requireNonNull(inner, "inner");
  }
}
