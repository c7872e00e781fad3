package io.intellixity.entigen.schema;

import java.util.Objects;

public record ListTypeRef(TypeRef element) implements TypeRef {
  public ListTypeRef {
    Objects.requireNonNull(element, "element");
  }
}
