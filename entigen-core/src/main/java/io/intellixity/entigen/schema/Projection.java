package io.intellixity.entigen.schema;

import java.util.List;

/** Named read-only subset of an entity's fields. */
public record Projection(String name, List<String> fields) {
  public Projection {
    fields = fields == null ? List.of() : List.copyOf(fields);
  }
}
