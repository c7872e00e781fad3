package io.intellixity.entigen.surface;

import java.util.List;

public record DtoShape(String name, Role role, List<DtoField> fields) {
  public enum Role { CREATE, UPDATE, RESPONSE, QUERY, PROJECTION }

  public DtoShape {
    fields = fields == null ? List.of() : List.copyOf(fields);
  }
}
