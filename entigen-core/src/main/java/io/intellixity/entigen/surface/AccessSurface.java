package io.intellixity.entigen.surface;

import io.intellixity.entigen.schema.SqlLevel;

import java.util.List;

/** Typed CRUD surface of one entity: its DTO shapes and repository operations. */
public record AccessSurface(
    String entity,
    String repository,
    String errorKind,
    SqlLevel sqlLevel,
    List<DtoShape> dtos,
    List<OperationSignature> operations
) {
  public AccessSurface {
    dtos = dtos == null ? List.of() : List.copyOf(dtos);
    operations = operations == null ? List.of() : List.copyOf(operations);
  }

  public OperationSignature operation(String name) {
    for (OperationSignature op : operations) {
      if (op.name().equals(name)) return op;
    }
    return null;
  }

  public DtoShape dto(DtoShape.Role role) {
    for (DtoShape dto : dtos) {
      if (dto.role() == role) return dto;
    }
    return null;
  }
}
