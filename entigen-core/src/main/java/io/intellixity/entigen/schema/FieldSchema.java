package io.intellixity.entigen.schema;

import java.util.Objects;

public record FieldSchema(
    String name,
    TypeRef type,
    boolean identity,
    boolean generated,
    Expose expose,
    FilterKind filter,
    ColumnOverrides column,
    RelationSpec relation
) {
  public FieldSchema {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    expose = expose == null ? Expose.NONE : expose;
    filter = filter == null ? FilterKind.NONE : filter;
    column = column == null ? ColumnOverrides.NONE : column;
  }

  public String columnName() {
    return column.columnName() != null ? column.columnName() : name;
  }

  public boolean inCreate() {
    return expose.create() && !expose.skip() && !identity && !generated;
  }

  public boolean inUpdate() {
    return expose.update() && !expose.skip() && !identity && !generated;
  }

  /** The identity field is always part of responses, even when skipped. */
  public boolean inResponse() {
    return identity || (expose.response() && !expose.skip());
  }

  public boolean isFilterable() {
    return filter != FilterKind.NONE;
  }

  public boolean isRelation() {
    return relation != null;
  }
}
