package io.intellixity.entigen.surface;

import io.intellixity.entigen.schema.*;
import io.intellixity.entigen.util.Naming;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the {@link AccessSurface} of an entity.\n
 *
 * Operation presence follows the field sets: no create without create fields, no update without
 * update fields, no query without filters. {@link SqlLevel#NONE} keeps the DTOs and drops the
 * repository.
 */
public final class AccessSurfaceBuilder {
  private static final DtoField LIMIT = new DtoField("limit", "i64");
  private static final DtoField OFFSET = new DtoField("offset", "i64");

  private AccessSurfaceBuilder() {}

  public static AccessSurface build(EntitySchema s) {
    String e = s.name();
    String response = e + "Response";
    String createDto = "Create" + e + "Request";
    String updateDto = "Update" + e + "Request";
    String queryDto = e + "Query";
    DtoField id = DtoField.of(s.identityField().name(), s.identityField().type());

    List<DtoShape> dtos = new ArrayList<>();
    if (!s.createFields().isEmpty()) {
      dtos.add(new DtoShape(createDto, DtoShape.Role.CREATE, s.createFields().stream()
          .map(f -> DtoField.of(f.name(), f.type())).toList()));
    }
    if (!s.updateFields().isEmpty()) {
      dtos.add(new DtoShape(updateDto, DtoShape.Role.UPDATE, s.updateFields().stream()
          .map(f -> DtoField.of(f.name(), optional(f.type()))).toList()));
    }
    dtos.add(new DtoShape(response, DtoShape.Role.RESPONSE, s.responseFields().stream()
        .map(f -> DtoField.of(f.name(), f.type())).toList()));
    if (s.hasFilters()) {
      dtos.add(new DtoShape(queryDto, DtoShape.Role.QUERY, queryFields(s)));
    }
    for (Projection p : s.projections()) {
      dtos.add(new DtoShape(e + Naming.pascalCase(p.name()), DtoShape.Role.PROJECTION, p.fields().stream()
          .map(name -> DtoField.of(name, s.field(name).type())).toList()));
    }

    List<OperationSignature> ops = new ArrayList<>();
    if (s.sqlLevel() != SqlLevel.NONE) {
      if (!s.createFields().isEmpty()) {
        ops.add(new OperationSignature(Operations.CREATE, List.of(new DtoField("dto", createDto)), response));
      }
      ops.add(new OperationSignature(Operations.FIND_BY_ID, List.of(id), "optional<" + response + ">"));
      if (!s.updateFields().isEmpty()) {
        ops.add(new OperationSignature(Operations.UPDATE, List.of(id, new DtoField("dto", updateDto)), response));
      }
      ops.add(new OperationSignature(Operations.DELETE, List.of(id), "bool"));
      ops.add(new OperationSignature(Operations.LIST, List.of(LIMIT, OFFSET), "list<" + response + ">"));
      if (s.hasFilters()) {
        ops.add(new OperationSignature(Operations.QUERY, List.of(new DtoField("query", queryDto)), "list<" + response + ">"));
      }
      if (s.softDelete()) {
        ops.add(new OperationSignature(Operations.HARD_DELETE, List.of(id), "bool"));
        ops.add(new OperationSignature(Operations.RESTORE, List.of(id), "bool"));
        ops.add(new OperationSignature(Operations.FIND_BY_ID_WITH_DELETED, List.of(id), "optional<" + response + ">"));
        ops.add(new OperationSignature(Operations.LIST_WITH_DELETED, List.of(LIMIT, OFFSET), "list<" + response + ">"));
      }
      for (FieldSchema f : s.relationFields()) {
        String target = f.relation().target();
        ops.add(new OperationSignature(Operations.findRelated(target), List.of(id), "optional<" + target + ">"));
      }
      for (String target : s.oneToManyTargets()) {
        ops.add(new OperationSignature(Operations.findMany(target), List.of(id), "list<" + target + ">"));
      }
      for (Projection p : s.projections()) {
        ops.add(new OperationSignature(Operations.findProjection(p.name()), List.of(id),
            "optional<" + e + Naming.pascalCase(p.name()) + ">"));
      }
    }

    return new AccessSurface(e, e + "Repository", s.errorKind(), s.sqlLevel(), dtos, ops);
  }

  private static List<DtoField> queryFields(EntitySchema s) {
    List<DtoField> out = new ArrayList<>();
    for (FieldSchema f : s.filterFields()) {
      TypeRef t = optional(unwrapOptional(f.type()));
      if (f.filter() == FilterKind.RANGE) {
        out.add(DtoField.of(f.name() + "_from", t));
        out.add(DtoField.of(f.name() + "_to", t));
      } else {
        out.add(DtoField.of(f.name(), t));
      }
    }
    out.add(new DtoField(LIMIT.name(), "optional<i64>"));
    out.add(new DtoField(OFFSET.name(), "optional<i64>"));
    return out;
  }

  private static TypeRef optional(TypeRef t) {
    return t.isOptional() ? t : new OptionalTypeRef(t);
  }

  private static TypeRef unwrapOptional(TypeRef t) {
    return t instanceof OptionalTypeRef o ? o.inner() : t;
  }
}
