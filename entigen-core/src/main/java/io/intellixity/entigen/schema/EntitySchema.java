package io.intellixity.entigen.schema;

import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one entity.\n
 *
 * Built once by the schema parser; every consumer reads it through the accessors below, which
 * return unmodifiable lists in declaration order.
 */
public record EntitySchema(
    String name,
    String table,
    String schemaNamespace,
    DialectKind dialect,
    IdentityKind identityKind,
    String errorKind,
    SqlLevel sqlLevel,
    boolean softDelete,
    ReturningPolicy returning,
    List<FieldSchema> fields,
    List<String> oneToManyTargets,
    List<IndexSpec> indexes,
    List<Projection> projections
) {
  public static final String DEFAULT_NAMESPACE = "public";
  public static final String DEFAULT_ERROR_KIND = "sql";
  /** Soft-delete marker column. */
  public static final String SOFT_DELETE_FIELD = "deleted_at";

  public EntitySchema {
    Objects.requireNonNull(name, "name");
    if (table == null || table.isBlank()) throw new IllegalArgumentException("table is required for entity: " + name);
    schemaNamespace = schemaNamespace == null || schemaNamespace.isBlank() ? DEFAULT_NAMESPACE : schemaNamespace;
    dialect = dialect == null ? DialectKind.POSTGRES : dialect;
    identityKind = identityKind == null ? IdentityKind.TIME_ORDERED : identityKind;
    errorKind = errorKind == null || errorKind.isBlank() ? DEFAULT_ERROR_KIND : errorKind;
    sqlLevel = sqlLevel == null ? SqlLevel.FULL : sqlLevel;
    returning = returning == null ? ReturningPolicy.FULL : returning;
    fields = fields == null ? List.of() : List.copyOf(fields);
    oneToManyTargets = oneToManyTargets == null ? List.of() : List.copyOf(oneToManyTargets);
    indexes = indexes == null ? List.of() : List.copyOf(indexes);
    projections = projections == null ? List.of() : List.copyOf(projections);

    long ids = fields.stream().filter(FieldSchema::identity).count();
    if (ids != 1) {
      throw new IllegalArgumentException("entity " + name + " must have exactly one identity field, found " + ids);
    }
  }

  public FieldSchema identityField() {
    for (FieldSchema f : fields) {
      if (f.identity()) return f;
    }
    throw new IllegalStateException("no identity field: " + name);
  }

  public List<FieldSchema> allFields() {
    return fields;
  }

  public List<FieldSchema> createFields() {
    return fields.stream().filter(FieldSchema::inCreate).toList();
  }

  public List<FieldSchema> updateFields() {
    return fields.stream().filter(FieldSchema::inUpdate).toList();
  }

  public List<FieldSchema> responseFields() {
    return fields.stream().filter(FieldSchema::inResponse).toList();
  }

  public List<FieldSchema> relationFields() {
    return fields.stream().filter(FieldSchema::isRelation).toList();
  }

  public List<FieldSchema> filterFields() {
    return fields.stream().filter(FieldSchema::isFilterable).toList();
  }

  public boolean hasFilters() {
    return fields.stream().anyMatch(FieldSchema::isFilterable);
  }

  public FieldSchema field(String fieldName) {
    for (FieldSchema f : fields) {
      if (f.name().equals(fieldName)) return f;
    }
    return null;
  }

  public String tableQualifiedName() {
    return schemaNamespace + "." + table;
  }

  /** Column carrying the soft-delete marker. */
  public String softDeleteColumn() {
    FieldSchema marker = field(SOFT_DELETE_FIELD);
    return marker == null ? SOFT_DELETE_FIELD : marker.columnName();
  }
}
