package io.intellixity.entigen.sql;

import io.intellixity.entigen.schema.EntitySchema;
import io.intellixity.entigen.schema.FieldSchema;
import io.intellixity.entigen.schema.SchemaCatalog;
import io.intellixity.entigen.util.Naming;

/**
 * Resolves where a related entity lives.\n
 *
 * Relations name their target entity only. Without a catalog the table is guessed by pluralizing
 * the snake_case entity name inside the referencing entity's namespace, with identity column
 * {@code id}. A catalog lookup replaces the guess whenever the target was compiled in the same
 * batch.
 */
public final class TableResolver {
  private static final String DEFAULT_IDENTITY_COLUMN = "id";

  private final SchemaCatalog catalog;

  private TableResolver(SchemaCatalog catalog) {
    this.catalog = catalog;
  }

  public static TableResolver heuristic() {
    return new TableResolver(SchemaCatalog.EMPTY);
  }

  public static TableResolver fromCatalog(SchemaCatalog catalog) {
    return new TableResolver(catalog == null ? SchemaCatalog.EMPTY : catalog);
  }

  public TableRef resolve(EntitySchema owner, String targetEntity) {
    EntitySchema target = catalog.find(targetEntity);
    if (target != null) {
      return new TableRef(target.schemaNamespace(), target.table(), target.identityField().columnName());
    }
    return new TableRef(owner.schemaNamespace(), Naming.pluralize(Naming.snakeCase(targetEntity)), DEFAULT_IDENTITY_COLUMN);
  }

  /** Column on {@code targetEntity}'s table that points back at {@code owner}. */
  public String backReferenceColumn(EntitySchema owner, String targetEntity) {
    EntitySchema target = catalog.find(targetEntity);
    if (target != null) {
      for (FieldSchema f : target.relationFields()) {
        if (f.relation().target().equals(owner.name())) return f.columnName();
      }
    }
    return Naming.snakeCase(owner.name()) + "_" + DEFAULT_IDENTITY_COLUMN;
  }
}
