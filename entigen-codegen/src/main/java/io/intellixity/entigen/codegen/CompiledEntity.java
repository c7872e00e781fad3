package io.intellixity.entigen.codegen;

import io.intellixity.entigen.parse.Diagnostic;
import io.intellixity.entigen.schema.EntitySchema;
import io.intellixity.entigen.sql.crud.CrudStatements;
import io.intellixity.entigen.sql.ddl.Migration;
import io.intellixity.entigen.surface.AccessSurface;

import java.util.List;

/**
 * Everything produced for one declaration.\n
 *
 * {@code schema} and {@code surface} are null when the declaration had errors; {@code crud} and
 * {@code migration} are null when SQL is not generated for the entity.
 */
public record CompiledEntity(
    String name,
    String origin,
    EntitySchema schema,
    AccessSurface surface,
    CrudStatements crud,
    Migration migration,
    List<Diagnostic> diagnostics
) {
  public CompiledEntity {
    diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
  }

  public boolean failed() {
    return diagnostics.stream().anyMatch(Diagnostic::isError);
  }
}
