package io.intellixity.entigen.parse;

import io.intellixity.entigen.schema.EntitySchema;

import java.util.List;

/**
 * Outcome of parsing one declaration: a schema (possibly with warnings) or the errors that
 * prevented building it.
 */
public record ParseResult(String entityName, EntitySchema schema, List<Diagnostic> diagnostics) {
  public ParseResult {
    diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    if (schema != null && diagnostics.stream().anyMatch(Diagnostic::isError)) {
      throw new IllegalArgumentException("a schema cannot be produced alongside errors");
    }
  }

  public boolean isValid() {
    return schema != null;
  }

  public List<Diagnostic> errors() {
    return diagnostics.stream().filter(Diagnostic::isError).toList();
  }

  public List<Diagnostic> warnings() {
    return diagnostics.stream().filter(d -> !d.isError()).toList();
  }

  public EntitySchema orThrow() {
    if (schema == null) {
      throw new SchemaValidationException("Invalid entity declaration: " + entityName, diagnostics);
    }
    return schema;
  }
}
