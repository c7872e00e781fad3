package io.intellixity.entigen.parse;

import java.util.List;

/** Raised when a caller demands a schema from a declaration that has errors. */
public final class SchemaValidationException extends RuntimeException {
  private final List<Diagnostic> diagnostics;

  public SchemaValidationException(String message, List<Diagnostic> diagnostics) {
    super(message + describe(diagnostics));
    this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
  }

  public SchemaValidationException(String message, Throwable cause) {
    super(message, cause);
    this.diagnostics = List.of();
  }

  public List<Diagnostic> diagnostics() {
    return diagnostics;
  }

  private static String describe(List<Diagnostic> diagnostics) {
    if (diagnostics == null || diagnostics.isEmpty()) return "";
    StringBuilder sb = new StringBuilder();
    for (Diagnostic d : diagnostics) {
      if (d.isError()) sb.append("\n  ").append(d);
    }
    return sb.toString();
  }
}
