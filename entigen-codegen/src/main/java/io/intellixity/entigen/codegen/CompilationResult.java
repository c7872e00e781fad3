package io.intellixity.entigen.codegen;

import io.intellixity.entigen.parse.Diagnostic;

import java.util.ArrayList;
import java.util.List;

/** Per-entity outcomes plus batch-level diagnostics (unreadable files, duplicate entities). */
public record CompilationResult(List<CompiledEntity> entities, List<Diagnostic> batchDiagnostics) {
  public CompilationResult {
    entities = entities == null ? List.of() : List.copyOf(entities);
    batchDiagnostics = batchDiagnostics == null ? List.of() : List.copyOf(batchDiagnostics);
  }

  public boolean hasErrors() {
    return batchDiagnostics.stream().anyMatch(Diagnostic::isError) || entities.stream().anyMatch(CompiledEntity::failed);
  }

  public List<Diagnostic> allDiagnostics() {
    List<Diagnostic> out = new ArrayList<>(batchDiagnostics);
    for (CompiledEntity e : entities) out.addAll(e.diagnostics());
    return out;
  }

  public CompiledEntity entity(String name) {
    for (CompiledEntity e : entities) {
      if (name.equals(e.name())) return e;
    }
    return null;
  }
}
