package io.intellixity.entigen.yaml;

import io.intellixity.entigen.parse.Diagnostic;
import io.intellixity.entigen.parse.EntityDeclaration;

import java.util.ArrayList;
import java.util.List;

/** Declarations read from one or more documents, plus syntax problems that prevented reading some. */
public record LoadedDeclarations(List<EntityDeclaration> declarations, List<Diagnostic> diagnostics) {
  public LoadedDeclarations {
    declarations = declarations == null ? List.of() : List.copyOf(declarations);
    diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
  }

  public LoadedDeclarations merge(LoadedDeclarations other) {
    List<EntityDeclaration> decls = new ArrayList<>(declarations);
    decls.addAll(other.declarations);
    List<Diagnostic> diags = new ArrayList<>(diagnostics);
    diags.addAll(other.diagnostics);
    return new LoadedDeclarations(decls, diags);
  }
}
