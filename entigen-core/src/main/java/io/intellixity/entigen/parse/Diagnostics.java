package io.intellixity.entigen.parse;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Accumulates diagnostics for one declaration so every problem is reported in one pass. */
final class Diagnostics {
  private final String origin;
  private final List<Diagnostic> out = new ArrayList<>();

  Diagnostics(String origin) {
    this.origin = origin;
  }

  void error(String location, String message) {
    out.add(new Diagnostic(Diagnostic.Severity.ERROR, origin, location, message));
  }

  void warning(String location, String message) {
    out.add(new Diagnostic(Diagnostic.Severity.WARNING, origin, location, message));
  }

  void unknownOption(String location, String key, Collection<String> allowed) {
    error(location + "." + key, "unknown option '" + key + "' (allowed: " + String.join(", ", allowed) + ")");
  }

  boolean hasErrors() {
    return out.stream().anyMatch(Diagnostic::isError);
  }

  List<Diagnostic> list() {
    return List.copyOf(out);
  }
}
