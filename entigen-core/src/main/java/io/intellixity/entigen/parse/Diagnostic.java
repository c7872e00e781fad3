package io.intellixity.entigen.parse;

import java.util.Objects;

/**
 * One finding about a declaration.\n
 *
 * @param origin   file the declaration came from, or {@code <inline>}
 * @param location path to the offending key, e.g. {@code User.fields[email].column.index}
 */
public record Diagnostic(Severity severity, String origin, String location, String message) {
  public enum Severity { ERROR, WARNING }

  public Diagnostic {
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(message, "message");
    origin = origin == null ? EntityDeclaration.INLINE : origin;
    location = location == null ? "" : location;
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public String toString() {
    return severity + " " + origin + (location.isEmpty() ? "" : " " + location) + ": " + message;
  }
}
