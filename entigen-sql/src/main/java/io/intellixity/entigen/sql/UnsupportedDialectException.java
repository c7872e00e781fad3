package io.intellixity.entigen.sql;

import io.intellixity.entigen.schema.DialectKind;

/** Raised when SQL is requested from a dialect that has no implementation yet. */
public final class UnsupportedDialectException extends RuntimeException {
  private final DialectKind dialect;

  public UnsupportedDialectException(DialectKind dialect, String message) {
    super(message);
    this.dialect = dialect;
  }

  public DialectKind dialect() {
    return dialect;
  }
}
