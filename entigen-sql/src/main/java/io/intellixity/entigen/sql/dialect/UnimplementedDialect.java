package io.intellixity.entigen.sql.dialect;

import io.intellixity.entigen.sql.UnsupportedDialectException;
import io.intellixity.entigen.types.TypeMapper;

import java.util.List;

/**
 * Placeholder for a dialect that is recognised but has no SQL generation yet.\n
 *
 * Every SQL capability fails with {@link UnsupportedDialectException}; entities on such a
 * dialect can still get their access surface with {@code sql: trait}.
 */
public abstract class UnimplementedDialect implements Dialect {

  protected abstract String displayName();

  @Override
  public final void ensureSupported() {
    throw unsupported();
  }

  @Override public final String placeholder(int index) { throw unsupported(); }
  @Override public final String placeholders(int count) { throw unsupported(); }
  @Override public final String assignmentClause(List<String> columns) { throw unsupported(); }
  @Override public final boolean supportsReturning() { return false; }
  @Override public final String returningClause(List<String> columns) { throw unsupported(); }
  @Override public final String likeOperator() { throw unsupported(); }
  @Override public final String currentTimestamp() { throw unsupported(); }
  @Override public final TypeMapper typeMapper() { throw unsupported(); }

  private UnsupportedDialectException unsupported() {
    return new UnsupportedDialectException(kind(), displayName()
        + " support is not yet implemented. Use 'sql: trait' to generate only the access interface"
        + " and implement it by hand, or 'sql: none' to skip repository generation.");
  }
}
