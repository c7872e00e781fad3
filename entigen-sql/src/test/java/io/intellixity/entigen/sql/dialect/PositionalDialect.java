package io.intellixity.entigen.sql.dialect;

import io.intellixity.entigen.schema.ColumnOverrides;
import io.intellixity.entigen.schema.DialectKind;
import io.intellixity.entigen.schema.ScalarTypeRef;
import io.intellixity.entigen.types.TypeMapper;

import java.util.Locale;

/** Bare {@link AbstractSqlDialect}: {@code ?} placeholders, no RETURNING, plain LIKE. */
public final class PositionalDialect extends AbstractSqlDialect {
  private final TypeMapper mapper = new TypeMapper() {
    @Override
    public String scalar(ScalarTypeRef scalar, ColumnOverrides column) {
      return scalar.scalarId().toUpperCase(Locale.ROOT);
    }
  };

  @Override public String id() { return "positional"; }
  @Override public DialectKind kind() { return DialectKind.POSTGRES; }
  @Override public TypeMapper typeMapper() { return mapper; }
}
