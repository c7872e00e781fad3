package io.intellixity.entigen.postgres;

import io.intellixity.entigen.schema.DialectKind;
import io.intellixity.entigen.sql.dialect.AbstractSqlDialect;
import io.intellixity.entigen.types.TypeMapper;

/**
 * Postgres dialect.\n
 *
 * Keeps only Postgres-specific overrides: {@code $n} placeholders, RETURNING, ILIKE and NOW().
 * Generic rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  private final TypeMapper typeMapper = new PostgresTypeMapper();

  @Override public String id() { return "postgres"; }
  @Override public DialectKind kind() { return DialectKind.POSTGRES; }
  @Override public TypeMapper typeMapper() { return typeMapper; }

  @Override
  public String placeholder(int index) {
    if (index < 1) throw new IllegalArgumentException("placeholder index starts at 1: " + index);
    return "$" + index;
  }

  @Override
  public boolean supportsReturning() {
    return true;
  }

  @Override
  public String likeOperator() {
    return "ILIKE";
  }

  @Override
  public String currentTimestamp() {
    return "NOW()";
  }
}
