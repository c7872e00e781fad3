package io.intellixity.entigen.sql.dialect;

import io.intellixity.entigen.schema.DialectKind;

public final class ClickHouseDialect extends UnimplementedDialect {
  @Override public String id() { return "clickhouse"; }
  @Override public DialectKind kind() { return DialectKind.CLICKHOUSE; }
  @Override protected String displayName() { return "ClickHouse"; }
}
