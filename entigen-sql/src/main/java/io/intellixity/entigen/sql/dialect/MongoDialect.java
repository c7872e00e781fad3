package io.intellixity.entigen.sql.dialect;

import io.intellixity.entigen.schema.DialectKind;

public final class MongoDialect extends UnimplementedDialect {
  @Override public String id() { return "mongodb"; }
  @Override public DialectKind kind() { return DialectKind.MONGODB; }
  @Override protected String displayName() { return "MongoDB"; }
}
