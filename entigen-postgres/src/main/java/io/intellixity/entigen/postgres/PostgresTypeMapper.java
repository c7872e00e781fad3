package io.intellixity.entigen.postgres;

import io.intellixity.entigen.schema.ColumnOverrides;
import io.intellixity.entigen.schema.ScalarIds;
import io.intellixity.entigen.schema.ScalarTypeRef;
import io.intellixity.entigen.types.TypeMapper;

import java.util.Map;

/** Scalar table for Postgres. Unknown scalars become TEXT. */
public final class PostgresTypeMapper implements TypeMapper {
  static final String FALLBACK = "TEXT";

  private static final Map<String, String> SCALARS = Map.ofEntries(
      Map.entry(ScalarIds.UUID, "UUID"),
      Map.entry(ScalarIds.STRING, "TEXT"),
      Map.entry(ScalarIds.I8, "SMALLINT"),
      Map.entry(ScalarIds.I16, "SMALLINT"),
      Map.entry(ScalarIds.U8, "SMALLINT"),
      Map.entry(ScalarIds.I32, "INTEGER"),
      Map.entry(ScalarIds.U16, "INTEGER"),
      Map.entry(ScalarIds.I64, "BIGINT"),
      Map.entry(ScalarIds.U32, "BIGINT"),
      Map.entry(ScalarIds.U64, "BIGINT"),
      Map.entry(ScalarIds.F32, "REAL"),
      Map.entry(ScalarIds.F64, "DOUBLE PRECISION"),
      Map.entry(ScalarIds.BOOL, "BOOLEAN"),
      Map.entry(ScalarIds.DATETIME, "TIMESTAMPTZ"),
      Map.entry(ScalarIds.DATE, "DATE"),
      Map.entry(ScalarIds.TIME, "TIME"),
      Map.entry(ScalarIds.NAIVE_DATETIME, "TIMESTAMP"),
      Map.entry(ScalarIds.JSON, "JSONB"),
      Map.entry(ScalarIds.DECIMAL, "DECIMAL"),
      Map.entry(ScalarIds.IP, "INET"),
      Map.entry(ScalarIds.MAC, "MACADDR"),
      Map.entry(ScalarIds.BYTES, "BYTEA"));

  @Override
  public String scalar(ScalarTypeRef scalar, ColumnOverrides column) {
    String id = scalar.scalarId();
    if (ScalarIds.STRING.equals(id) && column.varcharLength() != null) {
      return "VARCHAR(" + column.varcharLength() + ")";
    }
    return SCALARS.getOrDefault(id, FALLBACK);
  }
}
