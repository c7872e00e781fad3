package io.intellixity.entigen.schema;

/**
 * Per-field column options.\n
 *
 * @param index          single-column index kind, null when the column is not indexed
 * @param defaultExpr    emitted verbatim after {@code DEFAULT}
 * @param checkExpr      emitted verbatim inside {@code CHECK (...)}
 * @param varcharLength  string length limit, null for unbounded
 * @param sqlType        explicit SQL type, bypasses the type mapper
 * @param forceNullable  nullable even when the semantic type is not optional
 * @param columnName     custom column name, null to use the field name
 */
public record ColumnOverrides(
    boolean unique,
    IndexKind index,
    String defaultExpr,
    String checkExpr,
    Integer varcharLength,
    String sqlType,
    boolean forceNullable,
    String columnName
) {
  public static final ColumnOverrides NONE = new ColumnOverrides(false, null, null, null, null, null, false, null);

  public ColumnOverrides {
    if (varcharLength != null && varcharLength <= 0) {
      throw new IllegalArgumentException("varchar length must be positive: " + varcharLength);
    }
  }
}
