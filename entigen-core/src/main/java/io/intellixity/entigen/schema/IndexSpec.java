package io.intellixity.entigen.schema;

import java.util.List;

/** Multi-column (optionally unique or partial) index. */
public record IndexSpec(
    String name,
    List<String> columns,
    IndexKind kind,
    boolean unique,
    String where
) {
  public IndexSpec {
    columns = columns == null ? List.of() : List.copyOf(columns);
    if (columns.isEmpty()) throw new IllegalArgumentException("index needs at least one column");
    kind = kind == null ? IndexKind.BTREE : kind;
    if (name != null && name.isBlank()) name = null;
    if (where != null && where.isBlank()) where = null;
  }

  /** Declared name or {@code idx_<table>_<col1>_<col2>...}. */
  public String resolvedName(String table) {
    if (name != null) return name;
    return "idx_" + table + "_" + String.join("_", columns);
  }
}
