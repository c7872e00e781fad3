package io.intellixity.entigen.sql;

import java.util.List;
import java.util.Objects;

/** SQL text plus the ordered bind plan; {@code binds.get(i)} fills placeholder {@code i + 1}. */
public record SqlStatement(String sql, List<Bind> binds, ExecKind execKind) {
  public enum ExecKind {
    /** At most one row. */
    QUERY_ONE,
    /** Any number of rows. */
    QUERY_MANY,
    /** Write; the caller reads the affected row count. */
    UPDATE,
    /** Write with a RETURNING clause; the caller reads the returned row. */
    UPDATE_RETURNING
  }

  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    binds = binds == null ? List.of() : List.copyOf(binds);
    execKind = execKind == null ? ExecKind.QUERY_MANY : execKind;
  }
}
