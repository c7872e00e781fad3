package io.intellixity.entigen.sql.dialect;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared rendering for implemented SQL dialects.\n
 *
 * Subclasses override hooks for placeholders, returning and pattern matching.
 */
public abstract class AbstractSqlDialect implements Dialect {

  @Override
  public void ensureSupported() {
    // implemented dialects support everything the synthesizers need
  }

  /** Default is JDBC-style positional {@code ?}. */
  @Override
  public String placeholder(int index) {
    if (index < 1) throw new IllegalArgumentException("placeholder index starts at 1: " + index);
    return "?";
  }

  @Override
  public final String placeholders(int count) {
    List<String> out = new ArrayList<>(count);
    for (int i = 1; i <= count; i++) out.add(placeholder(i));
    return String.join(", ", out);
  }

  @Override
  public final String assignmentClause(List<String> columns) {
    List<String> out = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) out.add(columns.get(i) + " = " + placeholder(i + 1));
    return String.join(", ", out);
  }

  /** Default is no RETURNING support; dialects override. */
  @Override
  public boolean supportsReturning() {
    return false;
  }

  @Override
  public String returningClause(List<String> columns) {
    if (!supportsReturning() || columns == null || columns.isEmpty()) return "";
    return " RETURNING " + String.join(", ", columns);
  }

  @Override
  public String likeOperator() {
    return "LIKE";
  }

  @Override
  public String currentTimestamp() {
    return "CURRENT_TIMESTAMP";
  }
}
