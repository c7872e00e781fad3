package io.intellixity.entigen.sql.crud;

import io.intellixity.entigen.sql.SqlStatement;

import java.util.Objects;

/**
 * A write statement plus how its result entity is obtained.\n
 *
 * @param reread follow-up read for {@link ResultSource#REREAD}, otherwise null
 */
public record WritePlan(SqlStatement statement, ResultSource resultSource, SqlStatement reread) {
  public enum ResultSource {
    /** Build the result from the row handed back by RETURNING. */
    RETURNED_ROW,
    /** Result is the entity assembled before the write; anything returned is discarded. */
    INPUT_ENTITY,
    /** Run {@code reread} by identity after the write; a missing row is an error. */
    REREAD
  }

  public WritePlan {
    Objects.requireNonNull(statement, "statement");
    Objects.requireNonNull(resultSource, "resultSource");
    if ((resultSource == ResultSource.REREAD) != (reread != null)) {
      throw new IllegalArgumentException("reread statement is required exactly for REREAD");
    }
  }
}
