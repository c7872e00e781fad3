package io.intellixity.entigen.schema;

import java.util.List;

/**
 * What an INSERT/UPDATE asks the database to hand back.\n
 *
 * {@link Custom} requests the listed columns but the result is still the caller-side entity; the
 * returned values are discarded.
 */
public sealed interface ReturningPolicy {
  ReturningPolicy FULL = new Full();
  ReturningPolicy IDENTITY_ONLY = new IdentityOnly();
  ReturningPolicy NONE = new None();

  record Full() implements ReturningPolicy {}

  record IdentityOnly() implements ReturningPolicy {}

  record None() implements ReturningPolicy {}

  record Custom(List<String> columns) implements ReturningPolicy {
    public Custom {
      columns = columns == null ? List.of() : List.copyOf(columns);
      if (columns.isEmpty()) throw new IllegalArgumentException("custom returning needs at least one column");
    }
  }
}
