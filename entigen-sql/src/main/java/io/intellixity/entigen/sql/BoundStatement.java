package io.intellixity.entigen.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A statement rendered for concrete inputs; {@code values} are aligned with {@code binds}. */
public record BoundStatement(String sql, List<Bind> binds, List<Object> values) {
  public BoundStatement {
    binds = binds == null ? List.of() : List.copyOf(binds);
    // values may legitimately contain null
    values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    if (binds.size() != values.size()) {
      throw new IllegalArgumentException("binds/values size mismatch: " + binds.size() + " vs " + values.size());
    }
  }
}
