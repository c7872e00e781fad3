package io.intellixity.entigen.sql.crud;

import io.intellixity.entigen.schema.FilterKind;

/** One filterable field of the dynamic query. */
public record FilterTerm(String field, String column, FilterKind kind) {
  public String fromKey() {
    return field + "_from";
  }

  public String toKey() {
    return field + "_to";
  }
}
