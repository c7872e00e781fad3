package io.intellixity.entigen.sql.crud;

import io.intellixity.entigen.sql.SqlStatement;

/** Lookup of related rows by relation, issued after the owning entity was loaded. */
public record RelationQuery(String operation, Kind kind, String target, SqlStatement statement) {
  public enum Kind { BELONGS_TO, HAS_MANY }
}
