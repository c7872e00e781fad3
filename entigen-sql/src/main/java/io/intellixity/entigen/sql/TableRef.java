package io.intellixity.entigen.sql;

/** Physical location of an entity's table and its identity column. */
public record TableRef(String namespace, String table, String identityColumn) {
  public String qualifiedName() {
    return namespace + "." + table;
  }
}
