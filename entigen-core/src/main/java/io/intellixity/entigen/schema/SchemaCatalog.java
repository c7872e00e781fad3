package io.intellixity.entigen.schema;

import java.util.Collection;
import java.util.List;

/** Read-only lookup of the entities compiled together in one batch. */
public interface SchemaCatalog {
  SchemaCatalog EMPTY = new InMemorySchemaCatalog(List.of());

  /** Returns null when no entity with that name was declared. */
  EntitySchema find(String entityName);

  Collection<EntitySchema> all();
}
