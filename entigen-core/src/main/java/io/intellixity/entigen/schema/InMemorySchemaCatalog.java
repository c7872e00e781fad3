package io.intellixity.entigen.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Simple in-memory {@link SchemaCatalog}.\n
 *
 * Useful for tests and for the codegen batch.\n
 */
public final class InMemorySchemaCatalog implements SchemaCatalog {
  private final Map<String, EntitySchema> entities = new LinkedHashMap<>();

  public InMemorySchemaCatalog(List<EntitySchema> schemas) {
    for (EntitySchema s : schemas) {
      EntitySchema prev = entities.putIfAbsent(s.name(), s);
      if (prev != null) throw new IllegalArgumentException("Duplicate entity: " + s.name());
    }
  }

  @Override
  public EntitySchema find(String entityName) {
    return entities.get(entityName);
  }

  @Override
  public Collection<EntitySchema> all() {
    return Collections.unmodifiableCollection(entities.values());
  }
}
