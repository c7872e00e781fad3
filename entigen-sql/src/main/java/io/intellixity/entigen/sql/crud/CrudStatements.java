package io.intellixity.entigen.sql.crud;

import io.intellixity.entigen.sql.SqlStatement;
import io.intellixity.entigen.surface.Operations;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every statement synthesized for one entity.\n
 *
 * {@code create}, {@code update} and {@code query} are null when the entity has no fields for
 * them; the soft-delete statements are null unless soft delete is enabled.
 */
public record CrudStatements(
    String entity,
    WritePlan create,
    SqlStatement findById,
    WritePlan update,
    SqlStatement delete,
    SqlStatement list,
    FilterQuery query,
    SqlStatement hardDelete,
    SqlStatement restore,
    SqlStatement findByIdWithDeleted,
    SqlStatement listWithDeleted,
    List<RelationQuery> relations,
    Map<String, SqlStatement> projections
) {
  public CrudStatements {
    relations = relations == null ? List.of() : List.copyOf(relations);
    projections = projections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(projections));
  }

  /** Fixed-text statements keyed by operation name, in a stable order. The dynamic query is not included. */
  public Map<String, SqlStatement> byOperation() {
    Map<String, SqlStatement> out = new LinkedHashMap<>();
    if (create != null) out.put(Operations.CREATE, create.statement());
    out.put(Operations.FIND_BY_ID, findById);
    if (update != null) out.put(Operations.UPDATE, update.statement());
    out.put(Operations.DELETE, delete);
    out.put(Operations.LIST, list);
    if (hardDelete != null) out.put(Operations.HARD_DELETE, hardDelete);
    if (restore != null) out.put(Operations.RESTORE, restore);
    if (findByIdWithDeleted != null) out.put(Operations.FIND_BY_ID_WITH_DELETED, findByIdWithDeleted);
    if (listWithDeleted != null) out.put(Operations.LIST_WITH_DELETED, listWithDeleted);
    for (RelationQuery r : relations) out.put(r.operation(), r.statement());
    out.putAll(projections);
    return Collections.unmodifiableMap(out);
  }
}
