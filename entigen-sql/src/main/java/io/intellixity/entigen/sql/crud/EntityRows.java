package io.intellixity.entigen.sql.crud;

import io.intellixity.entigen.identity.IdentityGenerator;
import io.intellixity.entigen.schema.EntitySchema;
import io.intellixity.entigen.schema.FieldSchema;
import io.intellixity.entigen.schema.ScalarIds;
import io.intellixity.entigen.schema.ScalarTypeRef;
import io.intellixity.entigen.sql.Bind;
import io.intellixity.entigen.sql.SqlStatement;

import java.util.*;

/**
 * Entity values as field-name keyed maps, and the glue between them and synthesized statements.\n
 *
 * Maps may hold null values, so they are never built with {@code Map.of}.
 */
public final class EntityRows {
  private EntityRows() {}

  /**
   * Entity as it is inserted: a fresh uuid identity, create-DTO values for create fields, null for
   * generated and unexposed fields. A database-generated identity stays null until the row is
   * returned.
   */
  public static Map<String, Object> newEntity(EntitySchema s, Map<String, ?> createDto, IdentityGenerator ids) {
    Map<String, ?> dto = createDto == null ? Map.of() : createDto;
    Map<String, Object> out = new LinkedHashMap<>();
    for (FieldSchema f : s.allFields()) {
      if (f.identity()) {
        if (f.generated()) {
          out.put(f.name(), null);
        } else if (f.type() instanceof ScalarTypeRef st && ScalarIds.UUID.equals(st.scalarId())) {
          out.put(f.name(), ids.next());
        } else {
          throw new IllegalArgumentException("Identity " + s.name() + "." + f.name()
              + " is neither uuid nor database-generated");
        }
      } else if (f.inCreate()) {
        out.put(f.name(), dto.get(f.name()));
      } else {
        out.put(f.name(), null);
      }
    }
    return Collections.unmodifiableMap(out);
  }

  /**
   * Values for a fixed-text statement's placeholders, in bind order.
   *
   * @param entity   field values for FIELD and FOREIGN_KEY binds
   * @param identity value for IDENTITY binds
   */
  public static List<Object> bindValues(SqlStatement st, Map<String, ?> entity, Object identity) {
    Map<String, ?> e = entity == null ? Map.of() : entity;
    List<Object> out = new ArrayList<>(st.binds().size());
    for (Bind b : st.binds()) {
      switch (b.source()) {
        case FIELD, FOREIGN_KEY -> out.add(e.get(b.name()));
        case IDENTITY -> out.add(identity);
        default -> throw new IllegalArgumentException("bind " + b + " needs runtime values; render the FilterQuery instead");
      }
    }
    return out;
  }

  /** Re-keys a database row (column names) by field name. Missing columns become null. */
  public static Map<String, Object> fromRow(EntitySchema s, Map<String, ?> row) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (FieldSchema f : s.allFields()) out.put(f.name(), row.get(f.columnName()));
    return Collections.unmodifiableMap(out);
  }

  /**
   * The entity a write operation returns.
   *
   * @param written     entity sent to the database
   * @param returnedRow row handed back by RETURNING, or null
   * @param rereadRow   row from the follow-up read, or null
   */
  public static Map<String, Object> result(EntitySchema s, WritePlan plan, Map<String, ?> written,
                                           Map<String, ?> returnedRow, Map<String, ?> rereadRow) {
    switch (plan.resultSource()) {
      case RETURNED_ROW:
        if (returnedRow == null) throw new EntityNotFoundException(s.name() + " write returned no row");
        return fromRow(s, returnedRow);
      case INPUT_ENTITY:
        return Collections.unmodifiableMap(new LinkedHashMap<>(written));
      case REREAD:
        if (rereadRow == null) throw new EntityNotFoundException(s.name() + " not found after write");
        return fromRow(s, rereadRow);
      default:
        throw new IllegalStateException("Unknown result source: " + plan.resultSource());
    }
  }
}
