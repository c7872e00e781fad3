package io.intellixity.entigen.sql.crud;

import io.intellixity.entigen.schema.EntitySchema;
import io.intellixity.entigen.schema.FieldSchema;
import io.intellixity.entigen.schema.Projection;
import io.intellixity.entigen.schema.ReturningPolicy;
import io.intellixity.entigen.sql.Bind;
import io.intellixity.entigen.sql.SqlStatement;
import io.intellixity.entigen.sql.SqlStatement.ExecKind;
import io.intellixity.entigen.sql.TableRef;
import io.intellixity.entigen.sql.crud.WritePlan.ResultSource;
import io.intellixity.entigen.sql.dialect.Dialect;
import io.intellixity.entigen.surface.Operations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Synthesizes the CRUD and filter statements of an entity for one dialect.\n
 *
 * Pure and deterministic: the same schema always yields byte-identical SQL and bind plans.
 */
public final class CrudSynthesizer {
  private static final Logger log = LoggerFactory.getLogger(CrudSynthesizer.class);
  private static final List<String> ALL_COLUMNS = List.of("*");

  private final Dialect dialect;
  private final CrudOptions options;

  public CrudSynthesizer(Dialect dialect) {
    this(dialect, CrudOptions.DEFAULTS);
  }

  public CrudSynthesizer(Dialect dialect, CrudOptions options) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.options = Objects.requireNonNull(options, "options");
  }

  /** @throws io.intellixity.entigen.sql.UnsupportedDialectException for dialects without SQL support */
  public CrudStatements synthesize(EntitySchema s) {
    if (s.dialect() != dialect.kind()) {
      throw new IllegalArgumentException("Entity " + s.name() + " targets " + s.dialect().id()
          + " but synthesizer dialect is " + dialect.id());
    }
    dialect.ensureSupported();

    String table = s.tableQualifiedName();
    FieldSchema id = s.identityField();
    String idCol = id.columnName();
    String selectCols = columns(s.responseFields());
    String live = s.softDelete() ? s.softDeleteColumn() + " IS NULL" : null;
    String byId = " WHERE " + idCol + " = " + dialect.placeholder(1);
    List<Bind> idBind = List.of(Bind.identity(id.name()));
    String page = " ORDER BY " + idCol + " DESC LIMIT " + dialect.placeholder(1) + " OFFSET " + dialect.placeholder(2);
    List<Bind> pageBinds = List.of(new Bind(FilterQuery.LIMIT, Bind.Source.LIMIT), new Bind(FilterQuery.OFFSET, Bind.Source.OFFSET));

    SqlStatement findByIdWithDeleted = new SqlStatement(
        "SELECT " + selectCols + " FROM " + table + byId, idBind, ExecKind.QUERY_ONE);
    SqlStatement findById = live == null
        ? findByIdWithDeleted
        : new SqlStatement(findByIdWithDeleted.sql() + " AND " + live, idBind, ExecKind.QUERY_ONE);

    WritePlan create = s.createFields().isEmpty() ? null : create(s, table);
    WritePlan update = s.updateFields().isEmpty() ? null : update(s, table, findById);

    SqlStatement hardDelete = new SqlStatement("DELETE FROM " + table + byId, idBind, ExecKind.UPDATE);
    SqlStatement delete = live == null
        ? hardDelete
        : new SqlStatement("UPDATE " + table + " SET " + s.softDeleteColumn() + " = " + dialect.currentTimestamp()
            + byId + " AND " + live, idBind, ExecKind.UPDATE);

    SqlStatement listWithDeleted = new SqlStatement(
        "SELECT " + selectCols + " FROM " + table + page, pageBinds, ExecKind.QUERY_MANY);
    SqlStatement list = live == null
        ? listWithDeleted
        : new SqlStatement("SELECT " + selectCols + " FROM " + table + " WHERE " + live + page, pageBinds, ExecKind.QUERY_MANY);

    FilterQuery query = null;
    if (s.hasFilters()) {
      List<FilterTerm> terms = new ArrayList<>();
      for (FieldSchema f : s.filterFields()) terms.add(new FilterTerm(f.name(), f.columnName(), f.filter()));
      query = new FilterQuery(dialect, "SELECT " + selectCols + " FROM " + table, live, terms,
          " ORDER BY " + idCol + " DESC", options.defaultLimit());
    }

    SqlStatement restore = null;
    if (live != null) {
      restore = new SqlStatement("UPDATE " + table + " SET " + s.softDeleteColumn() + " = NULL" + byId
          + " AND " + s.softDeleteColumn() + " IS NOT NULL", idBind, ExecKind.UPDATE);
    }

    List<RelationQuery> relations = relations(s, id);

    Map<String, SqlStatement> projections = new LinkedHashMap<>();
    for (Projection p : s.projections()) {
      List<FieldSchema> pf = p.fields().stream().map(s::field).toList();
      String sql = "SELECT " + columns(pf) + " FROM " + table + byId + (live == null ? "" : " AND " + live);
      projections.put(Operations.findProjection(p.name()), new SqlStatement(sql, idBind, ExecKind.QUERY_ONE));
    }

    CrudStatements out = new CrudStatements(s.name(), create, findById, update, delete, list, query,
        live == null ? null : hardDelete,
        restore,
        live == null ? null : findByIdWithDeleted,
        live == null ? null : listWithDeleted,
        relations, projections);
    log.debug("Synthesized {} statements for {} ({})", out.byOperation().size() + (query == null ? 0 : 1), s.name(), dialect.id());
    return out;
  }

  private WritePlan create(EntitySchema s, String table) {
    // a database-generated identity is left to the column default and read back from RETURNING
    boolean dbIdentity = s.identityField().generated();
    List<FieldSchema> all = s.allFields().stream().filter(f -> !(f.identity() && dbIdentity)).toList();
    List<Bind> binds = all.stream().map(f -> Bind.field(f.name())).toList();
    String insert = "INSERT INTO " + table + " (" + columns(all) + ") VALUES (" + dialect.placeholders(all.size()) + ")";

    ReturningPolicy policy = effectiveReturning(s);
    if (dbIdentity && !(policy instanceof ReturningPolicy.Full)) {
      throw new IllegalArgumentException("Entity " + s.name() + " has a database-generated identity, which needs "
          + "RETURNING * but " + dialect.id() + " cannot return rows");
    }
    if (policy instanceof ReturningPolicy.Full) {
      return new WritePlan(new SqlStatement(insert + dialect.returningClause(ALL_COLUMNS), binds, ExecKind.UPDATE_RETURNING),
          ResultSource.RETURNED_ROW, null);
    }
    if (policy instanceof ReturningPolicy.IdentityOnly) {
      return new WritePlan(new SqlStatement(insert + dialect.returningClause(List.of(s.identityField().columnName())), binds,
          ExecKind.UPDATE_RETURNING), ResultSource.INPUT_ENTITY, null);
    }
    if (policy instanceof ReturningPolicy.Custom c) {
      // requested columns are fetched, the caller-side entity is still the result
      return new WritePlan(new SqlStatement(insert + dialect.returningClause(c.columns()), binds, ExecKind.UPDATE_RETURNING),
          ResultSource.INPUT_ENTITY, null);
    }
    return new WritePlan(new SqlStatement(insert, binds, ExecKind.UPDATE), ResultSource.INPUT_ENTITY, null);
  }

  private WritePlan update(EntitySchema s, String table, SqlStatement findById) {
    List<FieldSchema> fields = s.updateFields();
    FieldSchema id = s.identityField();
    List<Bind> binds = new ArrayList<>();
    for (FieldSchema f : fields) binds.add(Bind.field(f.name()));
    binds.add(Bind.identity(id.name()));
    String sql = "UPDATE " + table + " SET " + dialect.assignmentClause(fields.stream().map(FieldSchema::columnName).toList())
        + " WHERE " + id.columnName() + " = " + dialect.placeholder(fields.size() + 1);

    ReturningPolicy policy = effectiveReturning(s);
    if (policy instanceof ReturningPolicy.Full) {
      return new WritePlan(new SqlStatement(sql + dialect.returningClause(ALL_COLUMNS), binds, ExecKind.UPDATE_RETURNING),
          ResultSource.RETURNED_ROW, null);
    }
    if (policy instanceof ReturningPolicy.Custom c) {
      return new WritePlan(new SqlStatement(sql + dialect.returningClause(c.columns()), binds, ExecKind.UPDATE_RETURNING),
          ResultSource.REREAD, findById);
    }
    return new WritePlan(new SqlStatement(sql, binds, ExecKind.UPDATE), ResultSource.REREAD, findById);
  }

  private List<RelationQuery> relations(EntitySchema s, FieldSchema id) {
    List<RelationQuery> out = new ArrayList<>();
    for (FieldSchema f : s.relationFields()) {
      String target = f.relation().target();
      TableRef ref = options.tableResolver().resolve(s, target);
      String sql = "SELECT * FROM " + ref.qualifiedName() + " WHERE " + ref.identityColumn() + " = " + dialect.placeholder(1);
      out.add(new RelationQuery(Operations.findRelated(target), RelationQuery.Kind.BELONGS_TO, target,
          new SqlStatement(sql, List.of(new Bind(f.name(), Bind.Source.FOREIGN_KEY)), ExecKind.QUERY_ONE)));
    }
    for (String target : s.oneToManyTargets()) {
      TableRef ref = options.tableResolver().resolve(s, target);
      String fk = options.tableResolver().backReferenceColumn(s, target);
      String sql = "SELECT * FROM " + ref.qualifiedName() + " WHERE " + fk + " = " + dialect.placeholder(1);
      out.add(new RelationQuery(Operations.findMany(target), RelationQuery.Kind.HAS_MANY, target,
          new SqlStatement(sql, List.of(Bind.identity(id.name())), ExecKind.QUERY_MANY)));
    }
    return out;
  }

  private ReturningPolicy effectiveReturning(EntitySchema s) {
    return dialect.supportsReturning() ? s.returning() : ReturningPolicy.NONE;
  }

  private static String columns(List<FieldSchema> fields) {
    return String.join(", ", fields.stream().map(FieldSchema::columnName).toList());
  }
}
