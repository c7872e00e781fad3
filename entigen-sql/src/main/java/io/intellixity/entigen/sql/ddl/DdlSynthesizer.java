package io.intellixity.entigen.sql.ddl;

import io.intellixity.entigen.schema.EntitySchema;
import io.intellixity.entigen.schema.FieldSchema;
import io.intellixity.entigen.schema.IndexKind;
import io.intellixity.entigen.schema.IndexSpec;
import io.intellixity.entigen.schema.RelationSpec;
import io.intellixity.entigen.sql.TableRef;
import io.intellixity.entigen.sql.TableResolver;
import io.intellixity.entigen.sql.dialect.Dialect;
import io.intellixity.entigen.types.SqlType;
import io.intellixity.entigen.types.TypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Emits CREATE TABLE, index and DROP TABLE statements.\n
 *
 * Column lines: {@code <name> <type> [PRIMARY KEY | NOT NULL] [UNIQUE] [DEFAULT x] [CHECK (x)]
 * [REFERENCES ns.table(col) [ON DELETE action]]}. Array columns never get NOT NULL.
 */
public final class DdlSynthesizer {
  private static final Logger log = LoggerFactory.getLogger(DdlSynthesizer.class);
  private static final String INDENT = "    ";

  private final Dialect dialect;
  private final TableResolver tables;

  public DdlSynthesizer(Dialect dialect) {
    this(dialect, TableResolver.heuristic());
  }

  public DdlSynthesizer(Dialect dialect, TableResolver tables) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  public String createTable(EntitySchema s) {
    dialect.ensureSupported();
    TypeMapper mapper = dialect.typeMapper();
    List<String> lines = new ArrayList<>();
    for (FieldSchema f : s.allFields()) lines.add(INDENT + columnDefinition(s, f, mapper));
    return "CREATE TABLE IF NOT EXISTS " + s.tableQualifiedName() + " (\n" + String.join(",\n", lines) + "\n);\n";
  }

  /** Single-column indexes in field order, then composite indexes in declaration order. */
  public List<String> indexes(EntitySchema s) {
    dialect.ensureSupported();
    List<String> out = new ArrayList<>();
    for (FieldSchema f : s.allFields()) {
      IndexKind kind = f.column().index();
      if (kind == null) continue;
      String col = f.columnName();
      out.add("CREATE INDEX IF NOT EXISTS idx_" + s.table() + "_" + col + " ON " + s.tableQualifiedName()
          + using(kind) + " (" + col + ");\n");
    }
    for (IndexSpec idx : s.indexes()) out.add(compositeIndex(s, idx));
    return out;
  }

  public String compositeIndex(EntitySchema s, IndexSpec idx) {
    StringBuilder sql = new StringBuilder("CREATE ");
    if (idx.unique()) sql.append("UNIQUE ");
    sql.append("INDEX IF NOT EXISTS ").append(idx.resolvedName(s.table()))
        .append(" ON ").append(s.tableQualifiedName())
        .append(using(idx.kind()))
        .append(" (").append(String.join(", ", idx.columns())).append(")");
    if (idx.where() != null) sql.append(" WHERE ").append(idx.where());
    return sql.append(";\n").toString();
  }

  public String dropTable(EntitySchema s) {
    dialect.ensureSupported();
    return "DROP TABLE IF EXISTS " + s.tableQualifiedName() + " CASCADE;\n";
  }

  /** Up: table then indexes, separated by a blank line. Down: drop. */
  public Migration migration(EntitySchema s) {
    StringBuilder up = new StringBuilder(createTable(s));
    List<String> idx = indexes(s);
    if (!idx.isEmpty()) {
      up.append("\n");
      idx.forEach(up::append);
    }
    log.debug("DDL for {}: 1 table, {} indexes", s.name(), idx.size());
    return new Migration(s.name(), s.table(), up.toString(), dropTable(s));
  }

  String columnDefinition(EntitySchema s, FieldSchema f, TypeMapper mapper) {
    SqlType type = mapper.map(f.type(), f.column());
    StringBuilder sb = new StringBuilder(f.columnName()).append(' ').append(type.render());
    if (f.identity()) {
      sb.append(" PRIMARY KEY");
    } else if (!type.nullable() && !type.isArray()) {
      sb.append(" NOT NULL");
    }
    if (f.column().unique()) sb.append(" UNIQUE");
    if (f.column().defaultExpr() != null) sb.append(" DEFAULT ").append(f.column().defaultExpr());
    if (f.column().checkExpr() != null) sb.append(" CHECK (").append(f.column().checkExpr()).append(")");
    RelationSpec rel = f.relation();
    if (rel != null) {
      TableRef ref = tables.resolve(s, rel.target());
      sb.append(" REFERENCES ").append(ref.qualifiedName()).append('(').append(ref.identityColumn()).append(')');
      if (rel.onDelete() != null) sb.append(" ON DELETE ").append(rel.onDelete().sql());
    }
    return sb.toString();
  }

  private static String using(IndexKind kind) {
    return kind.usingMethod() == null ? "" : " USING " + kind.usingMethod();
  }
}
