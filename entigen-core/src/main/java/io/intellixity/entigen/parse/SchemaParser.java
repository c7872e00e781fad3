package io.intellixity.entigen.parse;

import io.intellixity.entigen.schema.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Validates a raw {@link EntityDeclaration} and builds the immutable {@link EntitySchema}.\n
 *
 * All cheaply discoverable problems are reported together. Warnings never block the schema; any
 * error does.
 */
public final class SchemaParser {
  private static final Logger log = LoggerFactory.getLogger(SchemaParser.class);

  static final List<String> ENTITY_KEYS = List.of(
      "entity", "table", "schema_namespace", "dialect", "sql", "identity_generation", "error_kind",
      "soft_delete", "returning", "has_many", "projections", "composite_index", "unique_index", "fields");
  static final List<String> FIELD_KEYS = List.of(
      "name", "type", "identity", "generated", "expose", "filter", "column", "relation");
  static final List<String> COLUMN_KEYS = List.of(
      "unique", "index", "default", "check", "varchar", "sql_type", "nullable", "name");
  static final List<String> EXPOSE_FLAGS = List.of("create", "update", "response", "skip");
  static final List<String> RELATION_KEYS = List.of("target", "on_delete");
  static final List<String> INDEX_KEYS = List.of("columns", "name", "type", "unique", "where");
  static final List<String> PROJECTION_KEYS = List.of("name", "fields");
  static final String FILTER_LIMIT = "limit";
  static final String FILTER_OFFSET = "offset";

  private final ParserOptions options;

  public SchemaParser() {
    this(ParserOptions.DEFAULTS);
  }

  public SchemaParser(ParserOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  public ParseResult parse(EntityDeclaration decl) {
    Objects.requireNonNull(decl, "decl");
    Diagnostics d = new Diagnostics(decl.origin());
    Map<String, Object> body = decl.body();

    String entity = string(body.get("entity"), "entity", d);
    if (entity == null || entity.isBlank()) {
      d.error("entity", "entity name is required");
      entity = null;
    }
    String at = entity == null ? "<entity>" : entity;

    for (String key : body.keySet()) {
      if (!ENTITY_KEYS.contains(key)) d.unknownOption(at, key, ENTITY_KEYS);
    }

    String table = string(body.get("table"), at + ".table", d);
    if (table == null || table.isBlank()) {
      d.error(at + ".table", "table name is required");
    }
    String namespace = string(body.get("schema_namespace"), at + ".schema_namespace", d);

    DialectKind dialect = options.defaultDialect();
    if (body.containsKey("dialect")) {
      String raw = string(body.get("dialect"), at + ".dialect", d);
      DialectKind k = DialectKind.fromToken(raw);
      if (raw != null && k == null) {
        d.error(at + ".dialect", "unknown dialect '" + raw + "' (allowed: " + String.join(", ", DialectKind.tokens()) + ")");
      }
      if (k != null) dialect = k;
    }

    SqlLevel sqlLevel = SqlLevel.FULL;
    if (body.containsKey("sql")) {
      String raw = string(body.get("sql"), at + ".sql", d);
      SqlLevel l = SqlLevel.fromToken(raw);
      if (raw != null && l == null) {
        d.error(at + ".sql", "unknown sql level '" + raw + "' (allowed: " + String.join(", ", SqlLevel.tokens()) + ")");
      }
      if (l != null) sqlLevel = l;
    }

    IdentityKind identityKind = IdentityKind.TIME_ORDERED;
    if (body.containsKey("identity_generation")) {
      String raw = string(body.get("identity_generation"), at + ".identity_generation", d);
      IdentityKind k = IdentityKind.fromToken(raw);
      if (raw != null && k == null) {
        d.error(at + ".identity_generation",
            "unknown identity generation '" + raw + "' (allowed: " + String.join(", ", IdentityKind.tokens()) + ")");
      }
      if (k != null) identityKind = k;
    }

    String errorKind = string(body.get("error_kind"), at + ".error_kind", d);
    boolean softDelete = bool(body.get("soft_delete"), at + ".soft_delete", d);
    ReturningPolicy returning = returning(body.get("returning"), at + ".returning", d);

    List<FieldSchema> fields = fields(body.get("fields"), at, d);
    List<String> hasMany = names(body.get("has_many"), at + ".has_many", d);

    Set<String> columnNames = new HashSet<>();
    for (FieldSchema f : fields) columnNames.add(f.columnName());
    List<IndexSpec> indexes = new ArrayList<>();
    indexes.addAll(indexes(body.get("composite_index"), at + ".composite_index", false, columnNames, d));
    indexes.addAll(indexes(body.get("unique_index"), at + ".unique_index", true, columnNames, d));

    List<Projection> projections = projections(body.get("projections"), at + ".projections", d);

    checkIdentity(fields, returning, at, d);
    checkFilterKeys(fields, at, d);
    checkConsistency(fields, projections, returning, softDelete, at, d);
    if (dialect != DialectKind.POSTGRES && sqlLevel == SqlLevel.FULL) {
      d.warning(at + ".dialect", dialect.id() + " SQL generation is not yet implemented; use 'sql: trait' to generate the access interface only");
    }

    if (d.hasErrors()) {
      log.debug("Declaration {} from {} rejected with {} diagnostics", at, decl.origin(), d.list().size());
      return new ParseResult(entity, null, d.list());
    }

    String ns = namespace == null || namespace.isBlank() ? options.defaultNamespace() : namespace;
    EntitySchema schema = new EntitySchema(entity, table, ns, dialect, identityKind, errorKind, sqlLevel,
        softDelete, returning, fields, hasMany, indexes, projections);
    return new ParseResult(entity, schema, d.list());
  }

  public List<ParseResult> parseAll(Collection<EntityDeclaration> decls) {
    List<ParseResult> out = new ArrayList<>(decls.size());
    for (EntityDeclaration decl : decls) out.add(parse(decl));
    return out;
  }

  // ---- fields ----

  private List<FieldSchema> fields(Object raw, String at, Diagnostics d) {
    List<FieldSchema> out = new ArrayList<>();
    if (raw == null) {
      d.error(at + ".fields", "at least one field is required");
      return out;
    }
    if (!(raw instanceof List<?> list)) {
      d.error(at + ".fields", "expected a list of fields");
      return out;
    }
    if (list.isEmpty()) d.error(at + ".fields", "at least one field is required");

    Set<String> names = new HashSet<>();
    Set<String> columns = new HashSet<>();
    for (int i = 0; i < list.size(); i++) {
      Object item = list.get(i);
      String loc = at + ".fields[" + i + "]";
      if (!(item instanceof Map<?, ?> m)) {
        d.error(loc, "expected a field mapping");
        continue;
      }
      Map<String, Object> fm = stringKeys(m);
      String name = string(fm.get("name"), loc + ".name", d);
      if (name == null || name.isBlank()) {
        d.error(loc + ".name", "field name is required");
        continue;
      }
      loc = at + ".fields[" + name + "]";
      if (!names.add(name)) {
        d.error(loc, "duplicate field name '" + name + "'");
        continue;
      }

      FieldSchema f = field(name, fm, loc, d);
      if (f == null) continue;
      if (!columns.add(f.columnName())) {
        d.error(loc + ".column.name", "column '" + f.columnName() + "' is already used by another field");
      }
      out.add(f);
    }
    return out;
  }

  private FieldSchema field(String name, Map<String, Object> fm, String loc, Diagnostics d) {
    for (String key : fm.keySet()) {
      if (!FIELD_KEYS.contains(key)) d.unknownOption(loc, key, FIELD_KEYS);
    }

    TypeRef type = null;
    String rawType = string(fm.get("type"), loc + ".type", d);
    if (rawType == null) {
      d.error(loc + ".type", "field type is required");
    } else {
      try {
        type = TypeRefParser.parse(rawType);
        ScalarTypeRef base = type.baseScalar();
        if (!base.isKnown()) {
          d.warning(loc + ".type", "unknown scalar type '" + base.scalarId() + "' will be stored as text");
        }
      } catch (IllegalArgumentException e) {
        d.error(loc + ".type", e.getMessage());
      }
    }

    boolean identity = bool(fm.get("identity"), loc + ".identity", d);
    boolean generated = bool(fm.get("generated"), loc + ".generated", d);
    Expose expose = expose(fm.get("expose"), loc + ".expose", d);
    if ((identity || generated) && (expose.create() || expose.update()) && !expose.skip()) {
      d.warning(loc + ".expose", (identity ? "identity" : "generated") + " fields are never writable; create/update ignored");
    }
    FilterKind filter = filter(fm.get("filter"), loc + ".filter", d);
    ColumnOverrides column = column(fm.get("column"), loc + ".column", d);
    RelationSpec relation = relation(fm.get("relation"), loc + ".relation", d);

    if (type == null || column == null) return null;
    return new FieldSchema(name, type, identity, generated, expose, filter, column, relation);
  }

  private Expose expose(Object raw, String loc, Diagnostics d) {
    if (raw == null) return Expose.NONE;
    if (raw instanceof Boolean b) return b ? Expose.ALL : Expose.NONE;
    boolean create = false, update = false, response = false, skip = false;
    for (String flag : names(raw, loc, d)) {
      switch (flag.toLowerCase(Locale.ROOT)) {
        case "create" -> create = true;
        case "update" -> update = true;
        case "response" -> response = true;
        case "skip" -> skip = true;
        default -> d.error(loc, "unknown expose flag '" + flag + "' (allowed: " + String.join(", ", EXPOSE_FLAGS) + ")");
      }
    }
    return new Expose(create, update, response, skip);
  }

  private FilterKind filter(Object raw, String loc, Diagnostics d) {
    if (raw == null) return FilterKind.NONE;
    if (raw instanceof Boolean b) return b ? FilterKind.EQ : FilterKind.NONE;
    String s = string(raw, loc, d);
    if (s == null) return FilterKind.NONE;
    FilterKind k = FilterKind.fromToken(s);
    if (k == null) {
      d.error(loc, "unknown filter '" + s + "' (allowed: " + String.join(", ", FilterKind.tokens()) + ")");
      return FilterKind.NONE;
    }
    return k;
  }

  /** Accepts a mapping or a flag list such as {@code [unique, {varchar: 255}]}. */
  private ColumnOverrides column(Object raw, String loc, Diagnostics d) {
    if (raw == null) return ColumnOverrides.NONE;
    Map<String, Object> opts = new LinkedHashMap<>();
    if (raw instanceof Map<?, ?> m) {
      opts.putAll(stringKeys(m));
    } else if (raw instanceof List<?> list) {
      for (Object item : list) {
        if (item instanceof Map<?, ?> m) opts.putAll(stringKeys(m));
        else if (item instanceof String s) opts.put(s.trim(), Boolean.TRUE);
        else d.error(loc, "expected a column option, got " + describe(item));
      }
    } else {
      d.error(loc, "expected a mapping or list of column options");
      return ColumnOverrides.NONE;
    }

    boolean ok = true;
    for (String key : opts.keySet()) {
      if (!COLUMN_KEYS.contains(key)) {
        d.unknownOption(loc, key, COLUMN_KEYS);
        ok = false;
      }
    }

    boolean unique = bool(opts.get("unique"), loc + ".unique", d);
    IndexKind index = null;
    Object rawIndex = opts.get("index");
    if (rawIndex instanceof Boolean b) {
      index = b ? IndexKind.BTREE : null;
    } else if (rawIndex != null) {
      String s = string(rawIndex, loc + ".index", d);
      index = IndexKind.fromToken(s);
      if (s != null && index == null) {
        d.error(loc + ".index", "unknown index type '" + s + "' (allowed: " + String.join(", ", IndexKind.tokens()) + ")");
        ok = false;
      }
    }

    Integer varchar = null;
    Object rawVarchar = opts.get("varchar");
    if (rawVarchar != null) {
      varchar = positiveInt(rawVarchar);
      if (varchar == null) {
        d.error(loc + ".varchar", "varchar length must be a positive integer, got " + describe(rawVarchar));
        ok = false;
      }
    }

    String defaultExpr = string(opts.get("default"), loc + ".default", d);
    String check = string(opts.get("check"), loc + ".check", d);
    String sqlType = string(opts.get("sql_type"), loc + ".sql_type", d);
    if (sqlType != null && sqlType.isBlank()) {
      d.error(loc + ".sql_type", "sql_type is blank");
      ok = false;
    }
    boolean nullable = bool(opts.get("nullable"), loc + ".nullable", d);
    String columnName = string(opts.get("name"), loc + ".name", d);
    if (columnName != null && columnName.isBlank()) {
      d.error(loc + ".name", "column name is blank");
      ok = false;
    }

    if (!ok) return null;
    return new ColumnOverrides(unique, index, defaultExpr, check, varchar, sqlType, nullable, columnName);
  }

  private RelationSpec relation(Object raw, String loc, Diagnostics d) {
    if (raw == null) return null;
    if (raw instanceof String s) {
      if (s.isBlank()) {
        d.error(loc, "relation target is blank");
        return null;
      }
      return new RelationSpec(s.trim(), null);
    }
    if (!(raw instanceof Map<?, ?> m)) {
      d.error(loc, "expected a target entity name or a mapping");
      return null;
    }
    Map<String, Object> rm = stringKeys(m);
    for (String key : rm.keySet()) {
      if (!RELATION_KEYS.contains(key)) d.unknownOption(loc, key, RELATION_KEYS);
    }
    String target = string(rm.get("target"), loc + ".target", d);
    if (target == null || target.isBlank()) {
      d.error(loc + ".target", "relation target is required");
      return null;
    }
    ReferentialAction onDelete = null;
    String rawAction = string(rm.get("on_delete"), loc + ".on_delete", d);
    if (rawAction != null) {
      onDelete = ReferentialAction.fromToken(rawAction);
      if (onDelete == null) {
        d.error(loc + ".on_delete",
            "unknown referential action '" + rawAction + "' (allowed: " + String.join(", ", ReferentialAction.tokens()) + ")");
        return null;
      }
    }
    return new RelationSpec(target.trim(), onDelete);
  }

  // ---- entity-level options ----

  private ReturningPolicy returning(Object raw, String loc, Diagnostics d) {
    if (raw == null) return ReturningPolicy.FULL;
    List<String> columns;
    if (raw instanceof List<?>) {
      columns = names(raw, loc, d);
    } else {
      String s = string(raw, loc, d);
      if (s == null) return ReturningPolicy.FULL;
      String t = s.trim().toLowerCase(Locale.ROOT);
      if (t.equals("full")) return ReturningPolicy.FULL;
      if (t.equals("id") || t.equals("identity")) return ReturningPolicy.IDENTITY_ONLY;
      if (t.equals("none")) return ReturningPolicy.NONE;
      columns = splitCommas(s);
    }
    if (columns.isEmpty()) {
      d.error(loc, "returning needs full, id, none or at least one column name");
      return ReturningPolicy.FULL;
    }
    return new ReturningPolicy.Custom(columns);
  }

  private List<IndexSpec> indexes(Object raw, String loc, boolean unique, Set<String> columnNames, Diagnostics d) {
    List<IndexSpec> out = new ArrayList<>();
    if (raw == null) return out;
    if (!(raw instanceof List<?> list)) {
      d.error(loc, "expected a list of indexes");
      return out;
    }
    for (int i = 0; i < list.size(); i++) {
      String iloc = loc + "[" + i + "]";
      if (!(list.get(i) instanceof Map<?, ?> m)) {
        d.error(iloc, "expected an index mapping");
        continue;
      }
      Map<String, Object> im = stringKeys(m);
      for (String key : im.keySet()) {
        if (!INDEX_KEYS.contains(key)) d.unknownOption(iloc, key, INDEX_KEYS);
      }
      List<String> columns = names(im.get("columns"), iloc + ".columns", d);
      if (columns.isEmpty()) {
        d.error(iloc + ".columns", "index needs at least one column");
        continue;
      }
      for (String c : columns) {
        if (!columnNames.contains(c)) d.warning(iloc + ".columns", "index column '" + c + "' is not a declared column");
      }
      IndexKind kind = IndexKind.BTREE;
      String rawKind = string(im.get("type"), iloc + ".type", d);
      if (rawKind != null) {
        kind = IndexKind.fromToken(rawKind);
        if (kind == null) {
          d.error(iloc + ".type", "unknown index type '" + rawKind + "' (allowed: " + String.join(", ", IndexKind.tokens()) + ")");
          continue;
        }
      }
      boolean isUnique = unique || bool(im.get("unique"), iloc + ".unique", d);
      out.add(new IndexSpec(string(im.get("name"), iloc + ".name", d), columns, kind, isUnique,
          string(im.get("where"), iloc + ".where", d)));
    }
    return out;
  }

  private List<Projection> projections(Object raw, String loc, Diagnostics d) {
    List<Projection> out = new ArrayList<>();
    if (raw == null) return out;
    if (!(raw instanceof List<?> list)) {
      d.error(loc, "expected a list of projections");
      return out;
    }
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < list.size(); i++) {
      String ploc = loc + "[" + i + "]";
      if (!(list.get(i) instanceof Map<?, ?> m)) {
        d.error(ploc, "expected a projection mapping");
        continue;
      }
      Map<String, Object> pm = stringKeys(m);
      for (String key : pm.keySet()) {
        if (!PROJECTION_KEYS.contains(key)) d.unknownOption(ploc, key, PROJECTION_KEYS);
      }
      String name = string(pm.get("name"), ploc + ".name", d);
      if (name == null || name.isBlank()) {
        d.error(ploc + ".name", "projection name is required");
        continue;
      }
      if (!seen.add(name)) {
        d.error(ploc + ".name", "duplicate projection '" + name + "'");
        continue;
      }
      List<String> pf = names(pm.get("fields"), ploc + ".fields", d);
      if (pf.isEmpty()) {
        d.error(ploc + ".fields", "projection '" + name + "' needs at least one field");
        continue;
      }
      out.add(new Projection(name, pf));
    }
    return out;
  }

  // ---- cross-field checks ----

  private static void checkIdentity(List<FieldSchema> fields, ReturningPolicy returning, String at, Diagnostics d) {
    List<String> ids = fields.stream().filter(FieldSchema::identity).map(FieldSchema::name).toList();
    if (ids.isEmpty() && !fields.isEmpty()) {
      d.error(at + ".fields", "exactly one identity field is required, found none");
    } else if (ids.size() > 1) {
      d.error(at + ".fields", "exactly one identity field is required, found " + ids.size() + " " + ids);
    }
    if (ids.size() != 1) return;

    // uuid identities are generated on create; anything else must come from the database
    FieldSchema id = fields.stream().filter(FieldSchema::identity).findFirst().orElseThrow();
    boolean uuid = id.type() instanceof ScalarTypeRef st && ScalarIds.UUID.equals(st.scalarId());
    if (id.generated()) {
      if (!(returning instanceof ReturningPolicy.Full)) {
        d.error(at + ".returning", "database-generated identity '" + id.name() + "' needs 'returning: full'");
      }
    } else if (!uuid) {
      d.error(at + ".fields[" + id.name() + "].type", "identity of type '" + TypeIds.id(id.type())
          + "' has no value on create; use uuid or mark it 'generated: true'");
    }
  }

  /** Filter values share one map with paging keys, so every key must be distinct. */
  private static void checkFilterKeys(List<FieldSchema> fields, String at, Diagnostics d) {
    Map<String, String> owner = new HashMap<>();
    owner.put(FILTER_LIMIT, "");
    owner.put(FILTER_OFFSET, "");
    for (FieldSchema f : fields) {
      if (!f.isFilterable()) continue;
      List<String> keys = f.filter() == FilterKind.RANGE
          ? List.of(f.name() + "_from", f.name() + "_to")
          : List.of(f.name());
      for (String key : keys) {
        String prev = owner.putIfAbsent(key, f.name());
        if (prev != null) {
          d.error(at + ".fields[" + f.name() + "].filter", "filter key '" + key + "' collides with "
              + (prev.isEmpty() ? "the paging key" : "the filter on '" + prev + "'"));
        }
      }
    }
  }

  private static void checkConsistency(List<FieldSchema> fields, List<Projection> projections,
                                       ReturningPolicy returning, boolean softDelete, String at, Diagnostics d) {
    Set<String> fieldNames = new HashSet<>();
    Set<String> columnNames = new HashSet<>();
    for (FieldSchema f : fields) {
      fieldNames.add(f.name());
      columnNames.add(f.columnName());
    }

    for (int i = 0; i < projections.size(); i++) {
      Projection p = projections.get(i);
      for (String pf : p.fields()) {
        if (!fieldNames.contains(pf)) {
          d.error(at + ".projections[" + i + "].fields", "projection '" + p.name() + "' references unknown field '" + pf + "'");
        }
      }
    }

    if (returning instanceof ReturningPolicy.Custom custom) {
      for (String c : custom.columns()) {
        if (!columnNames.contains(c)) d.warning(at + ".returning", "returning column '" + c + "' is not a declared column");
      }
    }

    if (softDelete) {
      FieldSchema marker = fields.stream()
          .filter(f -> f.name().equals(EntitySchema.SOFT_DELETE_FIELD))
          .findFirst().orElse(null);
      if (marker == null) {
        d.warning(at + ".soft_delete", "soft delete expects a nullable '" + EntitySchema.SOFT_DELETE_FIELD + "' field");
      } else if (!marker.type().isOptional() && !marker.column().forceNullable()) {
        d.warning(at + ".fields[" + marker.name() + "]", "soft delete marker should be optional so live rows can hold NULL");
      }
    }
  }

  // ---- scalar readers ----

  private static String string(Object raw, String loc, Diagnostics d) {
    if (raw == null) return null;
    if (raw instanceof String s) return s;
    if (raw instanceof Number || raw instanceof Boolean) return String.valueOf(raw);
    d.error(loc, "expected a string, got " + describe(raw));
    return null;
  }

  private static boolean bool(Object raw, String loc, Diagnostics d) {
    if (raw == null) return false;
    if (raw instanceof Boolean b) return b;
    if (raw instanceof String s) {
      if (s.equalsIgnoreCase("true")) return true;
      if (s.equalsIgnoreCase("false")) return false;
    }
    d.error(loc, "expected true or false, got " + describe(raw));
    return false;
  }

  /** A list of names, or one comma-separated string. */
  private static List<String> names(Object raw, String loc, Diagnostics d) {
    if (raw == null) return List.of();
    if (raw instanceof String s) return splitCommas(s);
    if (!(raw instanceof List<?> list)) {
      d.error(loc, "expected a list of names, got " + describe(raw));
      return List.of();
    }
    List<String> out = new ArrayList<>();
    for (Object item : list) {
      if (item instanceof String s && !s.isBlank()) out.add(s.trim());
      else d.error(loc, "expected a name, got " + describe(item));
    }
    return out;
  }

  private static List<String> splitCommas(String s) {
    List<String> out = new ArrayList<>();
    for (String part : s.split(",")) {
      String t = part.trim();
      if (!t.isEmpty()) out.add(t);
    }
    return out;
  }

  private static Integer positiveInt(Object raw) {
    long v;
    if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
      v = ((Number) raw).longValue();
    } else if (raw instanceof String s && s.trim().matches("\\d+")) {
      try {
        v = Long.parseLong(s.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    } else {
      return null;
    }
    return v > 0 && v <= Integer.MAX_VALUE ? (int) v : null;
  }

  private static Map<String, Object> stringKeys(Map<?, ?> m) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : m.entrySet()) out.put(String.valueOf(e.getKey()), e.getValue());
    return out;
  }

  private static String describe(Object raw) {
    if (raw == null) return "nothing";
    if (raw instanceof Map<?, ?>) return "a mapping";
    if (raw instanceof List<?>) return "a list";
    return "'" + raw + "'";
  }
}
