package io.intellixity.entigen.sql.crud;

import io.intellixity.entigen.schema.FilterKind;
import io.intellixity.entigen.sql.Bind;
import io.intellixity.entigen.sql.BoundStatement;
import io.intellixity.entigen.sql.SqlStatement;
import io.intellixity.entigen.sql.dialect.Dialect;

import java.util.*;

/**
 * Dynamic filter query.\n
 *
 * Only terms whose values are supplied are emitted; placeholders are numbered in emission order
 * and LIMIT/OFFSET always take the last two. The soft-delete condition, when present, comes
 * first and binds nothing.
 */
public final class FilterQuery {
  public static final String LIMIT = "limit";
  public static final String OFFSET = "offset";

  private final Dialect dialect;
  private final String selectFrom;
  private final String liveCondition;
  private final List<FilterTerm> terms;
  private final String orderBy;
  private final long defaultLimit;

  FilterQuery(Dialect dialect, String selectFrom, String liveCondition, List<FilterTerm> terms,
              String orderBy, long defaultLimit) {
    this.dialect = dialect;
    this.selectFrom = selectFrom;
    this.liveCondition = liveCondition;
    this.terms = List.copyOf(terms);
    this.orderBy = orderBy;
    this.defaultLimit = defaultLimit;
  }

  private final class RenderCtx {
    private int n = 1;
    private final List<Bind> binds = new ArrayList<>();
    private final List<Object> values = new ArrayList<>();

    String add(Bind b, Object value) {
      binds.add(b);
      values.add(value);
      return dialect.placeholder(n++);
    }
  }

  public List<FilterTerm> terms() {
    return terms;
  }

  public long defaultLimit() {
    return defaultLimit;
  }

  /**
   * Renders for the supplied values. Keys are field names for eq/like terms,
   * {@code <field>_from}/{@code <field>_to} for ranges, plus {@code limit} and {@code offset}.
   * Null values count as not supplied.
   */
  public BoundStatement render(Map<String, ?> values) {
    Map<String, ?> v = values == null ? Map.of() : values;
    RenderCtx ctx = new RenderCtx();
    List<String> conditions = new ArrayList<>();
    if (liveCondition != null) conditions.add(liveCondition);

    for (FilterTerm t : terms) {
      if (t.kind() == FilterKind.EQ) {
        Object value = v.get(t.field());
        if (value != null) conditions.add(t.column() + " = " + ctx.add(new Bind(t.field(), Bind.Source.FILTER), value));
      } else if (t.kind() == FilterKind.LIKE) {
        Object value = v.get(t.field());
        if (value != null) {
          String pattern = "%" + escapeLike(String.valueOf(value)) + "%";
          conditions.add(t.column() + " " + dialect.likeOperator() + " "
              + ctx.add(new Bind(t.field(), Bind.Source.FILTER_PATTERN), pattern));
        }
      } else if (t.kind() == FilterKind.RANGE) {
        Object from = v.get(t.fromKey());
        if (from != null) conditions.add(t.column() + " >= " + ctx.add(new Bind(t.field(), Bind.Source.RANGE_FROM), from));
        Object to = v.get(t.toKey());
        if (to != null) conditions.add(t.column() + " <= " + ctx.add(new Bind(t.field(), Bind.Source.RANGE_TO), to));
      }
    }

    long limit = longValue(v.get(LIMIT), defaultLimit, LIMIT);
    long offset = longValue(v.get(OFFSET), 0, OFFSET);

    StringBuilder sql = new StringBuilder(selectFrom);
    if (!conditions.isEmpty()) sql.append(" WHERE ").append(String.join(" AND ", conditions));
    sql.append(orderBy);
    sql.append(" LIMIT ").append(ctx.add(new Bind(LIMIT, Bind.Source.LIMIT), limit));
    sql.append(" OFFSET ").append(ctx.add(new Bind(OFFSET, Bind.Source.OFFSET), offset));
    return new BoundStatement(sql.toString(), ctx.binds, ctx.values);
  }

  /** The statement with every term present; what the query looks like when all filters are supplied. */
  public SqlStatement fullTemplate() {
    Map<String, Object> all = new HashMap<>();
    for (FilterTerm t : terms) {
      all.put(t.field(), "");
      all.put(t.fromKey(), "");
      all.put(t.toKey(), "");
    }
    BoundStatement b = render(all);
    return new SqlStatement(b.sql(), b.binds(), SqlStatement.ExecKind.QUERY_MANY);
  }

  /** Escapes LIKE wildcards so user input matches literally. */
  public static String escapeLike(String s) {
    return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private static long longValue(Object raw, long fallback, String name) {
    if (raw == null) return fallback;
    long value;
    if (raw instanceof Number n) {
      value = n.longValue();
    } else {
      try {
        value = Long.parseLong(String.valueOf(raw).trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(name + " must be an integer: " + raw, e);
      }
    }
    if (value < 0) throw new IllegalArgumentException(name + " must not be negative: " + value);
    return value;
  }
}
