package io.intellixity.entigen.codegen;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.intellixity.entigen.sql.Bind;
import io.intellixity.entigen.sql.SqlStatement;
import io.intellixity.entigen.sql.crud.CrudStatements;
import io.intellixity.entigen.sql.crud.FilterQuery;
import io.intellixity.entigen.sql.crud.FilterTerm;
import io.intellixity.entigen.sql.crud.WritePlan;
import io.intellixity.entigen.surface.Operations;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Serializable view of {@link CrudStatements}, written as {@code statements/<Entity>.json}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatementCatalog(String entity, String dialect, List<Entry> statements, Query query) {

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Entry(String operation, String sql, List<BindEntry> binds, String exec, String result, String reread) {}

  public record BindEntry(int position, String name, String source) {}

  public record Query(String operation, String template, List<FilterTerm> terms, long defaultLimit) {}

  public static StatementCatalog of(CrudStatements crud, String dialect) {
    List<Entry> entries = new ArrayList<>();
    for (Map.Entry<String, SqlStatement> e : crud.byOperation().entrySet()) {
      WritePlan plan = planFor(crud, e.getKey());
      entries.add(entry(e.getKey(), e.getValue(),
          plan == null ? null : plan.resultSource().name(),
          plan == null || plan.reread() == null ? null : Operations.FIND_BY_ID));
    }
    Query query = null;
    FilterQuery fq = crud.query();
    if (fq != null) query = new Query(Operations.QUERY, fq.fullTemplate().sql(), fq.terms(), fq.defaultLimit());
    return new StatementCatalog(crud.entity(), dialect, entries, query);
  }

  static List<BindEntry> binds(List<Bind> binds) {
    List<BindEntry> out = new ArrayList<>(binds.size());
    for (int i = 0; i < binds.size(); i++) {
      Bind b = binds.get(i);
      out.add(new BindEntry(i + 1, b.name(), b.source().name()));
    }
    return out;
  }

  private static Entry entry(String op, SqlStatement st, String result, String reread) {
    return new Entry(op, st.sql(), binds(st.binds()), st.execKind().name(), result, reread);
  }

  private static WritePlan planFor(CrudStatements crud, String op) {
    if (Operations.CREATE.equals(op)) return crud.create();
    if (Operations.UPDATE.equals(op)) return crud.update();
    return null;
  }
}
