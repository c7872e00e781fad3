package io.intellixity.entigen.sql.crud;

import io.intellixity.entigen.sql.TableResolver;

/**
 * @param defaultLimit  page size when a dynamic query omits {@code limit}
 * @param tableResolver where relation targets live
 */
public record CrudOptions(long defaultLimit, TableResolver tableResolver) {
  public static final long DEFAULT_LIMIT = 100;
  public static final CrudOptions DEFAULTS = new CrudOptions(DEFAULT_LIMIT, TableResolver.heuristic());

  public CrudOptions {
    if (defaultLimit <= 0) throw new IllegalArgumentException("defaultLimit must be positive: " + defaultLimit);
    tableResolver = tableResolver == null ? TableResolver.heuristic() : tableResolver;
  }
}
