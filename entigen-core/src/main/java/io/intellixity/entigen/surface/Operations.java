package io.intellixity.entigen.surface;

import io.intellixity.entigen.util.Naming;

/** Repository operation names shared by the access surface and the SQL catalogs. */
public final class Operations {
  public static final String CREATE = "create";
  public static final String FIND_BY_ID = "find_by_id";
  public static final String UPDATE = "update";
  public static final String DELETE = "delete";
  public static final String LIST = "list";
  public static final String QUERY = "query";
  public static final String HARD_DELETE = "hard_delete";
  public static final String RESTORE = "restore";
  public static final String FIND_BY_ID_WITH_DELETED = "find_by_id_with_deleted";
  public static final String LIST_WITH_DELETED = "list_with_deleted";

  private Operations() {}

  /** Belongs-to lookup, e.g. {@code find_organization}. */
  public static String findRelated(String target) {
    return "find_" + Naming.snakeCase(target);
  }

  /** One-to-many lookup, e.g. {@code find_posts}. */
  public static String findMany(String target) {
    return "find_" + Naming.pluralize(Naming.snakeCase(target));
  }

  /** Projection read, e.g. {@code find_by_id_public}. */
  public static String findProjection(String projection) {
    return "find_by_id_" + Naming.snakeCase(projection);
  }
}
