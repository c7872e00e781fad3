package io.intellixity.entigen.schema;

import java.util.List;
import java.util.Locale;

/** Target SQL dialect of an entity. Only {@link #POSTGRES} is implemented. */
public enum DialectKind {
  POSTGRES("postgres", List.of("postgres", "postgresql", "pg")),
  CLICKHOUSE("clickhouse", List.of("clickhouse", "ch")),
  MONGODB("mongodb", List.of("mongodb", "mongo"));

  private final String id;
  private final List<String> aliases;

  DialectKind(String id, List<String> aliases) {
    this.id = id;
    this.aliases = aliases;
  }

  public String id() {
    return id;
  }

  /** Returns null when the token names no dialect. */
  public static DialectKind fromToken(String token) {
    if (token == null) return null;
    String t = token.trim().toLowerCase(Locale.ROOT);
    for (DialectKind k : values()) {
      if (k.aliases.contains(t)) return k;
    }
    return null;
  }

  public static List<String> tokens() {
    return List.of("postgres", "postgresql", "pg", "clickhouse", "ch", "mongodb", "mongo");
  }
}
