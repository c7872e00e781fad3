package io.intellixity.entigen.schema;

import java.util.List;
import java.util.Locale;

public enum IndexKind {
  BTREE(null),
  HASH("hash"),
  GIN("gin"),
  GIST("gist"),
  BRIN("brin");

  private final String usingMethod;

  IndexKind(String usingMethod) {
    this.usingMethod = usingMethod;
  }

  /** Access method for {@code USING}; null for the default btree. */
  public String usingMethod() {
    return usingMethod;
  }

  public static IndexKind fromToken(String token) {
    if (token == null) return null;
    return switch (token.trim().toLowerCase(Locale.ROOT)) {
      case "btree", "b-tree" -> BTREE;
      case "hash" -> HASH;
      case "gin" -> GIN;
      case "gist" -> GIST;
      case "brin" -> BRIN;
      default -> null;
    };
  }

  public static List<String> tokens() {
    return List.of("btree", "b-tree", "hash", "gin", "gist", "brin");
  }
}
