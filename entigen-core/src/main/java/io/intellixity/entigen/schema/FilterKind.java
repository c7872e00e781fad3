package io.intellixity.entigen.schema;

import java.util.List;
import java.util.Locale;

public enum FilterKind {
  NONE,
  EQ,
  LIKE,
  RANGE;

  /** Parses eq/like/range; null for anything else. */
  public static FilterKind fromToken(String token) {
    if (token == null) return null;
    return switch (token.trim().toLowerCase(Locale.ROOT)) {
      case "eq" -> EQ;
      case "like" -> LIKE;
      case "range" -> RANGE;
      default -> null;
    };
  }

  public static List<String> tokens() {
    return List.of("eq", "like", "range");
  }
}
