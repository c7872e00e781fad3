package io.intellixity.entigen.schema;

import java.util.List;
import java.util.Locale;

/**
 * How much SQL is generated for an entity.\n
 *
 * {@link #TRAIT} produces only the access surface, which is how entities on an unimplemented
 * dialect are handled.
 */
public enum SqlLevel {
  FULL,
  TRAIT,
  NONE;

  public static SqlLevel fromToken(String token) {
    if (token == null) return null;
    return switch (token.trim().toLowerCase(Locale.ROOT)) {
      case "full" -> FULL;
      case "trait", "interface" -> TRAIT;
      case "none" -> NONE;
      default -> null;
    };
  }

  public static List<String> tokens() {
    return List.of("full", "trait", "interface", "none");
  }
}
