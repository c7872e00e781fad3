package io.intellixity.entigen.schema;

import java.util.List;
import java.util.Locale;

/** Foreign key {@code ON DELETE} behaviour. */
public enum ReferentialAction {
  CASCADE("CASCADE"),
  SET_NULL("SET NULL"),
  SET_DEFAULT("SET DEFAULT"),
  RESTRICT("RESTRICT"),
  NO_ACTION("NO ACTION");

  private final String sql;

  ReferentialAction(String sql) {
    this.sql = sql;
  }

  public String sql() {
    return sql;
  }

  /** Case, spaces and underscores are ignored: "set_null", "Set Null" and "setnull" are equal. */
  public static ReferentialAction fromToken(String token) {
    if (token == null) return null;
    String t = token.toLowerCase(Locale.ROOT).replace(" ", "").replace("_", "");
    return switch (t) {
      case "cascade" -> CASCADE;
      case "setnull" -> SET_NULL;
      case "setdefault" -> SET_DEFAULT;
      case "restrict" -> RESTRICT;
      case "noaction" -> NO_ACTION;
      default -> null;
    };
  }

  public static List<String> tokens() {
    return List.of("cascade", "set_null", "set_default", "restrict", "no_action");
  }
}
