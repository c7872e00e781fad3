package io.intellixity.entigen.schema;

import java.util.List;
import java.util.Locale;

/** How identity values are generated for new rows. */
public enum IdentityKind {
  /** UUID version 7. */
  TIME_ORDERED,
  /** UUID version 4. */
  RANDOM;

  public static IdentityKind fromToken(String token) {
    if (token == null) return null;
    return switch (token.trim().toLowerCase(Locale.ROOT)) {
      case "v7", "7", "time_ordered" -> TIME_ORDERED;
      case "v4", "4", "random" -> RANDOM;
      default -> null;
    };
  }

  public static List<String> tokens() {
    return List.of("v7", "7", "time_ordered", "v4", "4", "random");
  }
}
