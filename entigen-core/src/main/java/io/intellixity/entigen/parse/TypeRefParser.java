package io.intellixity.entigen.parse;

import io.intellixity.entigen.schema.ListTypeRef;
import io.intellixity.entigen.schema.OptionalTypeRef;
import io.intellixity.entigen.schema.ScalarIds;
import io.intellixity.entigen.schema.ScalarTypeRef;
import io.intellixity.entigen.schema.TypeRef;

import java.util.Locale;

/** Tiny type DSL: {@code optional<T>}, {@code list<T>} and scalar ids. */
public final class TypeRefParser {
  private TypeRefParser() {}

  /** @throws IllegalArgumentException on malformed syntax */
  public static TypeRef parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("type is blank");
    s = s.trim();

    int lt = s.indexOf('<');
    if (lt < 0) {
      if (s.indexOf('>') >= 0) throw new IllegalArgumentException("unbalanced '>' in type: " + s);
      if (!s.matches("[A-Za-z_][A-Za-z0-9_]*")) throw new IllegalArgumentException("invalid scalar type: " + s);
      return new ScalarTypeRef(ScalarIds.canonical(s));
    }
    if (!s.endsWith(">")) throw new IllegalArgumentException("type must close with '>': " + s);

    String wrapper = s.substring(0, lt).trim().toLowerCase(Locale.ROOT);
    String inside = s.substring(lt + 1, s.length() - 1);
    checkBalanced(inside, s);
    return switch (wrapper) {
      case "optional" -> new OptionalTypeRef(parse(inside));
      case "list" -> new ListTypeRef(parse(inside));
      default -> throw new IllegalArgumentException("unknown type wrapper '" + wrapper + "' (allowed: optional, list): " + s);
    };
  }

  private static void checkBalanced(String inside, String whole) {
    int depth = 0;
    for (int i = 0; i < inside.length(); i++) {
      char c = inside.charAt(i);
      if (c == '<') depth++;
      else if (c == '>' && --depth < 0) throw new IllegalArgumentException("unbalanced '>' in type: " + whole);
    }
    if (depth != 0) throw new IllegalArgumentException("unbalanced '<' in type: " + whole);
  }
}
