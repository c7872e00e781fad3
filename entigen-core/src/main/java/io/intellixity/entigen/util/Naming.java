package io.intellixity.entigen.util;

import java.util.Locale;

/** Identifier conventions shared by the synthesizers. */
public final class Naming {
  private Naming() {}

  /** {@code OrderItem -> order_item}, {@code HTTPLog -> http_log}. */
  public static String snakeCase(String name) {
    StringBuilder sb = new StringBuilder(name.length() + 4);
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isUpperCase(c)) {
        boolean prevLower = i > 0 && (Character.isLowerCase(name.charAt(i - 1)) || Character.isDigit(name.charAt(i - 1)));
        boolean nextLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
        boolean prevUpper = i > 0 && Character.isUpperCase(name.charAt(i - 1));
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '_' && (prevLower || (prevUpper && nextLower))) {
          sb.append('_');
        }
        sb.append(Character.toLowerCase(c));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  /** {@code order_item -> OrderItem}. */
  public static String pascalCase(String name) {
    StringBuilder sb = new StringBuilder(name.length());
    boolean upper = true;
    for (char c : name.toCharArray()) {
      if (c == '_' || c == '-' || c == ' ') {
        upper = true;
        continue;
      }
      sb.append(upper ? Character.toUpperCase(c) : c);
      upper = false;
    }
    return sb.toString();
  }

  /**
   * English plural heuristic: s/x/z/ch/sh take "es", consonant+y becomes "ies", everything else
   * takes "s".\n
   *
   * Lossy by nature ("person" becomes "persons"); declare the table explicitly when it matters.
   */
  public static String pluralize(String word) {
    String w = word.toLowerCase(Locale.ROOT);
    if (w.endsWith("s") || w.endsWith("x") || w.endsWith("z") || w.endsWith("ch") || w.endsWith("sh")) {
      return word + "es";
    }
    if (w.length() > 1 && w.endsWith("y") && !isVowel(w.charAt(w.length() - 2))) {
      return word.substring(0, word.length() - 1) + "ies";
    }
    return word + "s";
  }

  private static boolean isVowel(char c) {
    return c == 'a' || c == 'e' || c == 'i' || c == 'o' || c == 'u';
  }
}
