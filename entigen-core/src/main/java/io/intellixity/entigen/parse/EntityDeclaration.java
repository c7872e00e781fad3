package io.intellixity.entigen.parse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw, unvalidated entity declaration as read from a source document.\n
 *
 * Values are plain YAML/JSON trees: strings, numbers, booleans, lists and maps.
 */
public record EntityDeclaration(String origin, Map<String, Object> body) {
  public static final String INLINE = "<inline>";

  public EntityDeclaration {
    origin = origin == null ? INLINE : origin;
    body = body == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(body));
  }

  public static EntityDeclaration inline(Map<String, Object> body) {
    return new EntityDeclaration(INLINE, body);
  }
}
