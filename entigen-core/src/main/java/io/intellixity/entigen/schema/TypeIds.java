package io.intellixity.entigen.schema;

/** Canonical textual ids for {@link TypeRef} shapes. */
public final class TypeIds {
  private TypeIds() {}

  /** Returns the canonical id, e.g. {@code optional<list<i32>>}. */
  public static String id(TypeRef t) {
    if (t instanceof ScalarTypeRef s) return s.scalarId();
    if (t instanceof OptionalTypeRef o) return "optional<" + id(o.inner()) + ">";
    if (t instanceof ListTypeRef l) return "list<" + id(l.element()) + ">";
    throw new IllegalArgumentException("Unknown TypeRef: " + t);
  }
}
