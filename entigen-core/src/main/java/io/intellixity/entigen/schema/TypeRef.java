package io.intellixity.entigen.schema;

/**
 * Semantic type of a field.\n
 *
 * Wrappers nest arbitrarily, e.g. {@code optional<list<i32>>}.
 */
public sealed interface TypeRef permits ScalarTypeRef, OptionalTypeRef, ListTypeRef {

  /** True when the outermost wrapper is {@link OptionalTypeRef}. */
  default boolean isOptional() {
    return this instanceof OptionalTypeRef;
  }

  /** Strips every wrapper and returns the innermost scalar. */
  default ScalarTypeRef baseScalar() {
    TypeRef t = this;
    while (true) {
      if (t instanceof OptionalTypeRef o) t = o.inner();
      else if (t instanceof ListTypeRef l) t = l.element();
      else return (ScalarTypeRef) t;
    }
  }
}
