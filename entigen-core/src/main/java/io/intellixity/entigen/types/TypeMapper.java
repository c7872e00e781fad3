package io.intellixity.entigen.types;

import io.intellixity.entigen.schema.ColumnOverrides;
import io.intellixity.entigen.schema.ListTypeRef;
import io.intellixity.entigen.schema.OptionalTypeRef;
import io.intellixity.entigen.schema.ScalarTypeRef;
import io.intellixity.entigen.schema.TypeRef;

/**
 * Maps a semantic type plus column options to a dialect column type.\n
 *
 * Resolution order: explicit SQL type, optional unwrap (nullable), list unwrap (one more array
 * dimension), scalar table. Implementations supply only the scalar table.
 */
public interface TypeMapper {

  /** Maps a bare scalar; unknown ids fall back to the dialect's text type. */
  String scalar(ScalarTypeRef scalar, ColumnOverrides column);

  default SqlType map(TypeRef type, ColumnOverrides column) {
    ColumnOverrides c = column == null ? ColumnOverrides.NONE : column;
    if (c.sqlType() != null) {
      return new SqlType(c.sqlType(), type.isOptional() || c.forceNullable(), 0);
    }
    return resolve(type, c);
  }

  private SqlType resolve(TypeRef type, ColumnOverrides c) {
    if (type instanceof OptionalTypeRef o) {
      SqlType inner = resolve(o.inner(), c);
      return new SqlType(inner.name(), true, inner.arrayDepth());
    }
    if (type instanceof ListTypeRef l) {
      SqlType inner = resolve(l.element(), c);
      return new SqlType(inner.name(), inner.nullable(), inner.arrayDepth() + 1);
    }
    return new SqlType(scalar((ScalarTypeRef) type, c), c.forceNullable(), 0);
  }
}
