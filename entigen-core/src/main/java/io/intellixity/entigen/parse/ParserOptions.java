package io.intellixity.entigen.parse;

import io.intellixity.entigen.schema.DialectKind;
import io.intellixity.entigen.schema.EntitySchema;

/** Defaults applied to declarations that leave a setting out. */
public record ParserOptions(String defaultNamespace, DialectKind defaultDialect) {
  public static final ParserOptions DEFAULTS = new ParserOptions(EntitySchema.DEFAULT_NAMESPACE, DialectKind.POSTGRES);

  public ParserOptions {
    defaultNamespace = defaultNamespace == null || defaultNamespace.isBlank() ? EntitySchema.DEFAULT_NAMESPACE : defaultNamespace;
    defaultDialect = defaultDialect == null ? DialectKind.POSTGRES : defaultDialect;
  }
}
