package io.intellixity.entigen.codegen;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.intellixity.entigen.parse.ParserOptions;
import io.intellixity.entigen.schema.DialectKind;
import io.intellixity.entigen.schema.EntitySchema;
import io.intellixity.entigen.sql.crud.CrudOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Codegen settings, read from an optional YAML file.\n
 *
 * <pre>
 * default_schema_namespace: public
 * default_dialect: postgres
 * query_default_limit: 100
 * resolve_relation_tables: true
 * emit_manifest: true
 * </pre>
 */
public record CodegenConfig(
    @JsonProperty("default_schema_namespace") String defaultSchemaNamespace,
    @JsonProperty("default_dialect") String defaultDialect,
    @JsonProperty("query_default_limit") Long queryDefaultLimit,
    @JsonProperty("resolve_relation_tables") Boolean resolveRelationTables,
    @JsonProperty("emit_manifest") Boolean emitManifest
) {
  public static final CodegenConfig DEFAULTS = new CodegenConfig(null, null, null, null, null);

  private static final YAMLMapper YAML = YAMLMapper.builder()
      .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
      .build();

  public CodegenConfig {
    defaultSchemaNamespace = defaultSchemaNamespace == null || defaultSchemaNamespace.isBlank()
        ? EntitySchema.DEFAULT_NAMESPACE : defaultSchemaNamespace;
    defaultDialect = defaultDialect == null || defaultDialect.isBlank() ? DialectKind.POSTGRES.id() : defaultDialect;
    if (DialectKind.fromToken(defaultDialect) == null) {
      throw new IllegalArgumentException("Unknown default_dialect: " + defaultDialect);
    }
    queryDefaultLimit = queryDefaultLimit == null ? CrudOptions.DEFAULT_LIMIT : queryDefaultLimit;
    if (queryDefaultLimit <= 0) throw new IllegalArgumentException("query_default_limit must be positive: " + queryDefaultLimit);
    resolveRelationTables = resolveRelationTables == null ? Boolean.TRUE : resolveRelationTables;
    emitManifest = emitManifest == null ? Boolean.TRUE : emitManifest;
  }

  public static CodegenConfig load(Path file) throws IOException {
    if (file == null || !Files.exists(file)) return DEFAULTS;
    try {
      CodegenConfig c = YAML.readValue(file.toFile(), CodegenConfig.class);
      return c == null ? DEFAULTS : c;
    } catch (UnrecognizedPropertyException e) {
      throw new IllegalArgumentException("Unknown setting '" + e.getPropertyName() + "' in " + file
          + " (allowed: default_schema_namespace, default_dialect, query_default_limit, resolve_relation_tables, emit_manifest)", e);
    }
  }

  public ParserOptions parserOptions() {
    return new ParserOptions(defaultSchemaNamespace, DialectKind.fromToken(defaultDialect));
  }
}
