package io.intellixity.entigen.codegen;

import io.intellixity.entigen.parse.Diagnostic;
import io.intellixity.entigen.parse.EntityDeclaration;
import io.intellixity.entigen.parse.ParseResult;
import io.intellixity.entigen.parse.SchemaParser;
import io.intellixity.entigen.schema.EntitySchema;
import io.intellixity.entigen.schema.InMemorySchemaCatalog;
import io.intellixity.entigen.schema.SchemaCatalog;
import io.intellixity.entigen.schema.SqlLevel;
import io.intellixity.entigen.sql.TableResolver;
import io.intellixity.entigen.sql.UnsupportedDialectException;
import io.intellixity.entigen.sql.crud.CrudOptions;
import io.intellixity.entigen.sql.crud.CrudStatements;
import io.intellixity.entigen.sql.crud.CrudSynthesizer;
import io.intellixity.entigen.sql.ddl.DdlSynthesizer;
import io.intellixity.entigen.sql.ddl.Migration;
import io.intellixity.entigen.sql.dialect.Dialect;
import io.intellixity.entigen.sql.dialect.DialectRegistry;
import io.intellixity.entigen.surface.AccessSurface;
import io.intellixity.entigen.surface.AccessSurfaceBuilder;
import io.intellixity.entigen.yaml.LoadedDeclarations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Compiles a batch of declarations: parse all, build the catalog from the valid ones, then
 * synthesize surfaces, statements and migrations per entity.\n
 *
 * One failing entity never stops the others.
 */
public final class SchemaCompiler {
  private static final Logger log = LoggerFactory.getLogger(SchemaCompiler.class);

  private final CodegenConfig config;
  private final DialectRegistry dialects;

  public SchemaCompiler(CodegenConfig config, DialectRegistry dialects) {
    this.config = Objects.requireNonNull(config, "config");
    this.dialects = Objects.requireNonNull(dialects, "dialects");
  }

  public CompilationResult compile(LoadedDeclarations loaded) {
    List<Diagnostic> batch = new ArrayList<>(loaded.diagnostics());
    SchemaParser parser = new SchemaParser(config.parserOptions());

    List<Parsed> parsed = new ArrayList<>();
    Map<String, String> firstOrigin = new HashMap<>();
    List<EntitySchema> valid = new ArrayList<>();
    for (EntityDeclaration decl : loaded.declarations()) {
      ParseResult r = parser.parse(decl);
      if (r.isValid()) {
        String prev = firstOrigin.putIfAbsent(r.schema().name(), decl.origin());
        if (prev != null) {
          batch.add(new Diagnostic(Diagnostic.Severity.ERROR, decl.origin(), r.schema().name(),
              "entity " + r.schema().name() + " is already declared in " + prev));
          continue;
        }
        valid.add(r.schema());
      }
      parsed.add(new Parsed(decl.origin(), r));
    }

    SchemaCatalog catalog = new InMemorySchemaCatalog(valid);
    TableResolver resolver = config.resolveRelationTables() ? TableResolver.fromCatalog(catalog) : TableResolver.heuristic();
    CrudOptions crudOptions = new CrudOptions(config.queryDefaultLimit(), resolver);

    List<CompiledEntity> out = new ArrayList<>();
    for (Parsed p : parsed) {
      ParseResult r = p.result();
      if (!r.isValid()) {
        out.add(new CompiledEntity(r.entityName(), p.origin(), null, null, null, null, r.diagnostics()));
        continue;
      }
      out.add(compileEntity(r, p.origin(), crudOptions, resolver));
    }
    log.debug("Compiled {} declarations, {} valid", parsed.size(), valid.size());
    return new CompilationResult(out, batch);
  }

  private CompiledEntity compileEntity(ParseResult r, String origin, CrudOptions crudOptions, TableResolver resolver) {
    EntitySchema s = r.schema();
    List<Diagnostic> diags = new ArrayList<>(r.diagnostics());
    AccessSurface surface = AccessSurfaceBuilder.build(s);
    if (s.sqlLevel() == SqlLevel.NONE) {
      return new CompiledEntity(s.name(), origin, s, surface, null, null, diags);
    }

    Dialect dialect;
    CrudStatements crud = null;
    try {
      dialect = dialects.forKind(s.dialect());
      if (s.sqlLevel() == SqlLevel.FULL) crud = new CrudSynthesizer(dialect, crudOptions).synthesize(s);
    } catch (UnsupportedDialectException | IllegalArgumentException e) {
      diags.add(new Diagnostic(Diagnostic.Severity.ERROR, origin, s.name() + ".dialect", e.getMessage()));
      return new CompiledEntity(s.name(), origin, s, surface, null, null, diags);
    }

    Migration migration = null;
    try {
      migration = new DdlSynthesizer(dialect, resolver).migration(s);
    } catch (UnsupportedDialectException e) {
      log.debug("No migration for {}: {}", s.name(), e.getMessage());
    }
    return new CompiledEntity(s.name(), origin, s, surface, crud, migration, diags);
  }

  private record Parsed(String origin, ParseResult result) {}
}
