package io.intellixity.entigen.codegen;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.intellixity.entigen.codegen.internal.OutputFiles;
import io.intellixity.entigen.sql.Bind;
import io.intellixity.entigen.sql.SqlStatement;
import io.intellixity.entigen.sql.crud.CrudStatements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes compiled entities under an output directory:\n
 *
 * <pre>
 * migrations/&lt;table&gt;.up.sql, migrations/&lt;table&gt;.down.sql
 * statements/&lt;Entity&gt;.sql, statements/&lt;Entity&gt;.json
 * surface/&lt;Entity&gt;.json
 * manifest.json
 * </pre>
 */
public final class ArtifactWriter {
  private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);
  static final String MANIFEST = "manifest.json";

  private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private final Path outDir;
  private final List<GenerationManifest.Artifact> artifacts = new ArrayList<>();

  public ArtifactWriter(Path outDir) {
    this.outDir = outDir;
  }

  public void write(CompiledEntity e) throws IOException {
    if (e.failed() || e.schema() == null) return;

    if (e.migration() != null) {
      record(OutputFiles.write(outDir, "migrations/" + e.migration().table() + ".up.sql", e.migration().up()), "migration-up", e);
      record(OutputFiles.write(outDir, "migrations/" + e.migration().table() + ".down.sql", e.migration().down()), "migration-down", e);
    }
    if (e.crud() != null) {
      String dialect = e.schema().dialect().id();
      record(writeNamedQueries(e.crud(), "statements/" + e.name() + ".sql"), "statements-sql", e);
      record(OutputFiles.write(outDir, "statements/" + e.name() + ".json", json(StatementCatalog.of(e.crud(), dialect))),
          "statements-json", e);
    }
    record(OutputFiles.write(outDir, "surface/" + e.name() + ".json", json(e.surface())), "surface", e);
  }

  public Path writeManifest() throws IOException {
    Path file = OutputFiles.write(outDir, MANIFEST, json(new GenerationManifest(GenerationManifest.GENERATOR, artifacts)));
    log.debug("Manifest lists {} artifacts", artifacts.size());
    return file;
  }

  public List<GenerationManifest.Artifact> artifacts() {
    return List.copyOf(artifacts);
  }

  /** One {@code -- name: op} block per statement, followed by its bind plan. */
  private Path writeNamedQueries(CrudStatements crud, String relativePath) throws IOException {
    try (OutputFiles.LineWriter w = OutputFiles.open(outDir, relativePath)) {
      w.println("-- " + crud.entity() + " statements");
      for (Map.Entry<String, SqlStatement> e : crud.byOperation().entrySet()) {
        w.blank();
        w.println("-- name: " + e.getKey() + " :" + e.getValue().execKind().name().toLowerCase(Locale.ROOT));
        List<Bind> binds = e.getValue().binds();
        for (int i = 0; i < binds.size(); i++) {
          w.println("-- " + (i + 1) + ": " + binds.get(i).name() + " (" + binds.get(i).source().name().toLowerCase(Locale.ROOT) + ")");
        }
        w.println(e.getValue().sql() + ";");
      }
      if (crud.query() != null) {
        w.blank();
        w.println("-- name: query :dynamic");
        w.println("-- terms are emitted only for supplied values; placeholders renumber accordingly");
        w.println(crud.query().fullTemplate().sql() + ";");
      }
    }
    return outDir.resolve(relativePath);
  }

  private void record(Path file, String kind, CompiledEntity e) throws IOException {
    String rel = outDir.relativize(file).toString().replace('\\', '/');
    artifacts.add(new GenerationManifest.Artifact(rel, kind, e.name(), OutputFiles.sha256(file)));
  }

  private static String json(Object value) throws IOException {
    return JSON.writeValueAsString(value) + "\n";
  }
}
