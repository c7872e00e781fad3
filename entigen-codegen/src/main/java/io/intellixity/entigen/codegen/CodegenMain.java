package io.intellixity.entigen.codegen;

import io.intellixity.entigen.parse.Diagnostic;
import io.intellixity.entigen.sql.dialect.DialectRegistry;
import io.intellixity.entigen.yaml.LoadedDeclarations;
import io.intellixity.entigen.yaml.YamlDeclarationLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.*;

/**
 * CLI:
 *   CodegenMain &lt;schemaDir&gt; &lt;outDir&gt; [configFile]
 *
 * Exit status 0 on success, 1 when any entity failed, 2 on usage errors.
 */
public final class CodegenMain {
  private static final Logger log = LoggerFactory.getLogger(CodegenMain.class);

  private CodegenMain() {}

  public static void main(String[] args) throws Exception {
    int code = run(args);
    if (code != 0) System.exit(code);
  }

  public static int run(String[] args) throws Exception {
    if (args.length < 2 || args.length > 3) {
      System.err.println("Usage: CodegenMain <schemaDir> <outDir> [configFile]");
      return 2;
    }
    Path schemaDir = Paths.get(args[0]);
    Path outDir = Paths.get(args[1]);
    if (!Files.isDirectory(schemaDir)) {
      System.err.println("Not a directory: " + schemaDir);
      return 2;
    }
    CodegenConfig config = CodegenConfig.load(args.length == 3 ? Paths.get(args[2]) : null);

    LoadedDeclarations loaded = new YamlDeclarationLoader().loadDir(schemaDir);
    CompilationResult result = new SchemaCompiler(config, DialectRegistry.discover()).compile(loaded);

    for (Diagnostic d : result.allDiagnostics()) {
      if (d.isError()) log.error("{}", d);
      else log.warn("{}", d);
    }

    ArtifactWriter writer = new ArtifactWriter(outDir);
    int written = 0;
    for (CompiledEntity e : result.entities()) {
      if (e.failed() || e.schema() == null) continue;
      writer.write(e);
      written++;
    }
    if (config.emitManifest()) writer.writeManifest();

    int failed = result.entities().size() - written;
    log.info("Generated {} entities into {} ({} failed)", written, outDir, failed);
    return result.hasErrors() ? 1 : 0;
  }
}
