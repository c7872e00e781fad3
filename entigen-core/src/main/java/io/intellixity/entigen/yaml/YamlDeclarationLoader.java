package io.intellixity.entigen.yaml;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.intellixity.entigen.parse.Diagnostic;
import io.intellixity.entigen.parse.EntityDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads entity declarations from YAML.\n
 *
 * One entity per YAML document; a file may hold several documents separated by {@code ---}.
 * Syntax errors are reported as diagnostics so one broken file does not hide problems in others.
 */
public final class YamlDeclarationLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlDeclarationLoader.class);
  private static final YAMLMapper YAML = new YAMLMapper();
  private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

  public LoadedDeclarations loadDir(Path dir) throws IOException {
    if (!Files.isDirectory(dir)) throw new IllegalArgumentException("Not a directory: " + dir);
    List<Path> files;
    try (Stream<Path> s = Files.walk(dir)) {
      files = s.filter(Files::isRegularFile)
          .filter(p -> {
            String n = p.getFileName().toString();
            return n.endsWith(".yaml") || n.endsWith(".yml");
          })
          .sorted()
          .toList();
    }
    LoadedDeclarations out = new LoadedDeclarations(List.of(), List.of());
    for (Path file : files) {
      out = out.merge(parse(Files.readString(file, StandardCharsets.UTF_8), dir.relativize(file).toString()));
    }
    log.debug("Loaded {} declarations from {} files under {}", out.declarations().size(), files.size(), dir);
    return out;
  }

  public LoadedDeclarations load(Path file) throws IOException {
    return parse(Files.readString(file, StandardCharsets.UTF_8), file.getFileName().toString());
  }

  public LoadedDeclarations parse(String yaml, String origin) {
    List<EntityDeclaration> decls = new ArrayList<>();
    List<Diagnostic> diags = new ArrayList<>();
    ObjectReader reader = YAML.readerFor(MAP);
    try (MappingIterator<Map<String, Object>> it = reader.readValues(yaml)) {
      int doc = 0;
      while (it.hasNextValue()) {
        Map<String, Object> body = it.nextValue();
        doc++;
        if (body == null || body.isEmpty()) continue;
        decls.add(new EntityDeclaration(origin, body));
      }
      if (doc == 0) {
        diags.add(new Diagnostic(Diagnostic.Severity.WARNING, origin, "", "document contains no entity declarations"));
      }
    } catch (JsonProcessingException e) {
      diags.add(new Diagnostic(Diagnostic.Severity.ERROR, origin, position(e.getLocation()), e.getOriginalMessage()));
    } catch (IOException e) {
      // reading from a String only fails on malformed content
      diags.add(new Diagnostic(Diagnostic.Severity.ERROR, origin, "", "unreadable YAML: " + e.getMessage()));
    }
    return new LoadedDeclarations(decls, diags);
  }

  private static String position(JsonLocation loc) {
    if (loc == null) return "";
    return "line " + loc.getLineNr() + ", column " + loc.getColumnNr();
  }
}
