package io.intellixity.entigen.codegen;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class CodegenMainTest {
  private static final String USERS = """
      entity: User
      table: users
      soft_delete: true
      fields:
        - {name: id, type: uuid, identity: true}
        - {name: email, type: string, expose: [create, update, response], filter: eq, column: {index: true}}
        - {name: deleted_at, type: optional<datetime>}
      """;

  @TempDir
  Path dir;

  private Path schemas(String... docs) throws Exception {
    Path in = Files.createDirectories(dir.resolve("schemas"));
    for (int i = 0; i < docs.length; i++) Files.writeString(in.resolve("e" + i + ".yaml"), docs[i]);
    return in;
  }

  @Test
  void writesArtifactsAndManifest() throws Exception {
    Path in = schemas(USERS);
    Path out = dir.resolve("out");

    assertEquals(0, CodegenMain.run(new String[]{in.toString(), out.toString()}));

    String up = Files.readString(out.resolve("migrations/users.up.sql"));
    assertTrue(up.startsWith("CREATE TABLE IF NOT EXISTS public.users (\n"));
    assertTrue(up.contains("CREATE INDEX IF NOT EXISTS idx_users_email ON public.users (email);"));
    assertEquals("DROP TABLE IF EXISTS public.users CASCADE;\n", Files.readString(out.resolve("migrations/users.down.sql")));

    String sql = Files.readString(out.resolve("statements/User.sql"));
    assertTrue(sql.contains("-- name: delete :update\n-- 1: id (identity)\n"
        + "UPDATE public.users SET deleted_at = NOW() WHERE id = $1 AND deleted_at IS NULL;"));
    assertTrue(sql.contains("-- name: query :dynamic"));

    ObjectMapper json = new ObjectMapper();
    JsonNode statements = json.readTree(out.resolve("statements/User.json").toFile());
    assertEquals("postgres", statements.get("dialect").asText());
    assertEquals("create", statements.get("statements").get(0).get("operation").asText());
    assertEquals("RETURNED_ROW", statements.get("statements").get(0).get("result").asText());

    JsonNode surface = json.readTree(out.resolve("surface/User.json").toFile());
    assertEquals("User", surface.get("entity").asText());

    JsonNode manifest = json.readTree(out.resolve(ArtifactWriter.MANIFEST).toFile());
    assertEquals("entigen", manifest.get("generator").asText());
    assertEquals(5, manifest.get("artifacts").size());
    assertEquals(64, manifest.get("artifacts").get(0).get("sha256").asText().length());
  }

  @Test
  void reRunsProduceIdenticalOutput() throws Exception {
    Path in = schemas(USERS);
    Path a = dir.resolve("a");
    Path b = dir.resolve("b");
    assertEquals(0, CodegenMain.run(new String[]{in.toString(), a.toString()}));
    assertEquals(0, CodegenMain.run(new String[]{in.toString(), b.toString()}));
    assertEquals(Files.readString(a.resolve(ArtifactWriter.MANIFEST)), Files.readString(b.resolve(ArtifactWriter.MANIFEST)));
  }

  @Test
  void failingEntityExitsWithOneButOthersAreWritten() throws Exception {
    Path in = schemas(USERS, """
        entity: Broken
        table: broken
        fields:
          - {name: id, type: uuid, identity: true}
          - {name: x, type: "list<i32"}
        """);
    Path out = dir.resolve("out");

    assertEquals(1, CodegenMain.run(new String[]{in.toString(), out.toString()}));
    assertTrue(Files.exists(out.resolve("migrations/users.up.sql")));
    assertFalse(Files.exists(out.resolve("migrations/broken.up.sql")));
  }

  @Test
  void configCanDisableTheManifest() throws Exception {
    Path in = schemas(USERS);
    Path config = Files.writeString(dir.resolve("entigen.yaml"), "emit_manifest: false\n");
    Path out = dir.resolve("out");

    assertEquals(0, CodegenMain.run(new String[]{in.toString(), out.toString(), config.toString()}));
    assertTrue(Files.exists(out.resolve("surface/User.json")));
    assertFalse(Files.exists(out.resolve(ArtifactWriter.MANIFEST)));
  }

  @Test
  void usageErrors() throws Exception {
    assertEquals(2, CodegenMain.run(new String[0]));
    assertEquals(2, CodegenMain.run(new String[]{dir.resolve("nope").toString(), dir.resolve("out").toString()}));
  }
}
