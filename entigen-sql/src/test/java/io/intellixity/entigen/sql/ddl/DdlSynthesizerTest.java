package io.intellixity.entigen.sql.ddl;

import io.intellixity.entigen.schema.EntitySchema;
import io.intellixity.entigen.sql.Schemas;
import io.intellixity.entigen.sql.dialect.PositionalDialect;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class DdlSynthesizerTest {
  private static final EntitySchema TAGS = Schemas.parse("""
      entity: Tag
      table: tags
      fields:
        - {name: id, type: uuid, identity: true}
        - {name: label, type: string, column: [unique, {check: "label <> ''"}]}
        - {name: aliases, type: list<string>}
        - {name: weight, type: i32, column: {default: "0", nullable: true}}
      """);

  @Test
  void columnLinesUseTheDialectMapper() {
    String ddl = new DdlSynthesizer(new PositionalDialect()).createTable(TAGS);
    assertEquals("""
        CREATE TABLE IF NOT EXISTS public.tags (
            id UUID PRIMARY KEY,
            label STRING NOT NULL UNIQUE CHECK (label <> ''),
            aliases STRING[],
            weight I32 DEFAULT 0
        );
        """, ddl);
  }

  @Test
  void migrationWithoutIndexesIsJustTheTable() {
    DdlSynthesizer ddl = new DdlSynthesizer(new PositionalDialect());
    Migration m = ddl.migration(TAGS);
    assertEquals(ddl.createTable(TAGS), m.up());
    assertEquals("DROP TABLE IF EXISTS public.tags CASCADE;\n", m.down());
    assertEquals("tags", m.table());
  }
}
