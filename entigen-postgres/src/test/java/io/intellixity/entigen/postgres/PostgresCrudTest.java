package io.intellixity.entigen.postgres;

import io.intellixity.entigen.schema.EntitySchema;
import io.intellixity.entigen.schema.InMemorySchemaCatalog;
import io.intellixity.entigen.sql.Bind;
import io.intellixity.entigen.sql.BoundStatement;
import io.intellixity.entigen.sql.SqlStatement.ExecKind;
import io.intellixity.entigen.sql.TableResolver;
import io.intellixity.entigen.sql.crud.CrudOptions;
import io.intellixity.entigen.sql.crud.CrudStatements;
import io.intellixity.entigen.sql.crud.CrudSynthesizer;
import io.intellixity.entigen.sql.crud.EntityRows;
import io.intellixity.entigen.sql.crud.RelationQuery;
import io.intellixity.entigen.sql.crud.WritePlan;
import io.intellixity.entigen.sql.crud.WritePlan.ResultSource;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresCrudTest {
  private static final CrudSynthesizer CRUD = new CrudSynthesizer(new PostgresDialect());

  private static final String METRICS = """
      entity: Metric
      table: metrics
      soft_delete: true
      fields:
        - {name: id, type: uuid, identity: true}
        - {name: name, type: string, expose: [create, update, response], filter: like}
        - {name: value, type: f64, expose: [create, response]}
        - {name: deleted_at, type: optional<datetime>}
      """;

  private static String logs(String returning) {
    return """
        entity: LogEntry
        table: logs
        returning: %s
        fields:
          - {name: id, type: uuid, identity: true}
          - {name: message, type: string, expose: [create, update, response]}
          - {name: created_at, type: datetime, generated: true, expose: [response], column: {default: "NOW()"}}
        """.formatted(returning);
  }

  private static final String BLOG = """
      entity: User
      table: users
      has_many: [Post]
      projections:
        - {name: summary, fields: [id, email]}
      fields:
        - {name: id, type: uuid, identity: true}
        - {name: email, type: string, expose: [create, update, response], filter: eq}
      ---
      entity: Post
      table: posts
      fields:
        - {name: id, type: uuid, identity: true}
        - {name: author_id, type: uuid, expose: [create, response], relation: {target: User, on_delete: cascade}}
      """;

  @Test
  void softDeleteStatements() {
    CrudStatements crud = CRUD.synthesize(Schemas.parse(METRICS));

    assertEquals("SELECT id, name, value FROM public.metrics WHERE id = $1 AND deleted_at IS NULL", crud.findById().sql());
    assertEquals("UPDATE public.metrics SET deleted_at = NOW() WHERE id = $1 AND deleted_at IS NULL", crud.delete().sql());
    assertEquals("DELETE FROM public.metrics WHERE id = $1", crud.hardDelete().sql());
    assertEquals("UPDATE public.metrics SET deleted_at = NULL WHERE id = $1 AND deleted_at IS NOT NULL", crud.restore().sql());
    assertEquals("SELECT id, name, value FROM public.metrics WHERE deleted_at IS NULL ORDER BY id DESC LIMIT $1 OFFSET $2",
        crud.list().sql());
    assertEquals("SELECT id, name, value FROM public.metrics ORDER BY id DESC LIMIT $1 OFFSET $2", crud.listWithDeleted().sql());
    assertEquals("SELECT id, name, value FROM public.metrics WHERE id = $1", crud.findByIdWithDeleted().sql());
    assertEquals(ExecKind.UPDATE, crud.delete().execKind());
  }

  @Test
  void withoutSoftDeleteDeleteIsHard() {
    CrudStatements crud = CRUD.synthesize(Schemas.parse(logs("full")));
    assertEquals("DELETE FROM public.logs WHERE id = $1", crud.delete().sql());
    assertNull(crud.hardDelete());
    assertNull(crud.restore());
    assertNull(crud.listWithDeleted());
    assertFalse(crud.byOperation().containsKey("restore"));
  }

  @Test
  void createInsertsEveryColumnAndReturnsTheRow() {
    WritePlan create = CRUD.synthesize(Schemas.parse(METRICS)).create();
    assertEquals("INSERT INTO public.metrics (id, name, value, deleted_at) VALUES ($1, $2, $3, $4) RETURNING *",
        create.statement().sql());
    assertEquals(ExecKind.UPDATE_RETURNING, create.statement().execKind());
    assertEquals(ResultSource.RETURNED_ROW, create.resultSource());
    assertEquals(List.of("id", "name", "value", "deleted_at"), create.statement().binds().stream().map(Bind::name).toList());
  }

  @Test
  void customReturningFetchesColumnsButKeepsTheInputEntity() {
    EntitySchema s = Schemas.parse(logs("\"id, created_at\""));
    WritePlan create = CRUD.synthesize(s).create();
    assertEquals("INSERT INTO public.logs (id, message, created_at) VALUES ($1, $2, $3) RETURNING id, created_at",
        create.statement().sql());
    assertEquals(ResultSource.INPUT_ENTITY, create.resultSource());

    UUID id = UUID.randomUUID();
    Map<String, Object> written = EntityRows.newEntity(s, Map.of("message", "hello"), () -> id);
    Map<String, Object> returned = new HashMap<>();
    returned.put("id", id);
    returned.put("created_at", "2024-01-01T00:00:00Z");
    Map<String, Object> result = EntityRows.result(s, create, written, returned, null);
    assertEquals(written, result);
    assertNull(result.get("created_at"));
  }

  @Test
  void identityOnlyAndNoneReturning() {
    WritePlan idOnly = CRUD.synthesize(Schemas.parse(logs("id"))).create();
    assertTrue(idOnly.statement().sql().endsWith("VALUES ($1, $2, $3) RETURNING id"));
    assertEquals(ResultSource.INPUT_ENTITY, idOnly.resultSource());

    WritePlan none = CRUD.synthesize(Schemas.parse(logs("none"))).create();
    assertTrue(none.statement().sql().endsWith("VALUES ($1, $2, $3)"));
    assertEquals(ExecKind.UPDATE, none.statement().execKind());
  }

  @Test
  void updateReturnsRowOrRereads() {
    WritePlan full = CRUD.synthesize(Schemas.parse(logs("full"))).update();
    assertEquals("UPDATE public.logs SET message = $1 WHERE id = $2 RETURNING *", full.statement().sql());
    assertEquals(ResultSource.RETURNED_ROW, full.resultSource());
    assertNull(full.reread());

    CrudStatements none = CRUD.synthesize(Schemas.parse(logs("none")));
    assertEquals("UPDATE public.logs SET message = $1 WHERE id = $2", none.update().statement().sql());
    assertEquals(ResultSource.REREAD, none.update().resultSource());
    assertSame(none.findById(), none.update().reread());
  }

  @Test
  void writesAreOmittedWithoutExposedFields() {
    CrudStatements crud = CRUD.synthesize(Schemas.parse("""
        entity: Counter
        table: counters
        fields:
          - {name: id, type: uuid, identity: true}
          - {name: hits, type: i64, expose: [response]}
        """));
    assertNull(crud.create());
    assertNull(crud.update());
    assertNull(crud.query());
    assertEquals(List.of("find_by_id", "delete", "list"), List.copyOf(crud.byOperation().keySet()));
  }

  @Test
  void filterQueryUsesIlikeAfterTheLiveCondition() {
    BoundStatement b = CRUD.synthesize(Schemas.parse(METRICS)).query().render(Map.of("name", "cpu", "limit", 5));
    assertEquals("SELECT id, name, value FROM public.metrics WHERE deleted_at IS NULL AND name ILIKE $1 "
        + "ORDER BY id DESC LIMIT $2 OFFSET $3", b.sql());
    assertEquals(List.of("%cpu%", 5L, 0L), b.values());
  }

  @Test
  void relationsAndProjections() {
    List<EntitySchema> blog = Schemas.all(BLOG);
    CrudStatements user = CRUD.synthesize(blog.get(0));
    CrudStatements post = CRUD.synthesize(blog.get(1));

    RelationQuery posts = user.relations().get(0);
    assertEquals("find_posts", posts.operation());
    assertEquals(RelationQuery.Kind.HAS_MANY, posts.kind());
    assertEquals("SELECT * FROM public.posts WHERE user_id = $1", posts.statement().sql());

    RelationQuery author = post.relations().get(0);
    assertEquals("find_user", author.operation());
    assertEquals("SELECT * FROM public.users WHERE id = $1", author.statement().sql());
    assertEquals(Bind.Source.FOREIGN_KEY, author.statement().binds().get(0).source());

    assertEquals("SELECT id, email FROM public.users WHERE id = $1", user.projections().get("find_by_id_summary").sql());
  }

  @Test
  void catalogResolvesBackReferences() {
    List<EntitySchema> blog = Schemas.all(BLOG);
    CrudSynthesizer crud = new CrudSynthesizer(new PostgresDialect(),
        new CrudOptions(CrudOptions.DEFAULT_LIMIT, TableResolver.fromCatalog(new InMemorySchemaCatalog(blog))));
    assertEquals("SELECT * FROM public.posts WHERE author_id = $1",
        crud.synthesize(blog.get(0)).relations().get(0).statement().sql());
  }

  @Test
  void synthesisIsDeterministic() {
    EntitySchema s = Schemas.parse(METRICS);
    assertEquals(CRUD.synthesize(s).byOperation(), new CrudSynthesizer(new PostgresDialect()).synthesize(s).byOperation());
  }

  @Test
  void databaseGeneratedIdentityIsLeftOutOfTheInsert() {
    EntitySchema s = Schemas.parse("""
        entity: Ticket
        table: tickets
        fields:
          - {name: id, type: i64, identity: true, generated: true, column: {sql_type: BIGSERIAL}}
          - {name: subject, type: string, expose: [create, response]}
        """);
    WritePlan create = CRUD.synthesize(s).create();

    assertEquals("INSERT INTO public.tickets (subject) VALUES ($1) RETURNING *", create.statement().sql());
    assertEquals(ResultSource.RETURNED_ROW, create.resultSource());
    Map<String, Object> row = new HashMap<>();
    row.put("id", 42L);
    row.put("subject", "printer");
    Map<String, Object> written = EntityRows.newEntity(s, Map.of("subject", "printer"), UUID::randomUUID);
    assertEquals(42L, EntityRows.result(s, create, written, row, null).get("id"));
  }
}
