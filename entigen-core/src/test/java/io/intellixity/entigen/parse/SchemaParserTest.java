package io.intellixity.entigen.parse;

import io.intellixity.entigen.schema.*;
import io.intellixity.entigen.yaml.YamlDeclarationLoader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaParserTest {
  private static ParseResult parse(String yaml) {
    List<EntityDeclaration> decls = new YamlDeclarationLoader().parse(yaml, "test.yaml").declarations();
    assertEquals(1, decls.size());
    return new SchemaParser().parse(decls.get(0));
  }

  private static boolean hasError(ParseResult r, String location, String fragment) {
    return r.errors().stream().anyMatch(d -> d.location().equals(location) && d.message().contains(fragment));
  }

  @Test
  void parsesFullDeclaration() {
    ParseResult r = parse("""
        entity: User
        table: users
        schema_namespace: core
        identity_generation: v4
        returning: id
        has_many: [Post]
        fields:
          - name: id
            type: uuid
            identity: true
          - name: email
            type: string
            expose: [create, update, response]
            filter: like
            column: {unique: true, varchar: 255}
          - name: org_id
            type: uuid
            expose: [create, response]
            relation: {target: Organization, on_delete: set_null}
          - name: created_at
            type: datetime
            generated: true
            expose: [response]
        """);

    assertTrue(r.isValid(), () -> r.diagnostics().toString());
    EntitySchema s = r.schema();
    assertEquals("core.users", s.tableQualifiedName());
    assertEquals(IdentityKind.RANDOM, s.identityKind());
    assertEquals(ReturningPolicy.IDENTITY_ONLY, s.returning());
    assertEquals(List.of("Post"), s.oneToManyTargets());
    assertEquals("id", s.identityField().name());

    FieldSchema email = s.field("email");
    assertEquals(FilterKind.LIKE, email.filter());
    assertTrue(email.column().unique());
    assertEquals(255, email.column().varcharLength());

    FieldSchema org = s.field("org_id");
    assertEquals(new RelationSpec("Organization", ReferentialAction.SET_NULL), org.relation());
  }

  @Test
  void writeSetsNeverContainIdentityOrGenerated() {
    ParseResult r = parse("""
        entity: Item
        table: items
        fields:
          - {name: id, type: uuid, identity: true, expose: [create, update, response]}
          - {name: title, type: string, expose: [create, update, response]}
          - {name: stamp, type: datetime, generated: true, expose: [create, update]}
        """);

    EntitySchema s = r.orThrow();
    assertEquals(List.of("title"), s.createFields().stream().map(FieldSchema::name).toList());
    assertEquals(List.of("title"), s.updateFields().stream().map(FieldSchema::name).toList());
    assertEquals(2, r.warnings().size(), () -> r.warnings().toString());
  }

  @Test
  void responseAlwaysContainsIdentity() {
    EntitySchema s = parse("""
        entity: Tag
        table: tags
        fields:
          - {name: id, type: uuid, identity: true}
          - {name: label, type: string, expose: [create]}
        """).orThrow();

    assertEquals(List.of("id"), s.responseFields().stream().map(FieldSchema::name).toList());
  }

  @Test
  void skipSilentlyOverridesOtherFlags() {
    ParseResult r = parse("""
        entity: Secret
        table: secrets
        fields:
          - {name: id, type: uuid, identity: true}
          - {name: hash, type: string, expose: [create, update, response, skip]}
        """);

    EntitySchema s = r.orThrow();
    assertTrue(s.createFields().isEmpty());
    assertTrue(s.updateFields().isEmpty());
    assertEquals(1, s.responseFields().size());
    assertTrue(r.diagnostics().isEmpty());
  }

  @Test
  void rejectsMissingIdentity() {
    ParseResult r = parse("""
        entity: Note
        table: notes
        fields:
          - {name: body, type: string}
        """);

    assertFalse(r.isValid());
    assertTrue(hasError(r, "Note.fields", "found none"));
  }

  @Test
  void rejectsTwoIdentities() {
    ParseResult r = parse("""
        entity: Pair
        table: pairs
        fields:
          - {name: a, type: uuid, identity: true}
          - {name: b, type: uuid, identity: true}
        """);

    assertTrue(hasError(r, "Pair.fields", "found 2 [a, b]"));
    SchemaValidationException ex = assertThrows(SchemaValidationException.class, r::orThrow);
    assertEquals(1, ex.diagnostics().size());
  }

  @Test
  void collectsEveryErrorInOnePass() {
    ParseResult r = parse("""
        entity: Broken
        dialect: oracle
        colour: blue
        fields:
          - {name: id, type: uuid, identity: true}
          - {name: id, type: string}
          - {name: score, type: "list<i32", filter: between}
          - {name: tag, type: string, column: {index: bitmap, varchar: -3, size: 3}}
          - {name: owner, type: uuid, relation: {target: User, on_delete: explode}}
        """);

    assertFalse(r.isValid());
    assertTrue(hasError(r, "Broken.table", "required"));
    assertTrue(hasError(r, "Broken.dialect", "allowed: postgres"));
    assertTrue(hasError(r, "Broken.colour", "unknown option 'colour'"));
    assertTrue(hasError(r, "Broken.fields[id]", "duplicate field name"));
    assertTrue(hasError(r, "Broken.fields[score].type", "must close"));
    assertTrue(hasError(r, "Broken.fields[score].filter", "allowed: eq, like, range"));
    assertTrue(hasError(r, "Broken.fields[tag].column.index", "unknown index type 'bitmap'"));
    assertTrue(hasError(r, "Broken.fields[tag].column.varchar", "positive integer"));
    assertTrue(hasError(r, "Broken.fields[tag].column.size", "unknown option 'size'"));
    assertTrue(hasError(r, "Broken.fields[owner].relation.on_delete", "unknown referential action"));
    assertTrue(r.errors().stream().allMatch(d -> d.origin().equals("test.yaml")));
  }

  @Test
  void unknownScalarIsWarningOnly() {
    ParseResult r = parse("""
        entity: Geo
        table: geos
        fields:
          - {name: id, type: uuid, identity: true}
          - {name: shape, type: polygon}
        """);

    assertTrue(r.isValid());
    assertEquals(1, r.warnings().size());
    assertEquals("Geo.fields[shape].type", r.warnings().get(0).location());
  }

  @Test
  void softDeleteWithoutMarkerWarns() {
    ParseResult r = parse("""
        entity: Metric
        table: metrics
        soft_delete: true
        fields:
          - {name: id, type: uuid, identity: true}
        """);

    assertTrue(r.isValid());
    assertTrue(r.warnings().stream().anyMatch(d -> d.location().equals("Metric.soft_delete")));
  }

  @Test
  void softDeleteWithRequiredMarkerWarns() {
    ParseResult r = parse("""
        entity: Metric
        table: metrics
        soft_delete: true
        fields:
          - {name: id, type: uuid, identity: true}
          - {name: deleted_at, type: datetime}
        """);

    assertTrue(r.warnings().stream().anyMatch(d -> d.location().equals("Metric.fields[deleted_at]")));
  }

  @Test
  void parsesReturningVariants() {
    String base = """
        entity: Log
        table: logs
        fields:
          - {name: id, type: uuid, identity: true}
          - {name: created_at, type: datetime, generated: true}
        """;

    assertEquals(ReturningPolicy.NONE, parse(base + "returning: NONE\n").orThrow().returning());
    assertEquals(new ReturningPolicy.Custom(List.of("id", "created_at")),
        parse(base + "returning: \"id, created_at\"\n").orThrow().returning());
    assertTrue(hasError(parse(base + "returning: \" , \"\n"), "Log.returning", "at least one column"));
  }

  @Test
  void columnAcceptsFlagList() {
    EntitySchema s = parse("""
        entity: Doc
        table: docs
        fields:
          - {name: id, type: uuid, identity: true}
          - name: body
            type: json
            column: [index, {index: gin}, nullable, {name: doc_body}]
        """).orThrow();

    ColumnOverrides c = s.field("body").column();
    assertEquals(IndexKind.GIN, c.index());
    assertTrue(c.forceNullable());
    assertEquals("doc_body", s.field("body").columnName());
  }

  @Test
  void compositeAndUniqueIndexes() {
    EntitySchema s = parse("""
        entity: User
        table: users
        composite_index:
          - {columns: [name, email]}
        unique_index:
          - {columns: [email], name: users_email_key, where: "deleted_at IS NULL"}
        fields:
          - {name: id, type: uuid, identity: true}
          - {name: name, type: string}
          - {name: email, type: string}
        """).orThrow();

    assertEquals(2, s.indexes().size());
    assertEquals("idx_users_name_email", s.indexes().get(0).resolvedName("users"));
    IndexSpec uq = s.indexes().get(1);
    assertTrue(uq.unique());
    assertEquals("users_email_key", uq.resolvedName("users"));
    assertEquals("deleted_at IS NULL", uq.where());
  }

  @Test
  void projectionMustReferenceDeclaredFields() {
    ParseResult r = parse("""
        entity: User
        table: users
        projections:
          - {name: Public, fields: [id, nickname]}
        fields:
          - {name: id, type: uuid, identity: true}
        """);

    assertTrue(hasError(r, "User.projections[0].fields", "unknown field 'nickname'"));
  }

  @Test
  void appliesParserDefaults() {
    List<EntityDeclaration> decls = new YamlDeclarationLoader().parse("""
        entity: Event
        table: events
        fields:
          - {name: id, type: uuid, identity: true}
        """, "e.yaml").declarations();

    EntitySchema s = new SchemaParser(new ParserOptions("audit", DialectKind.POSTGRES)).parse(decls.get(0)).orThrow();
    assertEquals("audit.events", s.tableQualifiedName());
    assertEquals(SqlLevel.FULL, s.sqlLevel());
    assertEquals("sql", s.errorKind());
  }

  @Test
  void unimplementedDialectAtFullLevelWarns() {
    ParseResult r = parse("""
        entity: Hit
        table: hits
        dialect: ch
        fields:
          - {name: id, type: uuid, identity: true}
        """);

    assertEquals(DialectKind.CLICKHOUSE, r.orThrow().dialect());
    assertTrue(r.warnings().get(0).message().contains("sql: trait"));
  }

  @Test
  void filterNamedLikeAPagingKeyIsRejected() {
    ParseResult r = parse("""
        entity: Quota
        table: quotas
        fields:
          - {name: id, type: uuid, identity: true}
          - {name: limit, type: i64, expose: [response], filter: eq}
          - {name: offset, type: i64, expose: [response], filter: range}
        """);

    assertFalse(r.isValid());
    assertTrue(hasError(r, "Quota.fields[limit].filter", "collides with the paging key"));
    assertFalse(hasError(r, "Quota.fields[offset].filter", "collides"));
  }

  @Test
  void filterKeyCollidingWithRangeBoundIsRejected() {
    ParseResult r = parse("""
        entity: Product
        table: products
        fields:
          - {name: id, type: uuid, identity: true}
          - {name: price, type: decimal, expose: [response], filter: range}
          - {name: price_from, type: decimal, expose: [response], filter: eq}
        """);

    assertFalse(r.isValid());
    assertTrue(hasError(r, "Product.fields[price_from].filter", "collides with the filter on 'price'"));
  }

  @Test
  void identityWithoutValueOnCreateIsRejected() {
    ParseResult r = parse("""
        entity: Ticket
        table: tickets
        fields:
          - {name: id, type: i64, identity: true}
        """);

    assertTrue(hasError(r, "Ticket.fields[id].type", "mark it 'generated: true'"));
  }

  @Test
  void databaseGeneratedIdentityNeedsFullReturning() {
    EntitySchema ok = parse("""
        entity: Ticket
        table: tickets
        fields:
          - {name: id, type: i64, identity: true, generated: true, column: {sql_type: BIGSERIAL}}
        """).orThrow();
    assertTrue(ok.identityField().generated());

    ParseResult r = parse("""
        entity: Ticket
        table: tickets
        returning: id
        fields:
          - {name: id, type: i64, identity: true, generated: true}
        """);
    assertTrue(hasError(r, "Ticket.returning", "needs 'returning: full'"));
  }
}
