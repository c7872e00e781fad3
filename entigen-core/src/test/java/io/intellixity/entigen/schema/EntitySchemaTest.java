package io.intellixity.entigen.schema;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class EntitySchemaTest {
  private static FieldSchema field(String name, boolean identity) {
    return new FieldSchema(name, new ScalarTypeRef(identity ? "uuid" : "string"), identity, false,
        Expose.ALL, null, null, null);
  }

  private static EntitySchema schema(List<FieldSchema> fields) {
    return new EntitySchema("User", "users", null, null, null, null, null, false, null, fields, null, null, null);
  }

  @Test
  void appliesDefaults() {
    EntitySchema s = schema(List.of(field("id", true)));
    assertEquals("public", s.schemaNamespace());
    assertEquals(DialectKind.POSTGRES, s.dialect());
    assertEquals(IdentityKind.TIME_ORDERED, s.identityKind());
    assertEquals(ReturningPolicy.FULL, s.returning());
    assertEquals(SqlLevel.FULL, s.sqlLevel());
  }

  @Test
  void requiresExactlyOneIdentity() {
    assertThrows(IllegalArgumentException.class, () -> schema(List.of(field("name", false))));
    assertThrows(IllegalArgumentException.class, () -> schema(List.of(field("a", true), field("b", true))));
  }

  @Test
  void accessorsAreImmutableSnapshots() {
    List<FieldSchema> fields = new ArrayList<>(List.of(field("id", true), field("name", false)));
    EntitySchema s = schema(fields);
    fields.add(field("late", false));

    assertEquals(2, s.allFields().size());
    assertThrows(UnsupportedOperationException.class, () -> s.allFields().add(field("x", false)));
    assertThrows(UnsupportedOperationException.class, () -> s.createFields().clear());
    assertThrows(UnsupportedOperationException.class, () -> s.responseFields().clear());
  }

  @Test
  void softDeleteColumnFollowsCustomColumnName() {
    FieldSchema marker = new FieldSchema("deleted_at", new OptionalTypeRef(new ScalarTypeRef("datetime")), false, false,
        Expose.NONE, null, new ColumnOverrides(false, null, null, null, null, null, false, "removed_on"), null);
    EntitySchema s = schema(List.of(field("id", true), marker));
    assertEquals("removed_on", s.softDeleteColumn());
    assertEquals("deleted_at", schema(List.of(field("id", true))).softDeleteColumn());
  }
}
