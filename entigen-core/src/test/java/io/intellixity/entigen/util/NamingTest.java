package io.intellixity.entigen.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class NamingTest {
  @Test
  void pluralizes() {
    assertEquals("users", Naming.pluralize("user"));
    assertEquals("statuses", Naming.pluralize("status"));
    assertEquals("matches", Naming.pluralize("match"));
    assertEquals("wishes", Naming.pluralize("wish"));
    assertEquals("boxes", Naming.pluralize("box"));
    assertEquals("categories", Naming.pluralize("category"));
    assertEquals("keys", Naming.pluralize("key"));
    assertEquals("toys", Naming.pluralize("toy"));
    assertEquals("order_items", Naming.pluralize("order_item"));
  }

  @Test
  void convertsCase() {
    assertEquals("order_item", Naming.snakeCase("OrderItem"));
    assertEquals("http_log", Naming.snakeCase("HTTPLog"));
    assertEquals("user", Naming.snakeCase("User"));
    assertEquals("already_snake", Naming.snakeCase("already_snake"));
    assertEquals("OrderItem", Naming.pascalCase("order_item"));
    assertEquals("Public", Naming.pascalCase("public"));
  }
}
