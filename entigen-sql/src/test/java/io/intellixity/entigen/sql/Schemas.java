package io.intellixity.entigen.sql;

import io.intellixity.entigen.parse.SchemaParser;
import io.intellixity.entigen.schema.EntitySchema;
import io.intellixity.entigen.yaml.YamlDeclarationLoader;

public final class Schemas {
  private Schemas() {}

  public static EntitySchema parse(String yaml) {
    return new SchemaParser().parse(new YamlDeclarationLoader().parse(yaml, "test.yaml").declarations().get(0)).orThrow();
  }
}
