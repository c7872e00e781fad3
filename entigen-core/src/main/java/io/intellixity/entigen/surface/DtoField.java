package io.intellixity.entigen.surface;

import io.intellixity.entigen.schema.TypeIds;
import io.intellixity.entigen.schema.TypeRef;

/** A named, typed member of a DTO or operation parameter list. */
public record DtoField(String name, String type) {
  public static DtoField of(String name, TypeRef type) {
    return new DtoField(name, TypeIds.id(type));
  }
}
