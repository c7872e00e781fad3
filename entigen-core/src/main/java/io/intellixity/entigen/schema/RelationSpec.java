package io.intellixity.entigen.schema;

import java.util.Objects;

/** Belongs-to relation: the field holds the identity of a {@code target} entity. */
public record RelationSpec(String target, ReferentialAction onDelete) {
  public RelationSpec {
    Objects.requireNonNull(target, "target");
    if (target.isBlank()) throw new IllegalArgumentException("relation target is blank");
  }
}
