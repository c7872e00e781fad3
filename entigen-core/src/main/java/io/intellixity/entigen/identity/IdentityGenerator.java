package io.intellixity.entigen.identity;

import io.intellixity.entigen.schema.IdentityKind;

import java.util.UUID;

/** Produces identity values for new entities. */
public interface IdentityGenerator {
  UUID next();

  static IdentityGenerator forKind(IdentityKind kind) {
    return switch (kind) {
      case TIME_ORDERED -> UuidGenerators.timeOrdered();
      case RANDOM -> UuidGenerators.random();
    };
  }
}
