package io.intellixity.entigen.surface;

import java.util.List;

/** A repository method: name, parameters and result type. Errors use the entity's error kind. */
public record OperationSignature(String name, List<DtoField> params, String returns) {
  public OperationSignature {
    params = params == null ? List.of() : List.copyOf(params);
  }
}
