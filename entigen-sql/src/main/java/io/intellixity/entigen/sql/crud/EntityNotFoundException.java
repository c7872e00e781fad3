package io.intellixity.entigen.sql.crud;

/** The row a write plan needs to read back is gone. */
public final class EntityNotFoundException extends RuntimeException {
  public EntityNotFoundException(String message) {
    super(message);
  }
}
