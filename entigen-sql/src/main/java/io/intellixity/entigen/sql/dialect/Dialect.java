package io.intellixity.entigen.sql.dialect;

import io.intellixity.entigen.schema.DialectKind;
import io.intellixity.entigen.types.TypeMapper;

import java.util.List;

/**
 * Capability SPI consulted by the CRUD and DDL synthesizers.\n
 *
 * Implementations are discovered through {@code META-INF/entigen.factories}.
 */
public interface Dialect {
  String id();

  DialectKind kind();

  /** Fails with {@link io.intellixity.entigen.sql.UnsupportedDialectException} when the dialect has no SQL support. */
  void ensureSupported();

  /** Placeholder for the 1-based parameter {@code index}. */
  String placeholder(int index);

  /** {@code count} placeholders starting at 1, comma-separated; empty for zero. */
  String placeholders(int count);

  /** {@code a = <p1>, b = <p2>} for the given columns, numbered from 1. */
  String assignmentClause(List<String> columns);

  boolean supportsReturning();

  /** {@code " RETURNING ..."} suffix; empty when the dialect cannot return rows. */
  String returningClause(List<String> columns);

  /** Case-insensitive pattern operator. */
  String likeOperator();

  /** Expression for the current timestamp, used to stamp soft deletes. */
  String currentTimestamp();

  TypeMapper typeMapper();
}
