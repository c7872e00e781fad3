package io.intellixity.entigen.sql;

import java.util.Objects;

/**
 * One entry of a statement's bind plan.\n
 *
 * @param name   field (or pseudo-field such as {@code limit}) whose value fills the placeholder
 * @param source where the caller takes that value from
 */
public record Bind(String name, Source source) {
  public enum Source {
    /** Value of the named field in the entity or write payload. */
    FIELD,
    /** The identity argument of the operation. */
    IDENTITY,
    /** Foreign key value read from the already loaded entity. */
    FOREIGN_KEY,
    /** Equality filter value. */
    FILTER,
    /** LIKE filter value, escaped and wrapped in {@code %...%}. */
    FILTER_PATTERN,
    /** Lower bound of a range filter, from {@code <field>_from}. */
    RANGE_FROM,
    /** Upper bound of a range filter, from {@code <field>_to}. */
    RANGE_TO,
    LIMIT,
    OFFSET
  }

  public Bind {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(source, "source");
  }

  public static Bind field(String name) {
    return new Bind(name, Source.FIELD);
  }

  public static Bind identity(String name) {
    return new Bind(name, Source.IDENTITY);
  }
}
