package io.intellixity.entigen.schema;

/** Raw exposure flags as declared. {@code skip} overrides every other flag. */
public record Expose(boolean create, boolean update, boolean response, boolean skip) {
  public static final Expose NONE = new Expose(false, false, false, false);
  public static final Expose ALL = new Expose(true, true, true, false);
}
