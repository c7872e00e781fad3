package io.intellixity.entigen.schema;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The scalar vocabulary understood by type mappers.\n
 *
 * Declarations may use aliases; {@link #canonical(String)} folds them to one id per scalar.
 */
public final class ScalarIds {
  public static final String UUID = "uuid";
  public static final String STRING = "string";
  public static final String I8 = "i8";
  public static final String I16 = "i16";
  public static final String I32 = "i32";
  public static final String I64 = "i64";
  public static final String U8 = "u8";
  public static final String U16 = "u16";
  public static final String U32 = "u32";
  public static final String U64 = "u64";
  public static final String F32 = "f32";
  public static final String F64 = "f64";
  public static final String BOOL = "bool";
  public static final String DATETIME = "datetime";
  public static final String DATE = "date";
  public static final String TIME = "time";
  public static final String NAIVE_DATETIME = "naive_datetime";
  public static final String JSON = "json";
  public static final String DECIMAL = "decimal";
  public static final String IP = "ip";
  public static final String MAC = "mac";
  public static final String BYTES = "bytes";

  private static final Set<String> KNOWN = Set.of(
      UUID, STRING, I8, I16, I32, I64, U8, U16, U32, U64, F32, F64, BOOL,
      DATETIME, DATE, TIME, NAIVE_DATETIME, JSON, DECIMAL, IP, MAC, BYTES);

  private static final Map<String, String> ALIASES = Map.ofEntries(
      Map.entry("str", STRING),
      Map.entry("text", STRING),
      Map.entry("short", I16),
      Map.entry("int", I32),
      Map.entry("integer", I32),
      Map.entry("long", I64),
      Map.entry("bigint", I64),
      Map.entry("float", F32),
      Map.entry("double", F64),
      Map.entry("boolean", BOOL),
      Map.entry("timestamptz", DATETIME),
      Map.entry("instant", DATETIME),
      Map.entry("local_date", DATE),
      Map.entry("local_time", TIME),
      Map.entry("timestamp", NAIVE_DATETIME),
      Map.entry("local_datetime", NAIVE_DATETIME),
      Map.entry("jsonb", JSON),
      Map.entry("big_decimal", DECIMAL),
      Map.entry("inet", IP),
      Map.entry("ipv4", IP),
      Map.entry("ipv6", IP),
      Map.entry("macaddr", MAC),
      Map.entry("bytea", BYTES),
      Map.entry("binary", BYTES));

  private ScalarIds() {}

  /** Lower-cases and resolves aliases; unknown ids are returned lower-cased. */
  public static String canonical(String raw) {
    String s = raw.trim().toLowerCase(Locale.ROOT);
    return ALIASES.getOrDefault(s, s);
  }

  public static boolean isKnown(String scalarId) {
    return KNOWN.contains(scalarId);
  }

  public static Set<String> known() {
    return KNOWN;
  }
}
