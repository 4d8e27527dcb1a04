package io.intellixity.dynattr.jdbc;

import java.time.LocalDate;

/**
 * A positional bind value with the type id the dialect binds it as.\n
 *
 * Type ids: {@code string}, {@code double}, {@code long}, {@code bool}, {@code date}, {@code json}.
 */
public record Bind(Object value, String typeId) {
  public static final String STRING = "string";
  public static final String DOUBLE = "double";
  public static final String LONG = "long";
  public static final String BOOL = "bool";
  public static final String DATE = "date";
  public static final String JSON = "json";

  public static Bind string(String v) { return new Bind(v, STRING); }
  public static Bind number(Double v) { return new Bind(v, DOUBLE); }
  public static Bind id(long v) { return new Bind(v, LONG); }
  public static Bind bool(Boolean v) { return new Bind(v, BOOL); }
  public static Bind date(LocalDate v) { return new Bind(v, DATE); }
  public static Bind json(String v) { return new Bind(v, JSON); }
}
