package io.intellixity.dynattr.query;

import java.util.Locale;

public enum Operator {
  EQ("="),
  NE("!="),
  LT("<"),
  GT(">"),
  LE("<="),
  GE(">="),

  LIKE("LIKE"),
  IN("IN"),
  BETWEEN("BETWEEN"),

  NULL("NULL"),
  NOT_NULL("NOT NULL");

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() { return symbol; }

  public boolean isNullCheck() {
    return this == NULL || this == NOT_NULL;
  }

  public boolean isComparison() {
    return switch (this) {
      case EQ, NE, LT, GT, LE, GE -> true;
      default -> false;
    };
  }

  /** Accepts symbols, enum names and the usual aliases ({@code <>}, {@code ilike}, {@code is null}, ...). */
  public static Operator parse(String s) {
    if (s == null) return EQ;
    String norm = s.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    return switch (norm) {
      case "", "=", "==", "eq" -> EQ;
      case "!=", "<>", "ne" -> NE;
      case "<", "lt" -> LT;
      case ">", "gt" -> GT;
      case "<=", "le", "lte" -> LE;
      case ">=", "ge", "gte" -> GE;
      case "like", "ilike" -> LIKE;
      case "in" -> IN;
      case "between", "range" -> BETWEEN;
      case "null", "is null", "is_null" -> NULL;
      case "not null", "is not null", "not_null", "is_not_null" -> NOT_NULL;
      default -> throw new QueryValidationException("Unknown operator: " + s);
    };
  }
}
