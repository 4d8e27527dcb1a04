package io.intellixity.dynattr.query;

import java.util.Locale;

/** How per-filter id sets combine: intersection or union. */
public enum SearchLogic {
  AND, OR;

  public static SearchLogic parse(String s) {
    if (s == null || s.isBlank()) return AND;
    return switch (s.trim().toUpperCase(Locale.ROOT)) {
      case "AND" -> AND;
      case "OR" -> OR;
      default -> throw new QueryValidationException("Unknown search logic: " + s);
    };
  }
}
