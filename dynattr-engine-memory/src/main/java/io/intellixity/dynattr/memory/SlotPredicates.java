package io.intellixity.dynattr.memory;

import io.intellixity.dynattr.model.ValueRecord;
import io.intellixity.dynattr.spi.search.SlotPredicate;

import java.util.Locale;
import java.util.regex.Pattern;

/** Evaluates {@link SlotPredicate}s against records held in memory. */
final class SlotPredicates {
  private SlotPredicates() {}

  static boolean test(SlotPredicate p, ValueRecord r) {
    Object v = p.slot().read(r);
    return switch (p.operator()) {
      case NULL -> v == null;
      case NOT_NULL -> v != null;
      case EQ -> v != null && v.equals(p.value());
      case NE -> v != null && !v.equals(p.value());
      case LT -> v != null && compare(v, p.value()) < 0;
      case GT -> v != null && compare(v, p.value()) > 0;
      case LE -> v != null && compare(v, p.value()) <= 0;
      case GE -> v != null && compare(v, p.value()) >= 0;
      case IN -> v != null && p.values().contains(v);
      case BETWEEN -> v != null && compare(v, p.lower()) >= 0 && compare(v, p.upper()) <= 0;
      case LIKE -> v != null && (p.fullText()
          ? fullText(v.toString(), String.valueOf(p.value()))
          : like(v.toString(), String.valueOf(p.value()), p.caseSensitive()));
    };
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  static int compare(Object a, Object b) {
    if (!(a instanceof Comparable ca) || b == null || !a.getClass().equals(b.getClass())) {
      throw new IllegalArgumentException("Cannot compare " + a + " with " + b);
    }
    return ca.compareTo(b);
  }

  /** SQL LIKE on {@code %term%}: {@code %} and {@code _} inside the term keep their wildcard meaning. */
  static boolean like(String value, String term, boolean caseSensitive) {
    String pattern = "%" + term + "%";
    StringBuilder regex = new StringBuilder();
    StringBuilder literal = new StringBuilder();
    for (char c : pattern.toCharArray()) {
      if (c == '%' || c == '_') {
        if (literal.length() > 0) {
          regex.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        regex.append(c == '%' ? ".*" : ".");
      } else {
        literal.append(c);
      }
    }
    if (literal.length() > 0) regex.append(Pattern.quote(literal.toString()));
    int flags = Pattern.DOTALL | (caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    return Pattern.compile(regex.toString(), flags).matcher(value).matches();
  }

  /** Every word of {@code query} occurs as a word of {@code value}, ignoring case. */
  static boolean fullText(String value, String query) {
    String haystack = " " + value.toLowerCase(Locale.ROOT).replaceAll("\\W+", " ") + " ";
    for (String word : query.toLowerCase(Locale.ROOT).split("\\W+")) {
      if (word.isEmpty()) continue;
      if (!haystack.contains(" " + word + " ")) return false;
    }
    return true;
  }
}
