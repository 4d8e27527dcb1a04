package io.intellixity.dynattr.validation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Scalar coercions shared by validation, casting and search operand handling.
 * <p>
 * All parse methods return {@code null} when the input cannot be interpreted, never throw.
 */
public final class Values {
  private Values() {}

  private static final Pattern NUMERIC =
      Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  private static final List<DateTimeFormatter> DATE_PATTERNS = List.of(
      DateTimeFormatter.ISO_LOCAL_DATE,
      DateTimeFormatter.ofPattern("yyyy/MM/dd"),
      DateTimeFormatter.ofPattern("yyyy.MM.dd"),
      DateTimeFormatter.ofPattern("d MMMM uuuu", Locale.ENGLISH),
      DateTimeFormatter.ofPattern("MMMM d, uuuu", Locale.ENGLISH),
      DateTimeFormatter.ofPattern("d MMM uuuu", Locale.ENGLISH),
      DateTimeFormatter.ofPattern("MMM d, uuuu", Locale.ENGLISH)
  );

  /** Null or the empty string. Whitespace is not empty. */
  public static boolean isEmpty(Object v) {
    return v == null || (v instanceof CharSequence cs && cs.length() == 0);
  }

  public static boolean isNumeric(Object v) {
    return toDouble(v) != null;
  }

  public static Double toDouble(Object v) {
    if (v == null || v instanceof Boolean) return null;
    if (v instanceof Number n) {
      double d = n.doubleValue();
      return Double.isNaN(d) || Double.isInfinite(d) ? null : d;
    }
    if (v instanceof CharSequence cs) {
      String s = cs.toString().trim();
      if (!NUMERIC.matcher(s).matches()) return null;
      return Double.parseDouble(s);
    }
    return null;
  }

  /** Integral, non-negative value as used by length rules; {@code null} otherwise. */
  public static Long toNonNegativeInteger(Object v) {
    Long out = null;
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
      out = ((Number) v).longValue();
    } else if (v instanceof BigInteger bi && bi.bitLength() < 63) {
      out = bi.longValue();
    }
    return out == null || out < 0 ? null : out;
  }

  public static boolean isBooleanLike(Object v) {
    return toBoolean(v) != null;
  }

  /** {true, false, 1, 0, "1", "0", "true", "false"} with case-insensitive words. */
  public static Boolean toBoolean(Object v) {
    if (v instanceof Boolean b) return b;
    if (v instanceof Number n) {
      if (n instanceof Double || n instanceof Float || n instanceof BigDecimal) {
        double d = n.doubleValue();
        if (d == 1d) return true;
        if (d == 0d) return false;
        return null;
      }
      long l = n.longValue();
      if (l == 1L) return true;
      if (l == 0L) return false;
      return null;
    }
    if (v instanceof CharSequence cs) {
      String s = cs.toString().trim().toLowerCase(Locale.ROOT);
      return switch (s) {
        case "1", "true" -> true;
        case "0", "false" -> false;
        default -> null;
      };
    }
    return null;
  }

  /**
   * Calendar date for {@code v}: {@link LocalDate}, date-time values, ISO and a few common textual
   * patterns, and the words {@code today}, {@code tomorrow}, {@code yesterday} resolved on {@code clock}.
   */
  public static LocalDate toDate(Object v, Clock clock) {
    if (v == null) return null;
    if (v instanceof LocalDate d) return d;
    if (v instanceof LocalDateTime dt) return dt.toLocalDate();
    if (v instanceof OffsetDateTime odt) return odt.toLocalDate();
    if (v instanceof java.sql.Date sd) return sd.toLocalDate();
    if (v instanceof java.util.Date ud) return ud.toInstant().atZone(clock.getZone()).toLocalDate();
    if (!(v instanceof CharSequence cs)) return null;

    String s = cs.toString().trim();
    if (s.isEmpty()) return null;
    switch (s.toLowerCase(Locale.ROOT)) {
      case "today", "now": return LocalDate.now(clock);
      case "tomorrow": return LocalDate.now(clock).plusDays(1);
      case "yesterday": return LocalDate.now(clock).minusDays(1);
      default: break;
    }
    for (DateTimeFormatter f : DATE_PATTERNS) {
      try {
        return LocalDate.parse(s, f);
      } catch (DateTimeParseException ignored) {
        // next pattern
      }
    }
    try {
      return LocalDateTime.parse(s.replace(' ', 'T')).toLocalDate();
    } catch (DateTimeParseException ignored) {
      // not a local date-time
    }
    try {
      return OffsetDateTime.parse(s).toLocalDate();
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  /** Text form of a scalar; integral doubles render without a fraction ({@code 5.0 -> "5"}). */
  public static String toText(Object v) {
    if (v == null) return null;
    if (v instanceof CharSequence cs) return cs.toString();
    if (v instanceof Double || v instanceof Float || v instanceof BigDecimal) {
      if (toDouble(v) == null) return String.valueOf(v);
      BigDecimal bd = new BigDecimal(v.toString()).stripTrailingZeros();
      return bd.scale() <= 0 ? bd.toBigInteger().toString() : bd.toPlainString();
    }
    return String.valueOf(v);
  }

  /** Renders a numeric rule bound the way users wrote it ({@code 18}, not {@code 18.0}). */
  public static String formatNumber(double d) {
    return toText(d);
  }
}
