package io.intellixity.dynattr.query;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One filter on one attribute. Operands are raw; casting to the attribute's type happens when the
 * filter is compiled against the catalog.
 */
public final class Criterion {
  private final String attribute;
  private final Operator operator;
  private final Object value;
  private final List<Object> values;
  private final Object min;
  private final Object max;
  private final LikeOptions like;

  public Criterion(String attribute, Operator operator, Object value, List<Object> values,
                   Object min, Object max, LikeOptions like) {
    this.attribute = Objects.requireNonNull(attribute, "attribute");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = value;
    this.values = values == null ? null : java.util.Collections.unmodifiableList(new ArrayList<>(values));
    this.min = min;
    this.max = max;
    this.like = like == null ? LikeOptions.DEFAULT : like;
    check();
  }

  public String attribute() { return attribute; }
  public Operator operator() { return operator; }
  public Object value() { return value; }
  public List<Object> values() { return values; }
  public Object min() { return min; }
  public Object max() { return max; }
  public LikeOptions like() { return like; }

  public static Criterion of(String attribute, Operator operator, Object value) {
    if (operator == Operator.IN) return new Criterion(attribute, operator, null, toList(attribute, value), null, null, null);
    if (value == null && operator == Operator.EQ) return new Criterion(attribute, Operator.NULL, null, null, null, null, null);
    if (value == null && operator == Operator.NE) return new Criterion(attribute, Operator.NOT_NULL, null, null, null, null, null);
    return new Criterion(attribute, operator, value, null, null, null, null);
  }

  public static Criterion between(String attribute, Object min, Object max) {
    return new Criterion(attribute, Operator.BETWEEN, null, null, min, max, null);
  }

  public static Criterion like(String attribute, Object term, LikeOptions options) {
    return new Criterion(attribute, Operator.LIKE, term, null, null, null, options);
  }

  /**
   * Parses one entry of a filter map. {@code condition} is either a literal (implicit {@code =}, where
   * {@code null} means unset or explicitly null) or a map with {@code value} and {@code operator}.
   * <p>
   * BETWEEN takes {@code {min, max}} as the value (or at the top level, or a two element list);
   * IN takes a list; LIKE reads {@code case_sensitive} and {@code full_text} from {@code options}
   * or from the top level.
   */
  public static Criterion fromEntry(String attribute, Object condition) {
    if (!(condition instanceof Map<?, ?> m) || !(m.containsKey("operator") || m.containsKey("value"))) {
      if (condition instanceof Collection<?> || (condition != null && condition.getClass().isArray())) {
        return of(attribute, Operator.IN, condition);
      }
      return of(attribute, Operator.EQ, condition);
    }

    Object rawOp = m.get("operator");
    Operator op = Operator.parse(rawOp == null ? null : String.valueOf(rawOp));
    Object value = m.get("value");

    return switch (op) {
      case BETWEEN -> {
        Object lo = m.get("min");
        Object hi = m.get("max");
        if (value instanceof Map<?, ?> range) {
          lo = range.get("min");
          hi = range.get("max");
        } else if (value instanceof List<?> pair && pair.size() == 2) {
          lo = pair.get(0);
          hi = pair.get(1);
        }
        yield between(attribute, lo, hi);
      }
      case LIKE -> {
        Object opts = m.get("options");
        LikeOptions lo = (opts instanceof Map<?, ?> om) ? LikeOptions.fromMap(om) : LikeOptions.fromMap(m);
        yield like(attribute, value, lo);
      }
      default -> of(attribute, op, value);
    };
  }

  private void check() {
    switch (operator) {
      case BETWEEN -> {
        if (min == null || max == null) {
          throw new QueryValidationException("BETWEEN filter on '" + attribute + "' needs both min and max");
        }
      }
      case IN -> {
        if (values == null) throw new QueryValidationException("IN filter on '" + attribute + "' needs a list of values");
      }
      case LIKE, LT, GT, LE, GE -> {
        if (value == null) {
          throw new QueryValidationException(operator.symbol() + " filter on '" + attribute + "' needs a value");
        }
      }
      default -> { }
    }
  }

  private static List<Object> toList(String attribute, Object v) {
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    if (v != null && v.getClass().isArray()) {
      int n = Array.getLength(v);
      List<Object> out = new ArrayList<>(n);
      for (int i = 0; i < n; i++) out.add(Array.get(v, i));
      return out;
    }
    throw new QueryValidationException("IN filter on '" + attribute + "' needs a list of values");
  }

  @Override
  public String toString() {
    return switch (operator) {
      case BETWEEN -> attribute + " BETWEEN " + min + " AND " + max;
      case IN -> attribute + " IN " + values;
      case NULL, NOT_NULL -> attribute + " IS " + operator.symbol();
      default -> attribute + " " + operator.symbol() + " " + value;
    };
  }
}
