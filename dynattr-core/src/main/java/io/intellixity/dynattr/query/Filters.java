package io.intellixity.dynattr.query;

import java.util.Collection;

/** Static builders for {@link Criterion}. */
public final class Filters {
  private Filters() {}

  public static Criterion eq(String attribute, Object value) { return Criterion.of(attribute, Operator.EQ, value); }
  public static Criterion ne(String attribute, Object value) { return Criterion.of(attribute, Operator.NE, value); }
  public static Criterion gt(String attribute, Object value) { return Criterion.of(attribute, Operator.GT, value); }
  public static Criterion ge(String attribute, Object value) { return Criterion.of(attribute, Operator.GE, value); }
  public static Criterion lt(String attribute, Object value) { return Criterion.of(attribute, Operator.LT, value); }
  public static Criterion le(String attribute, Object value) { return Criterion.of(attribute, Operator.LE, value); }

  public static Criterion in(String attribute, Collection<?> values) {
    return Criterion.of(attribute, Operator.IN, values);
  }

  public static Criterion between(String attribute, Object min, Object max) {
    return Criterion.between(attribute, min, max);
  }

  public static Criterion like(String attribute, String term) {
    return Criterion.like(attribute, term, LikeOptions.DEFAULT);
  }

  public static Criterion likeCaseSensitive(String attribute, String term) {
    return Criterion.like(attribute, term, new LikeOptions(true, false));
  }

  public static Criterion fullText(String attribute, String term) {
    return Criterion.like(attribute, term, new LikeOptions(false, true));
  }

  public static Criterion isNull(String attribute) { return Criterion.of(attribute, Operator.NULL, null); }
  public static Criterion notNull(String attribute) { return Criterion.of(attribute, Operator.NOT_NULL, null); }
}
