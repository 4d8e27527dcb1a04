package io.intellixity.dynattr.spi.search;

import io.intellixity.dynattr.model.ValueSlot;
import io.intellixity.dynattr.query.Operator;

import java.util.List;
import java.util.Objects;

/**
 * A typed condition on one slot of an attribute's value records. Operands are already cast to
 * the slot's Java type ({@link String}, {@link Double}, {@link java.time.LocalDate}, {@link Boolean}).
 * <p>
 * {@link Operator#NULL} matches records whose slot is null, {@link Operator#NOT_NULL} the others;
 * entities without a record never match.
 */
public record SlotPredicate(ValueSlot slot,
                            Operator operator,
                            Object value,
                            List<Object> values,
                            Object lower,
                            Object upper,
                            boolean caseSensitive,
                            boolean fullText) {
  public SlotPredicate {
    Objects.requireNonNull(slot, "slot");
    Objects.requireNonNull(operator, "operator");
    values = values == null ? null : java.util.Collections.unmodifiableList(new java.util.ArrayList<>(values));
  }

  public static SlotPredicate compare(ValueSlot slot, Operator op, Object value) {
    if (!op.isComparison()) throw new IllegalArgumentException("Not a comparison: " + op);
    return new SlotPredicate(slot, op, Objects.requireNonNull(value, "value"), null, null, null, false, false);
  }

  public static SlotPredicate in(ValueSlot slot, List<Object> values) {
    return new SlotPredicate(slot, Operator.IN, null, values, null, null, false, false);
  }

  public static SlotPredicate between(ValueSlot slot, Object lower, Object upper) {
    return new SlotPredicate(slot, Operator.BETWEEN, null, null, lower, upper, false, false);
  }

  /** Substring match of {@code term}; {@code fullText} asks for the backend's full-text matcher. */
  public static SlotPredicate like(ValueSlot slot, String term, boolean caseSensitive, boolean fullText) {
    return new SlotPredicate(slot, Operator.LIKE, term, null, null, null, caseSensitive, fullText);
  }

  public static SlotPredicate isNull(ValueSlot slot) {
    return new SlotPredicate(slot, Operator.NULL, null, null, null, null, false, false);
  }

  public static SlotPredicate notNull(ValueSlot slot) {
    return new SlotPredicate(slot, Operator.NOT_NULL, null, null, null, null, false, false);
  }
}
