package io.intellixity.dynattr.model;

import io.intellixity.dynattr.validation.Values;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Attribute value types.
 * <p>
 * Every type-dependent behavior is a switch on this enum: {@link #typeViolation}, {@link #cast},
 * {@link #slot} and {@link #column}. A new constant must be handled in each of them.
 */
public enum AttributeType {
  TEXT("text"),
  NUMBER("number"),
  DATE("date"),
  BOOLEAN("boolean"),
  SELECT("select");

  private final String id;

  AttributeType(String id) {
    this.id = id;
  }

  /** Stable lowercase identifier used in storage and input. */
  public String id() { return id; }

  public static Optional<AttributeType> fromId(String id) {
    if (id == null) return Optional.empty();
    String norm = id.trim().toLowerCase(Locale.ROOT);
    for (AttributeType t : values()) {
      if (t.id.equals(norm)) return Optional.of(t);
    }
    return Optional.empty();
  }

  public static List<String> ids() {
    return Arrays.stream(values()).map(AttributeType::id).toList();
  }

  /**
   * Type check of a non-empty raw value.
   *
   * @return the user-facing message when {@code raw} does not fit this type, else {@code null}
   */
  public String typeViolation(AttributeDefinition def, Object raw, Clock clock) {
    String label = def.label();
    return switch (this) {
      case TEXT -> (raw instanceof CharSequence || raw instanceof Number)
          ? null : "The " + label + " must be text.";
      case NUMBER -> Values.isNumeric(raw) ? null : "The " + label + " must be a number.";
      case DATE -> Values.toDate(raw, clock) != null ? null : "The " + label + " must be a valid date.";
      case BOOLEAN -> Values.isBooleanLike(raw) ? null : "The " + label + " must be true or false.";
      case SELECT -> (raw instanceof CharSequence cs && def.options().contains(cs.toString()))
          ? null : "The " + label + " must be one of: " + String.join(", ", def.options()) + ".";
    };
  }

  /**
   * Converts a raw value to this type's storage representation: {@link String}, {@link Double},
   * {@link java.time.LocalDate} or {@link Boolean}. An unparsable date becomes {@code null}.
   */
  public Object cast(Object raw, Clock clock) {
    if (raw == null) return null;
    return switch (this) {
      case TEXT, SELECT -> Values.toText(raw);
      case NUMBER -> Values.toDouble(raw);
      case DATE -> Values.toDate(raw, clock);
      case BOOLEAN -> Values.isEmpty(raw) ? null : Boolean.TRUE.equals(Values.toBoolean(raw));
    };
  }

  public ValueSlot slot() {
    return switch (this) {
      case TEXT, SELECT -> ValueSlot.STRING;
      case NUMBER -> ValueSlot.NUMBER;
      case DATE -> ValueSlot.DATE;
      case BOOLEAN -> ValueSlot.BOOLEAN;
    };
  }

  /** Value table column holding values of this type. */
  public String column() {
    return switch (this) {
      case TEXT, SELECT -> ValueSlot.STRING.column();
      case NUMBER -> ValueSlot.NUMBER.column();
      case DATE -> ValueSlot.DATE.column();
      case BOOLEAN -> ValueSlot.BOOLEAN.column();
    };
  }

  /** Validation rule names legal for this type. */
  public Set<String> allowedRules() {
    return switch (this) {
      case TEXT -> Set.of(ValidationRules.MIN, ValidationRules.MAX, ValidationRules.MIN_LENGTH, ValidationRules.MAX_LENGTH);
      case NUMBER -> Set.of(ValidationRules.MIN, ValidationRules.MAX);
      case DATE -> Set.of(ValidationRules.AFTER, ValidationRules.BEFORE);
      case BOOLEAN, SELECT -> Set.of();
    };
  }
}
