package io.intellixity.dynattr.validation;

import io.intellixity.dynattr.error.ValidationException;
import io.intellixity.dynattr.error.Violation;
import io.intellixity.dynattr.model.AttributeDefinition;
import io.intellixity.dynattr.model.AttributeType;
import io.intellixity.dynattr.model.ValidationRules;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validates and casts raw attribute values against their definition.
 * <p>
 * Order: required check, empty pass-through, type check, then custom rules. Rules only run when the
 * type check passed. The {@code today} sentinel of date rules is resolved on the injected clock.
 */
public final class ValueValidator {
  private final Clock clock;

  public ValueValidator(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public ValueValidator() {
    this(Clock.systemDefaultZone());
  }

  public Clock clock() { return clock; }

  /** Throws {@link ValidationException} with every violation of {@code raw}. */
  public void validate(AttributeDefinition def, Object raw) {
    List<Violation> v = violations(def, raw);
    if (!v.isEmpty()) {
      Map<String, Object> rawValues = new HashMap<>();
      rawValues.put(def.name(), raw);
      throw new ValidationException(v, rawValues);
    }
  }

  public boolean isValid(AttributeDefinition def, Object raw) {
    return violations(def, raw).isEmpty();
  }

  /** Storage representation of {@code raw}; see {@link AttributeType#cast}. */
  public Object cast(AttributeDefinition def, Object raw) {
    return def.type().cast(raw, clock);
  }

  public Object validateAndCast(AttributeDefinition def, Object raw) {
    validate(def, raw);
    return cast(def, raw);
  }

  /** User-facing messages only. */
  public List<String> messages(AttributeDefinition def, Object raw) {
    return violations(def, raw).stream().map(Violation::userMessage).toList();
  }

  public List<Violation> violations(AttributeDefinition def, Object raw) {
    List<Violation> out = new ArrayList<>();
    String label = def.label();

    if (Values.isEmpty(raw)) {
      if (def.required()) {
        out.add(violation(def, "required", null, raw, "The " + label + " field is required."));
      } else if (def.type() == AttributeType.SELECT && raw != null) {
        out.add(violation(def, "required", null, raw, "The " + label + " must have a value selected."));
      }
      return out;
    }

    String typeError = def.type().typeViolation(def, raw, clock);
    if (typeError != null) {
      out.add(violation(def, "type", def.type().id(), raw, typeError));
      return out;
    }

    switch (def.type()) {
      case TEXT -> checkText(def, raw, out);
      case NUMBER -> checkNumber(def, raw, out);
      case DATE -> checkDate(def, raw, out);
      case BOOLEAN, SELECT -> { }
    }
    return out;
  }

  private void checkText(AttributeDefinition def, Object raw, List<Violation> out) {
    int len = Values.toText(raw).length();
    String label = def.label();
    for (String rule : List.of(ValidationRules.MIN, ValidationRules.MIN_LENGTH)) {
      Long c = Values.toNonNegativeInteger(def.rule(rule));
      if (c != null && len < c) {
        out.add(violation(def, rule, c, raw, "The " + label + " must be at least " + c + " characters."));
      }
    }
    for (String rule : List.of(ValidationRules.MAX, ValidationRules.MAX_LENGTH)) {
      Long c = Values.toNonNegativeInteger(def.rule(rule));
      if (c != null && len > c) {
        out.add(violation(def, rule, c, raw, "The " + label + " may not be greater than " + c + " characters."));
      }
    }
  }

  private void checkNumber(AttributeDefinition def, Object raw, List<Violation> out) {
    double v = Values.toDouble(raw);
    Double min = Values.toDouble(def.rule(ValidationRules.MIN));
    Double max = Values.toDouble(def.rule(ValidationRules.MAX));
    if (min != null && v < min) {
      out.add(violation(def, ValidationRules.MIN, min, raw,
          "The " + def.label() + " must be at least " + Values.formatNumber(min) + "."));
    }
    if (max != null && v > max) {
      out.add(violation(def, ValidationRules.MAX, max, raw,
          "The " + def.label() + " may not be greater than " + Values.formatNumber(max) + "."));
    }
  }

  private void checkDate(AttributeDefinition def, Object raw, List<Violation> out) {
    LocalDate v = Values.toDate(raw, clock);
    Object after = def.rule(ValidationRules.AFTER);
    LocalDate a = resolve(after);
    if (a != null && !v.isAfter(a)) {
      out.add(violation(def, ValidationRules.AFTER, after, raw, "The " + def.label() + " must be after " + after + "."));
    }
    Object before = def.rule(ValidationRules.BEFORE);
    LocalDate b = resolve(before);
    if (b != null && !v.isBefore(b)) {
      out.add(violation(def, ValidationRules.BEFORE, before, raw, "The " + def.label() + " must be before " + before + "."));
    }
  }

  private LocalDate resolve(Object constraint) {
    if (constraint == null) return null;
    if (constraint instanceof CharSequence cs && ValidationRules.TODAY.equalsIgnoreCase(cs.toString().trim())) {
      return LocalDate.now(clock);
    }
    return Values.toDate(constraint, clock);
  }

  private static Violation violation(AttributeDefinition def, String rule, Object constraint, Object raw, String message) {
    Map<String, Object> ctx = new LinkedHashMap<>();
    ctx.put("attribute", def.name());
    ctx.put("type", def.type().id());
    ctx.put("rule", rule);
    if (constraint != null) ctx.put("constraint", constraint);
    if (raw != null) ctx.put("value", raw);
    return new Violation(def.name(), message, ctx);
  }
}
