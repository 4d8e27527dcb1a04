package io.intellixity.dynattr.validation;

import io.intellixity.dynattr.error.DefinitionException;
import io.intellixity.dynattr.model.AttributeDefinition;
import io.intellixity.dynattr.model.AttributeDraft;
import io.intellixity.dynattr.model.AttributeType;
import io.intellixity.dynattr.model.ValidationRules;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Checks attribute drafts before they reach the catalog. Every violated constraint is reported,
 * grouped by field: {@code name}, {@code label}, {@code type}, {@code options}, {@code validation}.
 */
public final class DefinitionValidator {
  public static final Pattern NAME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]*$");

  private final Clock clock;

  public DefinitionValidator(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public DefinitionValidator() {
    this(Clock.systemDefaultZone());
  }

  /** Validates {@code draft} and returns the definition it describes (without id). */
  public AttributeDefinition validate(AttributeDraft draft) {
    Map<String, List<String>> errors = violations(draft);
    if (!errors.isEmpty()) throw new DefinitionException(errors);

    AttributeType type = AttributeType.fromId(draft.type()).orElseThrow();
    List<String> options = new ArrayList<>();
    if (type == AttributeType.SELECT) {
      for (Object o : draft.options()) options.add(o.toString());
    }
    return new AttributeDefinition(null, draft.name(), draft.label().trim(), type, draft.required(),
        options, draft.validationRules());
  }

  public Map<String, List<String>> violations(AttributeDraft draft) {
    Map<String, List<String>> errors = new LinkedHashMap<>();

    String name = draft.name();
    if (name == null || name.isBlank()) {
      add(errors, "name", "The name field is required.");
    } else if (!NAME.matcher(name).matches()) {
      add(errors, "name", "The name must start with a letter and contain only letters, numbers, and underscores.");
    }

    if (draft.label() == null || draft.label().isBlank()) {
      add(errors, "label", "The label field is required.");
    }

    Optional<AttributeType> type = AttributeType.fromId(draft.type());
    if (draft.type() == null || draft.type().isBlank()) {
      add(errors, "type", "The type field is required.");
    } else if (type.isEmpty()) {
      add(errors, "type", "The type must be one of: " + String.join(", ", AttributeType.ids()) + ".");
    }

    if (type.isPresent() && type.get() == AttributeType.SELECT) {
      checkOptions(draft.options(), errors);
    }

    if (draft.validationRules() != null) {
      checkRules(type.orElse(null), draft.validationRules(), errors);
    }
    return errors;
  }

  private static void checkOptions(List<?> options, Map<String, List<String>> errors) {
    if (options == null || options.isEmpty()) {
      add(errors, "options", "Select attributes must have at least one option.");
      return;
    }
    for (int i = 0; i < options.size(); i++) {
      Object o = options.get(i);
      if (!(o instanceof CharSequence cs) || cs.toString().isBlank()) {
        add(errors, "options", "Option at index " + i + " must be a non-empty string.");
      }
    }
  }

  private void checkRules(AttributeType type, Map<String, Object> rules, Map<String, List<String>> errors) {
    for (Map.Entry<String, Object> e : rules.entrySet()) {
      String rule = e.getKey();
      Object c = e.getValue();
      if (!ValidationRules.ALL.contains(rule)) {
        add(errors, "validation", "Unknown validation rule: " + rule);
        continue;
      }
      if (type == null) continue;

      switch (rule) {
        case ValidationRules.MIN, ValidationRules.MAX -> {
          if (type == AttributeType.TEXT) {
            if (Values.toNonNegativeInteger(c) == null) {
              add(errors, "validation", "Text " + rule + " length must be a non-negative integer.");
            }
          } else if (type == AttributeType.NUMBER) {
            if (!Values.isNumeric(c)) add(errors, "validation", "Number " + rule + " value must be numeric.");
          } else {
            add(errors, "validation", rule + " validation is only supported for text and number attributes.");
          }
        }
        case ValidationRules.MIN_LENGTH, ValidationRules.MAX_LENGTH -> {
          if (type != AttributeType.TEXT) {
            add(errors, "validation", rule + " validation is only supported for text attributes.");
          } else if (Values.toNonNegativeInteger(c) == null) {
            add(errors, "validation", rule + " must be a non-negative integer.");
          }
        }
        case ValidationRules.AFTER, ValidationRules.BEFORE -> {
          if (type != AttributeType.DATE) {
            add(errors, "validation", rule + " validation is only supported for date attributes.");
          } else if (dateConstraint(c) == null) {
            add(errors, "validation", rule + " must be 'today' or a valid date.");
          }
        }
        default -> throw new IllegalStateException("Unhandled rule " + rule);
      }
    }

    if (type == AttributeType.TEXT || type == AttributeType.NUMBER) {
      Double min = Values.toDouble(rules.get(ValidationRules.MIN));
      Double max = Values.toDouble(rules.get(ValidationRules.MAX));
      if (min != null && max != null && min > max) {
        add(errors, "validation", "Minimum value cannot be greater than maximum value.");
      }
    }
    if (type == AttributeType.TEXT) {
      Long min = Values.toNonNegativeInteger(rules.get(ValidationRules.MIN_LENGTH));
      Long max = Values.toNonNegativeInteger(rules.get(ValidationRules.MAX_LENGTH));
      if (min != null && max != null && min > max) {
        add(errors, "validation", "Minimum length cannot be greater than maximum length.");
      }
    }
  }

  /** A date rule constraint resolved now; {@code null} when malformed. */
  LocalDate dateConstraint(Object c) {
    if (c instanceof CharSequence cs && ValidationRules.TODAY.equalsIgnoreCase(cs.toString().trim())) {
      return LocalDate.now(clock);
    }
    if (!(c instanceof CharSequence) && !(c instanceof LocalDate)) return null;
    return Values.toDate(c, clock);
  }

  private static void add(Map<String, List<String>> errors, String field, String message) {
    errors.computeIfAbsent(field, k -> new ArrayList<>()).add(message);
  }
}
