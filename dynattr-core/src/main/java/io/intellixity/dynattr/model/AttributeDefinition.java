package io.intellixity.dynattr.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A catalog-defined attribute.
 *
 * @param id              storage identity, {@code null} until persisted
 * @param name            unique immutable identifier token
 * @param label           user-facing name used in every message
 * @param options         allowed values, non-empty iff {@code type == SELECT}
 * @param validationRules rule name to constraint, see {@link ValidationRules}
 */
public record AttributeDefinition(Long id,
                                  String name,
                                  String label,
                                  AttributeType type,
                                  boolean required,
                                  List<String> options,
                                  Map<String, Object> validationRules) {
  public AttributeDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(label, "label");
    Objects.requireNonNull(type, "type");
    options = (options == null) ? List.of() : List.copyOf(options);
    validationRules = (validationRules == null)
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(validationRules));
  }

  public AttributeDefinition withId(long id) {
    return new AttributeDefinition(id, name, label, type, required, options, validationRules);
  }

  public boolean hasRule(String rule) {
    return validationRules.containsKey(rule);
  }

  public Object rule(String rule) {
    return validationRules.get(rule);
  }

  public ValueSlot slot() { return type.slot(); }
}
