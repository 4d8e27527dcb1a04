package io.intellixity.dynattr.model;

import java.util.List;
import java.util.Map;

/**
 * Unvalidated input for defining or updating an attribute.
 * <p>
 * {@code type} stays a string and options/rules stay loosely typed so that every problem can be
 * reported by the definition validator instead of failing during construction.
 */
public record AttributeDraft(String name,
                             String label,
                             String type,
                             boolean required,
                             List<?> options,
                             Map<String, Object> validationRules) {

  public static AttributeDraft of(String name, String label, String type) {
    return new AttributeDraft(name, label, type, false, null, null);
  }

  public static AttributeDraft of(String name, String label, AttributeType type) {
    return of(name, label, type == null ? null : type.id());
  }

  public AttributeDraft required(boolean required) {
    return new AttributeDraft(name, label, type, required, options, validationRules);
  }

  public AttributeDraft options(List<?> options) {
    return new AttributeDraft(name, label, type, required, options, validationRules);
  }

  public AttributeDraft rules(Map<String, Object> validationRules) {
    return new AttributeDraft(name, label, type, required, options, validationRules);
  }

  public AttributeDraft label(String label) {
    return new AttributeDraft(name, label, type, required, options, validationRules);
  }
}
