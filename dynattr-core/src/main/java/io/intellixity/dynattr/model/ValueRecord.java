package io.intellixity.dynattr.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Stored value of one attribute for one entity. At most one slot is non-null; a record with all
 * slots null holds an explicit null.
 */
public record ValueRecord(String entityId,
                          String entityType,
                          long attributeId,
                          String attributeName,
                          String stringSlot,
                          Double numberSlot,
                          LocalDate dateSlot,
                          Boolean booleanSlot) {
  public ValueRecord {
    Objects.requireNonNull(entityId, "entityId");
    Objects.requireNonNull(entityType, "entityType");
    Objects.requireNonNull(attributeName, "attributeName");
  }

  /**
   * Record for an already cast value, populated in the slot of {@code def}'s type.
   */
  public static ValueRecord of(EntityRef ref, AttributeDefinition def, Object castValue) {
    Objects.requireNonNull(def.id(), "definition is not persisted");
    String s = null;
    Double n = null;
    LocalDate d = null;
    Boolean b = null;
    if (castValue != null) {
      switch (def.slot()) {
        case STRING -> s = (String) castValue;
        case NUMBER -> n = (Double) castValue;
        case DATE -> d = (LocalDate) castValue;
        case BOOLEAN -> b = (Boolean) castValue;
      }
    }
    return new ValueRecord(ref.id(), ref.type(), def.id(), def.name(), s, n, d, b);
  }

  public EntityRef entity() {
    return new EntityRef(entityId, entityType);
  }

  /** The populated slot's value, or {@code null}. */
  public Object value() {
    if (stringSlot != null) return stringSlot;
    if (numberSlot != null) return numberSlot;
    if (dateSlot != null) return dateSlot;
    return booleanSlot;
  }
}
