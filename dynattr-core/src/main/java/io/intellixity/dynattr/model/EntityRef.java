package io.intellixity.dynattr.model;

import java.util.Objects;

/**
 * Opaque reference to a host record: its id and a type tag.
 * <p>
 * A reference without an id denotes a host record that has not been saved yet.
 */
public record EntityRef(String id, String type) {
  public EntityRef {
    Objects.requireNonNull(type, "type");
    if (type.isBlank()) throw new IllegalArgumentException("type must not be blank");
  }

  public static EntityRef of(String type, Object id) {
    return new EntityRef(id == null ? null : String.valueOf(id), type);
  }

  public static EntityRef unsaved(String type) {
    return new EntityRef(null, type);
  }

  public boolean persisted() {
    return id != null && !id.isBlank();
  }

  @Override
  public String toString() {
    return type + "#" + (id == null ? "<unsaved>" : id);
  }
}
