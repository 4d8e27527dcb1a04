package io.intellixity.dynattr.error;

import io.intellixity.dynattr.model.EntityRef;

public final class AttributeNotFoundException extends AttributeException {
  private final String name;

  public AttributeNotFoundException(String name) {
    this(name, null);
  }

  public AttributeNotFoundException(String name, EntityRef entity) {
    super("Attribute '" + name + "' not found" + (entity == null ? "" : " (entity " + entity + ")"),
        "The attribute '" + name + "' does not exist.",
        ctx("attribute", name,
            "entityType", entity == null ? null : entity.type(),
            "entityId", entity == null ? null : entity.id()),
        null);
    this.name = name;
  }

  public String name() { return name; }

  @Override
  public String code() { return "attribute_not_found"; }
}
