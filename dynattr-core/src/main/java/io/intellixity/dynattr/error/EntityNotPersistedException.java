package io.intellixity.dynattr.error;

import io.intellixity.dynattr.model.EntityRef;

/** The entity has no durable identity yet, so nothing can be attached to it. */
public final class EntityNotPersistedException extends AttributeException {
  public EntityNotPersistedException(EntityRef entity, String operation) {
    super("Entity must be saved before " + operation + " (" + entity + ")",
        "The record must be saved before its attributes can be changed.",
        ctx("entityType", entity.type(), "operation", operation),
        null);
  }

  @Override
  public String code() { return "entity_not_persisted"; }
}
