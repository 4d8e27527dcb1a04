package io.intellixity.dynattr.error;

import io.intellixity.dynattr.model.EntityRef;

import java.util.List;

/**
 * Unexpected persistence failure surfaced in sanitized form. The cause is kept for logs only.
 */
public final class StorageException extends AttributeException {
  private final String operation;

  public StorageException(String operation, EntityRef entity, List<String> attributes, Throwable cause) {
    super("Attribute " + operation + " failed"
            + (entity == null ? "" : " for " + entity)
            + (attributes == null || attributes.isEmpty() ? "" : " attributes=" + attributes)
            + (cause == null ? "" : ": " + cause.getMessage()),
        "The attribute " + operation + " could not be completed. Please try again later.",
        ctx("operation", operation,
            "entityType", entity == null ? null : entity.type(),
            "entityId", entity == null ? null : entity.id(),
            "attributes", attributes == null || attributes.isEmpty() ? null : List.copyOf(attributes)),
        cause);
    this.operation = operation;
  }

  public String operation() { return operation; }

  @Override
  public String code() { return "storage_failure"; }
}
