package io.intellixity.dynattr.error;

import java.util.Map;
import java.util.Objects;

/** One rejected attribute value, in the shape API responses use. */
public record Violation(String attributeName, String userMessage, Map<String, Object> machineContext) {
  public Violation {
    Objects.requireNonNull(attributeName, "attributeName");
    Objects.requireNonNull(userMessage, "userMessage");
    machineContext = machineContext == null ? Map.of() : Map.copyOf(machineContext);
  }
}
