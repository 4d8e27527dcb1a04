package io.intellixity.dynattr.error;

import java.util.List;
import java.util.Map;

public final class DuplicateAttributeException extends DefinitionException {
  private final String name;

  public DuplicateAttributeException(String name) {
    super(copy(Map.of("name", List.of("An attribute with the name '" + name + "' already exists."))),
        "An attribute with the name '" + name + "' already exists.");
    this.name = name;
  }

  public String name() { return name; }

  @Override
  public String code() { return "attribute_duplicate"; }
}
