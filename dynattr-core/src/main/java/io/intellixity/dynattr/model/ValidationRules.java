package io.intellixity.dynattr.model;

import java.util.Set;

/** Rule names accepted in {@link AttributeDefinition#validationRules()}. */
public final class ValidationRules {
  private ValidationRules() {}

  public static final String MIN = "min";
  public static final String MAX = "max";
  public static final String MIN_LENGTH = "min_length";
  public static final String MAX_LENGTH = "max_length";
  public static final String AFTER = "after";
  public static final String BEFORE = "before";

  /** Date sentinel resolved to the current date when a rule is evaluated. */
  public static final String TODAY = "today";

  public static final Set<String> ALL = Set.of(MIN, MAX, MIN_LENGTH, MAX_LENGTH, AFTER, BEFORE);
}
