package io.intellixity.dynattr.query;

import java.util.Objects;

/** Ordering by an attribute's typed value. */
public record SortField(String attribute, Direction direction) {
  public SortField {
    Objects.requireNonNull(attribute, "attribute");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortField asc(String attribute) { return new SortField(attribute, Direction.ASC); }
  public static SortField desc(String attribute) { return new SortField(attribute, Direction.DESC); }

  public enum Direction { ASC, DESC }
}
