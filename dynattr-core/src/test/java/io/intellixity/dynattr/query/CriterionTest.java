package io.intellixity.dynattr.query;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class CriterionTest {
  @Test
  void literalNullMeansNullCheck() {
    assertEquals(Operator.NULL, Criterion.fromEntry("x", null).operator());
    assertEquals(Operator.NULL, Criterion.fromEntry("x", Map.of("operator", "=")).operator());
    assertEquals(Operator.NOT_NULL, Filters.ne("x", null).operator());
  }

  @Test
  void literalListMeansIn() {
    Criterion c = Criterion.fromEntry("x", List.of(1, 2));
    assertEquals(Operator.IN, c.operator());
    assertEquals(List.of(1, 2), c.values());
  }

  @Test
  void operatorAliases() {
    assertEquals(Operator.NE, Operator.parse("<>"));
    assertEquals(Operator.NOT_NULL, Operator.parse("IS  NOT NULL"));
    assertEquals(Operator.NULL, Operator.parse("null"));
    assertEquals(Operator.LIKE, Operator.parse("ILIKE"));
    assertThrows(QueryValidationException.class, () -> Operator.parse("~="));
  }

  @Test
  void malformedOperandsAreRejected() {
    assertThrows(QueryValidationException.class,
        () -> Criterion.fromEntry("x", Map.of("operator", "IN", "value", "a")));
    assertThrows(QueryValidationException.class,
        () -> Criterion.fromEntry("x", Map.of("operator", ">")));
    assertThrows(QueryValidationException.class, () -> SearchLogic.parse("XOR"));
  }

  @Test
  void betweenAcceptsTopLevelBoundsAndPairs() {
    Criterion a = Criterion.fromEntry("x", Map.of("operator", "BETWEEN", "min", 1, "max", 3));
    assertEquals(1, a.min());
    Criterion b = Criterion.fromEntry("x", Map.of("operator", "BETWEEN", "value", List.of(4, 6)));
    assertEquals(6, b.max());
  }
}
