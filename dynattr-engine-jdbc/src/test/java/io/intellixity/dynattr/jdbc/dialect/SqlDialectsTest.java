package io.intellixity.dynattr.jdbc.dialect;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SqlDialectsTest {
  @Test
  void unknownProductsGetTheGenericDialect() {
    assertEquals(GenericSqlDialect.ID, SqlDialects.forProduct("H2").id());
  }

  @Test
  void looksUpById() {
    assertInstanceOf(GenericSqlDialect.class, SqlDialects.byId(" Generic "));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> SqlDialects.byId("oracle"));
    assertTrue(ex.getMessage().contains("oracle"));
  }
}
