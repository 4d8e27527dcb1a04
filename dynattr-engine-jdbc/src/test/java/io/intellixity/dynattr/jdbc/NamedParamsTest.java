package io.intellixity.dynattr.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class NamedParamsTest {
  @Test
  void replacesNamedBindsInOrder() {
    assertEquals("SELECT a FROM t WHERE x = ? AND y IN (?, ?)",
        NamedParams.toJdbcSql("SELECT a FROM t WHERE x = :b1 AND y IN (:b2, :b3)"));
  }

  @Test
  void keepsCastsAndQuotedColons() {
    assertEquals("SELECT '{}'::jsonb, 'a:b1' WHERE c = ?",
        NamedParams.toJdbcSql("SELECT '{}'::jsonb, 'a:b1' WHERE c = :b1"));
  }

  @Test
  void keepsEscapedQuotesInsideLiterals() {
    assertEquals("SELECT 'it''s :x' WHERE c = ?", NamedParams.toJdbcSql("SELECT 'it''s :x' WHERE c = :b1"));
  }

  @Test
  void nullSqlIsEmpty() {
    assertEquals("", NamedParams.toJdbcSql(null));
  }
}
