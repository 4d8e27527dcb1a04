package io.intellixity.dynattr.jdbc.dialect;

import io.intellixity.dynattr.jdbc.Bind;
import io.intellixity.dynattr.jdbc.JdbcTables;
import io.intellixity.dynattr.jdbc.SqlStatement;
import io.intellixity.dynattr.model.EntityRef;
import io.intellixity.dynattr.model.ValueSlot;
import io.intellixity.dynattr.query.Operator;
import io.intellixity.dynattr.query.SortField;
import io.intellixity.dynattr.spi.search.SlotPredicate;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class GenericSqlDialectTest {
  private final GenericSqlDialect d = new GenericSqlDialect();
  private final JdbcTables t = JdbcTables.defaults();

  private SqlStatement search(SlotPredicate p) {
    return d.selectMatchingEntityIds(t, "customer", "age", p);
  }

  @Test
  void comparisonUsesStandardNotEquals() {
    SqlStatement ss = search(SlotPredicate.compare(ValueSlot.NUMBER, Operator.NE, 4.0));

    assertTrue(ss.sql().startsWith("SELECT DISTINCT v.entity_id FROM \"attribute_values\" v"));
    assertTrue(ss.sql().endsWith("AND v.number_value <> :b3"));
    assertEquals(List.of(Bind.string("customer"), Bind.string("age"), Bind.number(4.0)), ss.binds());
  }

  @Test
  void rendersInBetweenAndNullChecks() {
    assertTrue(search(SlotPredicate.in(ValueSlot.NUMBER, List.of(1.0, 2.0))).sql()
        .endsWith("v.number_value IN (:b3, :b4)"));
    assertTrue(search(SlotPredicate.in(ValueSlot.NUMBER, List.of())).sql().endsWith("AND 1 = 0"));

    SqlStatement between = search(SlotPredicate.between(ValueSlot.DATE, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31)));
    assertTrue(between.sql().endsWith("v.date_value BETWEEN :b3 AND :b4"));
    assertEquals(Bind.date(LocalDate.of(2024, 1, 1)), between.binds().get(2));

    assertTrue(search(SlotPredicate.isNull(ValueSlot.STRING)).sql().endsWith("v.string_value IS NULL"));
    assertTrue(search(SlotPredicate.notNull(ValueSlot.STRING)).sql().endsWith("v.string_value IS NOT NULL"));
  }

  @Test
  void likeWrapsTermAndLowersBothSides() {
    SqlStatement ss = search(SlotPredicate.like(ValueSlot.STRING, "ali", false, false));

    assertTrue(ss.sql().endsWith("LOWER(v.string_value) LIKE LOWER(:b3)"));
    assertEquals(Bind.string("%ali%"), ss.binds().get(2));

    assertTrue(search(SlotPredicate.like(ValueSlot.STRING, "Ali", true, false)).sql()
        .endsWith("v.string_value LIKE :b3"));
  }

  @Test
  void fullTextFallsBackToLike() {
    SqlStatement ss = search(SlotPredicate.like(ValueSlot.STRING, "ali", false, true));
    assertTrue(ss.sql().endsWith("LOWER(v.string_value) LIKE LOWER(:b3)"));
  }

  @Test
  void keysetPageUsesStandardFetchFirst() {
    assertEquals("SELECT DISTINCT entity_id FROM \"attribute_values\" WHERE entity_type = :b1 ORDER BY entity_id FETCH FIRST 50 ROWS ONLY",
        d.selectEntityIdsAfter(t, "customer", null, 50).sql());
    assertTrue(d.selectEntityIdsAfter(t, "customer", "C10", 50).sql().contains("AND entity_id > :b2"));
  }

  @Test
  void orderingRestrictsToGivenIds() {
    SqlStatement ss = d.selectOrderedEntityIds(t, "customer", List.of("1", "2"), "age", ValueSlot.NUMBER,
        SortField.Direction.ASC);

    assertTrue(ss.sql().startsWith("SELECT v.entity_id, v.number_value FROM \"attribute_values\" v"
        + " WHERE v.entity_type = :b1 AND v.attribute_name = :b2"));
    assertTrue(ss.sql().contains("v.number_value IS NOT NULL AND v.entity_id IN (:b3, :b4)"));
    assertTrue(ss.sql().endsWith("ORDER BY v.number_value ASC, v.entity_id"));
    assertEquals(List.of("customer", "age", "1", "2"), ss.binds().stream().map(Bind::value).toList());
  }

  @Test
  void qualifiesTablesWithSchema() {
    SqlStatement ss = d.selectValues(t.inSchema("eav"), new EntityRef("7", "customer"));
    assertTrue(ss.sql().contains("FROM \"eav\".\"attribute_values\" WHERE entity_id = :b1 AND entity_type = :b2"));
  }

  @Test
  void definitionInsertUsesGeneratedKeys() {
    SqlStatement ss = d.insertDefinition(t, "age", "Age", "number", false, "[]", "{}");

    assertEquals(SqlStatement.ExecKind.UPDATE_GENERATED_KEYS, ss.execKind());
    assertFalse(ss.sql().contains("RETURNING"));
    assertEquals(6, ss.binds().size());
  }

  @Test
  void hasNoNativeUpsertOrFeatures() {
    assertFalse(d.supportsUpsert());
    assertThrows(UnsupportedOperationException.class, () -> d.upsertValue(t, null));
    assertEquals(Set.of(), d.probeFeatures(null));
    assertTrue(d.advisoryIndexStatements(t, Set.of()).isEmpty());
  }

  @Test
  void schemaCreatesBothTablesAndSearchIndexes() {
    List<String> ddl = d.createSchemaStatements(t);

    assertEquals(7, ddl.size());
    assertTrue(ddl.get(0).startsWith("CREATE TABLE \"attributes\""));
    assertTrue(ddl.get(1).contains("UNIQUE (entity_id, entity_type, attribute_id)"));
    assertTrue(ddl.get(1).contains("REFERENCES \"attributes\" (id) ON DELETE CASCADE"));
    assertTrue(ddl.stream().anyMatch(s -> s.contains("(entity_type, attribute_name, date_value)")));
  }
}
