package io.intellixity.dynattr.jdbc.postgres;

import io.intellixity.dynattr.jdbc.JdbcTables;
import io.intellixity.dynattr.jdbc.SqlStatement;
import io.intellixity.dynattr.jdbc.SqlStatement.ExecKind;
import io.intellixity.dynattr.jdbc.dialect.SqlDialects;
import io.intellixity.dynattr.model.ValueRecord;
import io.intellixity.dynattr.model.ValueSlot;
import io.intellixity.dynattr.spi.capability.Feature;
import io.intellixity.dynattr.spi.search.SlotPredicate;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private final PostgresDialect d = new PostgresDialect();
  private final JdbcTables t = JdbcTables.defaults();

  @Test
  void upsertsOnTheEntityAttributeKey() {
    ValueRecord r = new ValueRecord("7", "customer", 3L, "age", null, 25.0, null, null);

    SqlStatement ss = d.upsertValue(t, r);

    assertTrue(d.supportsUpsert());
    assertTrue(ss.sql().startsWith("INSERT INTO \"attribute_values\""));
    assertTrue(ss.sql().contains("ON CONFLICT (entity_id, entity_type, attribute_id) DO UPDATE SET"));
    assertTrue(ss.sql().contains("number_value = EXCLUDED.number_value"));
    assertEquals(8, ss.binds().size());
  }

  @Test
  void definitionInsertReturnsId() {
    SqlStatement ss = d.insertDefinition(t, "age", "Age", "number", false, "[]", "{}");

    assertEquals(ExecKind.QUERY_ONE_VALUE, ss.execKind());
    assertTrue(ss.sql().endsWith(" RETURNING id"));
  }

  @Test
  void likeUsesIlikeUnlessCaseSensitive() {
    String insensitive = d.selectMatchingEntityIds(t, "customer", "name",
        SlotPredicate.like(ValueSlot.STRING, "ali", false, false)).sql();
    String sensitive = d.selectMatchingEntityIds(t, "customer", "name",
        SlotPredicate.like(ValueSlot.STRING, "Ali", true, false)).sql();

    assertTrue(insensitive.endsWith("v.string_value ILIKE :b3"));
    assertTrue(sensitive.endsWith("v.string_value LIKE :b3"));
  }

  @Test
  void fullTextUsesTsvector() {
    SqlStatement ss = d.selectMatchingEntityIds(t, "customer", "bio",
        SlotPredicate.like(ValueSlot.STRING, "java developer", false, true));

    assertTrue(ss.sql().contains("to_tsvector('english', coalesce(v.string_value, '')) @@ plainto_tsquery('english', :b3)"));
    assertEquals("java developer", ss.binds().get(2).value());
  }

  @Test
  void reportsStaticFeatureSet() {
    Set<Feature> f = d.probeFeatures(null);

    assertTrue(f.contains(Feature.JSONB_SUPPORT));
    assertTrue(f.contains(Feature.FULLTEXT_SEARCH));
    assertFalse(f.contains(Feature.FTS_EXTENSION));
  }

  @Test
  void advisoryIndexesCoverFullTextAndTrigrams() {
    List<String> all = d.advisoryIndexStatements(t, d.probeFeatures(null));
    List<String> withoutFullText = d.advisoryIndexStatements(t, Set.of());

    assertEquals(3, all.size());
    assertTrue(all.get(0).contains("USING gin (to_tsvector('english'"));
    assertTrue(all.contains("CREATE EXTENSION IF NOT EXISTS pg_trgm"));
    assertTrue(all.get(2).contains("gin_trgm_ops"));
    assertEquals(2, withoutFullText.size());
  }

  @Test
  void schemaUsesJsonbAndBigserial() {
    String attributes = d.createSchemaStatements(t).get(0);

    assertTrue(attributes.contains("id BIGSERIAL PRIMARY KEY"));
    assertTrue(attributes.contains("options JSONB"));
  }

  @Test
  void isRegisteredForPostgresProducts() {
    assertTrue(d.matches("PostgreSQL"));
    assertEquals(PostgresDialect.ID, SqlDialects.forProduct("PostgreSQL").id());
    assertInstanceOf(PostgresDialect.class, SqlDialects.byId("postgres"));
  }
}
