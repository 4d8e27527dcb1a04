package io.intellixity.dynattr.jdbc.sqlite;

import io.intellixity.dynattr.config.DynattrSettings;
import io.intellixity.dynattr.error.DuplicateAttributeException;
import io.intellixity.dynattr.exec.Propagation;
import io.intellixity.dynattr.jdbc.HostTable;
import io.intellixity.dynattr.jdbc.JdbcHandle;
import io.intellixity.dynattr.jdbc.JdbcStorageEngine;
import io.intellixity.dynattr.jdbc.JdbcTables;
import io.intellixity.dynattr.model.AttributeDefinition;
import io.intellixity.dynattr.model.AttributeType;
import io.intellixity.dynattr.model.EntityRef;
import io.intellixity.dynattr.model.ValueRecord;
import io.intellixity.dynattr.query.Criteria;
import io.intellixity.dynattr.query.Filters;
import io.intellixity.dynattr.query.SearchLogic;
import io.intellixity.dynattr.query.SortField;
import io.intellixity.dynattr.service.DynamicAttributes;
import io.intellixity.dynattr.spi.capability.Feature;
import io.intellixity.dynattr.spi.capability.FeatureCache;
import io.intellixity.dynattr.spi.exec.DuplicateKeyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/** Runs the SQLite dialect's statements against a real database file. */
final class SqliteEndToEndTest {
  @TempDir
  Path dir;

  private SQLiteDataSource ds;
  private JdbcStorageEngine engine;
  private DynamicAttributes attrs;

  @BeforeEach
  void setUp() throws SQLException {
    ds = new SQLiteDataSource();
    ds.setUrl("jdbc:sqlite:" + dir.resolve("dynattr.db"));
    engine = new JdbcStorageEngine(new JdbcHandle("jdbc:sqlite", ds, null), new SqliteDialect(), JdbcTables.defaults(),
        List.of(HostTable.of("customer", "customers")), new FeatureCache(), Propagation.REQUIRED);
    assertTrue(engine.createSchema());
    assertFalse(engine.createSchema());

    execute("CREATE TABLE customers (id INTEGER PRIMARY KEY, name TEXT, dynamic_attributes TEXT)");
    for (int i = 1; i <= 4; i++) execute("INSERT INTO customers (id, name) VALUES (" + i + ", 'c" + i + "')");

    attrs = DynamicAttributes.builder()
        .engine(engine)
        .settings(DynattrSettings.defaults())
        .clock(Clock.fixed(Instant.parse("2024-06-15T10:00:00Z"), ZoneOffset.UTC))
        .build();
  }

  @Test
  void storesSearchesAndOrdersValues() throws SQLException {
    attrs.catalog().define("age", "Age", AttributeType.NUMBER, false, null, null);
    attrs.catalog().define("tier", "Tier", AttributeType.SELECT, false, List.of("gold", "silver"), null);
    attrs.catalog().define("vip", "VIP", AttributeType.BOOLEAN, false, null, null);
    attrs.catalog().define("joined", "Joined", AttributeType.DATE, false, null, null);
    attrs.catalog().define("nickname", "Nickname", AttributeType.TEXT, false, null, null);

    EntityRef c1 = EntityRef.of("customer", 1);
    attrs.values().setMany(c1, Map.of("age", 31, "tier", "gold", "vip", true, "joined", "2020-03-01", "nickname", "Ace"));
    attrs.values().setMany(EntityRef.of("customer", 2),
        Map.of("age", 45, "tier", "silver", "vip", false, "joined", "2022-07-10", "nickname", "Bo"));
    attrs.values().setMany(EntityRef.of("customer", 3), Map.of("age", 22, "tier", "gold", "nickname", "ace of spades"));
    attrs.values().setOne(EntityRef.of("customer", 4), "nickname", "Dee");

    assertEquals(Set.of("1", "3"), attrs.search().search("customer", Map.of("tier", "gold")));
    assertEquals(Set.of("1", "2"), attrs.search().searchNumberRange("customer", "age", 25, 50));
    assertEquals(Set.of("1"), attrs.search().searchBoolean("customer", "vip", true));
    assertEquals(Set.of("2"), attrs.search().searchDateRange("customer", "joined", "2021-01-01", null));
    assertEquals(Set.of("1", "3"), attrs.search().searchText("customer", "nickname", "ace", false));
    assertEquals(Set.of("1"), attrs.search().searchText("customer", "nickname", "Ace", true));
    assertEquals(Set.of("1", "2"), attrs.search().advancedSearch("customer",
        Map.of("tier", "silver", "vip", true), SearchLogic.OR));

    List<String> all = List.of("1", "2", "3", "4");
    assertEquals(List.of("2", "1", "3", "4"), attrs.search().orderBy("customer", all, SortField.desc("age")));
    assertEquals(List.of("3", "1", "2", "4"), attrs.search().orderBy("customer", all, SortField.asc("age")));
    assertEquals(List.of("1", "2", "3", "4"), attrs.search().orderBy("customer", all, SortField.asc("joined")));

    Map<String, Object> values = attrs.values().getAll(c1);
    assertEquals(31.0, values.get("age"));
    assertEquals(LocalDate.of(2020, 3, 1), values.get("joined"));
    assertEquals(Boolean.TRUE, values.get("vip"));
    assertTrue(cacheColumnOf(1).contains("\"tier\":\"gold\""));

    assertTrue(attrs.values().remove(c1, "tier"));
    assertEquals(Set.of("3"), attrs.search().search("customer", Map.of("tier", "gold")));
    assertFalse(cacheColumnOf(1).contains("tier"));
  }

  @Test
  void orderingSpansMoreIdsThanOneStatementBinds() {
    AttributeDefinition priority = attrs.catalog().define("priority", "Priority", AttributeType.NUMBER, false, null, null);
    int count = new SqliteDialect().maxIdsPerStatement() + 300;
    List<String> ids = new ArrayList<>();
    engine.inTx(() -> {
      for (int i = 0; i < count; i++) {
        engine.upsertValue(ValueRecord.of(EntityRef.of("ticket", i), priority, (double) (i % 10)));
        ids.add(String.valueOf(i));
      }
      return null;
    });
    ids.add("unranked");

    List<String> ordered = attrs.search().orderBy("ticket", ids, SortField.desc("priority"));

    assertEquals(count + 1, ordered.size());
    assertEquals(Set.copyOf(ids), Set.copyOf(ordered));
    assertEquals("unranked", ordered.get(count));
    for (int i = 1; i < count; i++) {
      int prev = Integer.parseInt(ordered.get(i - 1)) % 10;
      int cur = Integer.parseInt(ordered.get(i)) % 10;
      assertTrue(prev >= cur, "priority must not increase at position " + i);
      if (prev == cur) assertTrue(ordered.get(i - 1).compareTo(ordered.get(i)) < 0);
    }
  }

  @Test
  void fullTextSearchUsesIndexBuiltByOptimize() {
    assertTrue(attrs.capabilities().supports(Feature.FTS_EXTENSION));
    attrs.catalog().define("bio", "Bio", AttributeType.TEXT, false, null, null);
    attrs.values().setOne(EntityRef.of("customer", 1), "bio", "Collects brass desk lamps");
    attrs.values().setOne(EntityRef.of("customer", 2), "bio", "Sells office chairs");

    assertEquals(6, attrs.optimize().size());
    attrs.values().setOne(EntityRef.of("customer", 3), "bio", "Desk lamps and shades");

    assertEquals(Set.of("1", "3"), attrs.search().search("customer", Criteria.and(Filters.fullText("bio", "desk lamps"))));
  }

  @Test
  void uniqueNameCollisionSurfacesAsDuplicate() {
    AttributeDefinition age = new AttributeDefinition(null, "age", "Age", AttributeType.NUMBER, false, null, null);
    engine.insertDefinition(age);

    assertThrows(DuplicateKeyException.class, () -> engine.insertDefinition(age));
    assertThrows(DuplicateAttributeException.class,
        () -> attrs.catalog().define("age", "Age", AttributeType.NUMBER, false, null, null));
  }

  private void execute(String sql) throws SQLException {
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      st.execute(sql);
    }
  }

  private String cacheColumnOf(int customerId) throws SQLException {
    try (Connection c = ds.getConnection(); Statement st = c.createStatement();
         ResultSet rs = st.executeQuery("SELECT dynamic_attributes FROM customers WHERE id = " + customerId)) {
      assertTrue(rs.next());
      return rs.getString(1);
    }
  }
}
