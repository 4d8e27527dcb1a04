package io.intellixity.dynattr.service;

import io.intellixity.dynattr.error.AttributeNotFoundException;
import io.intellixity.dynattr.memory.InMemoryCapabilities;
import io.intellixity.dynattr.memory.InMemoryStorageEngine;
import io.intellixity.dynattr.model.AttributeDraft;
import io.intellixity.dynattr.model.AttributeType;
import io.intellixity.dynattr.model.EntityRef;
import io.intellixity.dynattr.query.Criteria;
import io.intellixity.dynattr.query.Filters;
import io.intellixity.dynattr.query.QueryValidationException;
import io.intellixity.dynattr.query.SearchLogic;
import io.intellixity.dynattr.query.SortField;
import io.intellixity.dynattr.spi.capability.Feature;
import io.intellixity.dynattr.spi.capability.FeatureCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class SearchCompilerTest {
  private DynamicAttributes attrs;
  private SearchCompiler search;

  @BeforeEach
  void setUp() {
    attrs = Fixtures.attributes(new InMemoryStorageEngine());
    search = attrs.search();
    attrs.catalog().define("level", "Level", AttributeType.NUMBER, false, null, null);
    attrs.catalog().define("code", "Code", AttributeType.TEXT, false, null, null);
    for (int i = 1; i <= 7; i++) {
      attrs.values().setOne(EntityRef.of("customer", "E" + i), "level", i);
    }
  }

  private void set(String id, String attribute, Object value) {
    attrs.values().setOne(EntityRef.of("customer", id), attribute, value);
  }

  @Test
  void numericComparisons() {
    assertEquals(4, search.search("customer", Map.of("level", Map.of("operator", ">", "value", 3))).size());
    assertEquals(3, search.search("customer", Map.of("level", Map.of("operator", ">=", "value", "5"))).size());
    assertEquals(Set.of("E2", "E3"),
        search.search("customer", Map.of("level", Map.of("operator", "between", "value", Map.of("min", 2, "max", 3)))));
    assertEquals(Set.of("E4"), search.search("customer", Map.of("level", 4)));
    assertEquals(6, search.search("customer", Criteria.and(Filters.ne("level", 4))).size());
  }

  @Test
  void textComparesLexicographically() {
    set("E1", "code", "10");
    set("E2", "code", "5");
    assertEquals(Set.of("E2"), search.search("customer", Criteria.and(Filters.gt("code", "4"))));
    assertEquals(Set.of("E2"), search.search("customer", Criteria.and(Filters.gt("code", 4))));
  }

  @Test
  void andIntersectsOrUnions() {
    Map<String, Object> filters = Map.of(
        "level", Map.of("operator", "<", "value", 3),
        "code", Map.of("operator", "=", "value", "x"));
    set("E1", "code", "x");
    set("E6", "code", "x");

    assertEquals(Set.of("E1"), search.search("customer", filters));
    assertEquals(Set.of("E1", "E2", "E6"), search.advancedSearch("customer", filters, "OR"));
    assertEquals(Set.of("E1", "E2", "E6"), search.advancedSearch("customer", filters, SearchLogic.OR));
  }

  @Test
  void emptyFilterMap() {
    assertEquals(7, search.search("customer", Map.of()).size());
    assertTrue(search.advancedSearch("customer", Map.of(), "or").isEmpty());
  }

  @Test
  void nullMatchesMissingAndExplicitNull() {
    set("E1", "code", "a");
    set("E2", "code", null);

    Set<String> missing = search.search("customer", Criteria.and(Filters.isNull("code")));
    assertEquals(Set.of("E2", "E3", "E4", "E5", "E6", "E7"), missing);
    assertEquals(Set.of("E1"), search.search("customer", Criteria.and(Filters.notNull("code"))));

    Map<String, Object> eqNull = new java.util.HashMap<>();
    eqNull.put("code", null);
    assertEquals(missing, search.search("customer", eqNull));
  }

  @Test
  void entitiesWithoutAnyValueNeverMatch() {
    assertFalse(search.search("customer", Criteria.and(Filters.isNull("code"))).contains("E99"));
    assertTrue(search.search("order", Criteria.and(Filters.isNull("code"))).isEmpty());
  }

  @Test
  void inLists() {
    assertEquals(Set.of("E1", "E7"), search.search("customer", Map.of("level", List.of(1, "7"))));
    assertTrue(search.search("customer", Criteria.and(Filters.in("level", List.of()))).isEmpty());
  }

  @Test
  void likeAndFullText() {
    attrs.catalog().define("description", "Description", AttributeType.TEXT, false, null, null);
    set("E1", "description", "Brass lamp with shade");
    set("E2", "description", "lamp, brass finish");

    assertEquals(Set.of("E1", "E2"), search.searchText("customer", "description", "LAMP", false));
    assertTrue(search.searchText("customer", "description", "LAMP", true).isEmpty());
    assertEquals(Set.of("E1", "E2"), search.search("customer", Criteria.and(Filters.fullText("description", "brass lamp"))));
  }

  @Test
  void fullTextFallsBackToLikeWithoutSupport() {
    InMemoryCapabilities noFullText = new InMemoryCapabilities(new FeatureCache(), EnumSet.of(Feature.CASE_SENSITIVE_LIKE));
    InMemoryStorageEngine engine = new InMemoryStorageEngine(noFullText);
    DynamicAttributes a = Fixtures.attributes(engine);
    a.catalog().define("description", "Description", AttributeType.TEXT, false, null, null);
    a.values().setOne(EntityRef.of("product", 1), "description", "Brass lamp with shade");
    a.values().setOne(EntityRef.of("product", 2), "description", "lamp, brass finish");

    assertEquals(Set.of("1"), a.search().search("product", Criteria.and(Filters.fullText("description", "brass lamp"))));
  }

  @Test
  void likeRequiresTextSlot() {
    assertThrows(QueryValidationException.class,
        () -> search.search("customer", Criteria.and(Filters.like("level", "1"))));
  }

  @Test
  void rangeHelpers() {
    attrs.catalog().define("joined", "Joined", AttributeType.DATE, false, null, null);
    attrs.catalog().define("vip", "VIP", AttributeType.BOOLEAN, false, null, null);
    set("E1", "joined", "2024-01-10");
    set("E2", "joined", "2024-06-15");
    set("E3", "vip", "1");
    set("E4", "vip", false);

    assertEquals(Set.of("E2", "E3", "E4", "E5"), search.searchNumberRange("customer", "level", 2, 5));
    assertEquals(Set.of("E6", "E7"), search.searchNumberRange("customer", "level", 6, null));
    assertEquals(7, search.searchNumberRange("customer", "level", null, null).size());
    assertEquals(Set.of("E2"), search.searchDateRange("customer", "joined", "today", null));
    assertEquals(Set.of("E1", "E2"), search.searchDateRange("customer", "joined", "2024-01-01", "2024-12-31"));
    assertEquals(Set.of("E3"), search.searchBoolean("customer", "vip", true));
    assertEquals(Set.of("E4"), search.searchBoolean("customer", "vip", false));
  }

  @Test
  void selectFiltersUseOptionText() {
    attrs.catalog().define(AttributeDraft.of("tier", "Tier", "select").options(List.of("gold", "silver")));
    set("E1", "tier", "gold");
    set("E2", "tier", "silver");
    assertEquals(Set.of("E1"), search.search("customer", Map.of("tier", "gold")));
    assertTrue(search.search("customer", Map.of("tier", "bronze")).isEmpty());
  }

  @Test
  void unknownAttributeAndBadOperand() {
    assertThrows(AttributeNotFoundException.class, () -> search.search("customer", Map.of("ghost", 1)));
    assertThrows(QueryValidationException.class, () -> search.search("customer", Map.of("level", "abc")));
    assertThrows(QueryValidationException.class,
        () -> search.search("customer", Map.of("level", Map.of("operator", "~~", "value", 1))));
  }

  @Test
  void orderByPutsMissingValuesLast() {
    set("E99", "code", "z");
    List<String> ids = List.of("E99", "E2", "E7", "E5");
    assertEquals(List.of("E2", "E5", "E7", "E99"), search.orderBy("customer", ids, SortField.asc("level")));
    assertEquals(List.of("E7", "E5", "E2", "E99"), search.orderBy("customer", ids, SortField.desc("level")));
  }
}
