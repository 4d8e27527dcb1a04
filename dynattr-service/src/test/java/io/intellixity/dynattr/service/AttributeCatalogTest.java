package io.intellixity.dynattr.service;

import io.intellixity.dynattr.error.AttributeNotFoundException;
import io.intellixity.dynattr.error.DefinitionException;
import io.intellixity.dynattr.error.DuplicateAttributeException;
import io.intellixity.dynattr.exec.TxHandle;
import io.intellixity.dynattr.memory.InMemoryStorageEngine;
import io.intellixity.dynattr.model.AttributeDefinition;
import io.intellixity.dynattr.model.AttributeDraft;
import io.intellixity.dynattr.model.AttributeType;
import io.intellixity.dynattr.model.EntityRef;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class AttributeCatalogTest {
  private final InMemoryStorageEngine engine = Fixtures.engine();
  private final DynamicAttributes attrs = Fixtures.attributes(engine);
  private final AttributeCatalog catalog = attrs.catalog();

  @Test
  void defineStoresValidatedDefinition() {
    AttributeDefinition def = catalog.define(AttributeDraft.of("tier", "  Tier ", "select")
        .options(List.of("gold", "silver"))
        .required(true));

    assertNotNull(def.id());
    assertEquals("Tier", def.label());
    assertEquals(AttributeType.SELECT, def.type());
    assertEquals(List.of("gold", "silver"), def.options());
    assertEquals(def, catalog.require("tier"));
  }

  @Test
  void defineReportsEveryViolation() {
    DefinitionException ex = assertThrows(DefinitionException.class,
        () -> catalog.define(AttributeDraft.of("9lives", "", "color")));
    assertEquals(List.of("name", "label", "type"), List.copyOf(ex.violations().keySet()));
    assertEquals(List.of("The type must be one of: text, number, date, boolean, select."), ex.violations().get("type"));
    assertTrue(catalog.list().isEmpty());
  }

  @Test
  void duplicateNameIsRejected() {
    catalog.define("age", "Age", AttributeType.NUMBER, false, null, null);
    DuplicateAttributeException ex = assertThrows(DuplicateAttributeException.class,
        () -> catalog.define("age", "Age again", AttributeType.TEXT, false, null, null));
    assertEquals("attribute_duplicate", ex.code());
    assertEquals(List.of("An attribute with the name 'age' already exists."), ex.messages());
  }

  @Test
  void concurrentDefineOfSameNameIsReportedAsDuplicate() {
    // lookups miss as if another definer committed between lookup and insert
    InMemoryStorageEngine racing = new InMemoryStorageEngine() {
      @Override
      protected AttributeDefinition selectDefinition(TxHandle txOrNull, String name) {
        return null;
      }
    };
    AttributeCatalog c = Fixtures.attributes(racing).catalog();
    c.define("age", "Age", AttributeType.NUMBER, false, null, null);

    DuplicateAttributeException ex = assertThrows(DuplicateAttributeException.class,
        () -> c.define("age", "Age", AttributeType.NUMBER, false, null, null));

    assertEquals("age", ex.name());
    assertEquals(1, racing.listDefinitions().size());
  }

  @Test
  void listIsOrderedByName() {
    catalog.define("zeta", "Zeta", AttributeType.TEXT, false, null, null);
    catalog.define("alpha", "Alpha", AttributeType.TEXT, false, null, null);
    assertEquals(List.of("alpha", "zeta"), catalog.list().stream().map(AttributeDefinition::name).toList());
  }

  @Test
  void lookupOfUnknownName() {
    assertTrue(catalog.lookup("nope").isEmpty());
    assertTrue(catalog.lookup(null).isEmpty());
    AttributeNotFoundException ex = assertThrows(AttributeNotFoundException.class, () -> catalog.require("nope"));
    assertEquals("The attribute 'nope' does not exist.", ex.userMessage());
  }

  @Test
  void updateReplacesMutableFields() {
    catalog.define("age", "Age", AttributeType.NUMBER, false, null, Map.of("min", 0));
    catalog.lookup("age");

    AttributeDefinition updated = catalog.update("age",
        AttributeDraft.of("age", "Age in years", "number").required(true).rules(Map.of("min", 18)));

    assertEquals("Age in years", updated.label());
    assertTrue(updated.required());
    assertEquals(18, updated.rule("min"));
    assertEquals(updated, catalog.require("age"));
  }

  @Test
  void updateKeepsNameAndTypeImmutable() {
    catalog.define("age", "Age", AttributeType.NUMBER, false, null, null);
    DefinitionException ex = assertThrows(DefinitionException.class,
        () -> catalog.update("age", AttributeDraft.of("years", "Age", "text")));
    assertEquals(List.of("The name of an attribute cannot be changed."), ex.violations().get("name"));
    assertEquals(List.of("The type of an attribute cannot be changed."), ex.violations().get("type"));
    assertEquals(AttributeType.NUMBER, catalog.require("age").type());
  }

  @Test
  void updateWithoutTypeKeepsCurrentType() {
    catalog.define("age", "Age", AttributeType.NUMBER, false, null, null);
    AttributeDefinition updated = catalog.update("age", new AttributeDraft(null, "Years", null, false, null, null));
    assertEquals(AttributeType.NUMBER, updated.type());
    assertEquals("Years", updated.label());
  }

  @Test
  void deleteCascadesToValuesAndCacheDocuments() {
    catalog.define("age", "Age", AttributeType.NUMBER, false, null, null);
    catalog.define("nickname", "Nickname", AttributeType.TEXT, false, null, null);
    EntityRef c1 = EntityRef.of("customer", 1);
    EntityRef c2 = EntityRef.of("customer", 2);
    attrs.values().setMany(c1, Map.of("age", 30, "nickname", "Bo"));
    attrs.values().setOne(c2, "age", 40);

    assertEquals(2, catalog.delete("age"));

    assertTrue(catalog.lookup("age").isEmpty());
    assertEquals(Map.of("nickname", "Bo"), engine.cacheDocuments().read(c1).orElseThrow());
    assertEquals(Map.of(), engine.cacheDocuments().read(c2).orElseThrow());
    assertEquals(1, engine.findValues(c1).size());
    assertThrows(AttributeNotFoundException.class, () -> catalog.delete("age"));
  }

  @Test
  void redefineAfterDeleteStartsEmpty() {
    catalog.define("age", "Age", AttributeType.NUMBER, false, null, null);
    EntityRef c1 = EntityRef.of("customer", 1);
    attrs.values().setOne(c1, "age", 30);
    catalog.delete("age");

    catalog.define("age", "Age", AttributeType.TEXT, false, null, null);
    assertNull(attrs.values().getOne(c1, "age"));
  }
}
