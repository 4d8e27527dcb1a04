package io.intellixity.dynattr.service;

import io.intellixity.dynattr.config.DynattrSettings;
import io.intellixity.dynattr.error.AttributeNotFoundException;
import io.intellixity.dynattr.error.EntityNotPersistedException;
import io.intellixity.dynattr.error.StorageException;
import io.intellixity.dynattr.error.ValidationException;
import io.intellixity.dynattr.exec.TxHandle;
import io.intellixity.dynattr.memory.InMemoryStorageEngine;
import io.intellixity.dynattr.model.AttributeDraft;
import io.intellixity.dynattr.model.AttributeType;
import io.intellixity.dynattr.model.EntityRef;
import io.intellixity.dynattr.model.ValueRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ValueStoreTest {
  private final InMemoryStorageEngine engine = Fixtures.engine();
  private final DynamicAttributes attrs = Fixtures.attributes(engine);
  private final ValueStore values = attrs.values();
  private final EntityRef e1 = EntityRef.of("customer", 1);

  private void defineAge() {
    attrs.catalog().define("age", "Age", AttributeType.NUMBER, false, null, null);
  }

  @Test
  void ageScenario() {
    defineAge();

    values.setOne(e1, "age", 25);
    assertEquals(25.0, values.getOne(e1, "age"));

    ValidationException invalid = assertThrows(ValidationException.class, () -> values.setOne(e1, "age", "not a number"));
    assertEquals(List.of("The Age must be a number."), invalid.messagesFor("age"));
    assertEquals("not a number", invalid.rawValues().get("age"));

    Map<String, Object> batch = new LinkedHashMap<>();
    batch.put("age", 30);
    batch.put("unknown_attr", "x");
    ValidationException aggregate = assertThrows(ValidationException.class, () -> values.setMany(e1, batch));
    assertEquals(List.of("unknown_attr"), List.copyOf(aggregate.messagesByAttribute().keySet()));
    assertEquals(List.of("The attribute 'unknown_attr' does not exist."), aggregate.messagesFor("unknown_attr"));

    assertEquals(25.0, values.getOne(e1, "age"));
    assertEquals(25.0, engine.findValue(e1, "age").orElseThrow().numberSlot());
  }

  @Test
  void setManyCollectsEveryFailureAndWritesNothing() {
    defineAge();
    attrs.catalog().define(AttributeDraft.of("nickname", "Nickname", "text").rules(Map.of("max", 3)));
    attrs.catalog().define(AttributeDraft.of("vip", "VIP", "boolean"));
    values.setOne(e1, "vip", true);

    Map<String, Object> batch = new LinkedHashMap<>();
    batch.put("age", "old");
    batch.put("nickname", "Maximilian");
    batch.put("vip", false);
    ValidationException ex = assertThrows(ValidationException.class, () -> values.setMany(e1, batch));

    assertEquals(2, ex.violations().size());
    assertEquals(List.of("The Nickname may not be greater than 3 characters."), ex.messagesFor("nickname"));
    assertEquals(Map.of("vip", true), values.getAll(e1));
  }

  @Test
  void setManyWritesAllAndRefreshesCacheOnce() {
    defineAge();
    attrs.catalog().define(AttributeDraft.of("since", "Customer since", "date"));

    Map<String, Object> stored = values.setMany(e1, Map.of("age", "41", "since", "2020-03-01"));
    assertEquals(41.0, stored.get("age"));

    Map<String, Object> expected = Map.of("age", 41.0, "since", LocalDate.of(2020, 3, 1));
    assertEquals(expected, values.getAll(e1));
    assertEquals(expected, engine.cacheDocuments().read(e1).orElseThrow());
    assertEquals(attrs.cache().snapshot(e1), attrs.cache().read(e1).orElseThrow());
  }

  @Test
  void writesToUnsavedEntityAreRejected() {
    defineAge();
    EntityRef unsaved = EntityRef.unsaved("customer");
    assertThrows(EntityNotPersistedException.class, () -> values.setOne(unsaved, "age", 1));
    assertThrows(EntityNotPersistedException.class, () -> values.setMany(unsaved, Map.of("age", 1)));
    assertNull(values.getOne(unsaved, "age"));
    assertTrue(values.getAll(unsaved).isEmpty());
  }

  @Test
  void unknownAttributeOnSetOne() {
    AttributeNotFoundException ex = assertThrows(AttributeNotFoundException.class, () -> values.setOne(e1, "ghost", 1));
    assertEquals("ghost", ex.name());
    assertEquals("1", ex.context().get("entityId"));
  }

  @Test
  void unsetValuesReadAsNullOrEmpty() {
    defineAge();
    assertNull(values.getOne(e1, "age"));
    assertNull(values.getOne(e1, "never_defined"));
    assertTrue(values.getAll(e1).isEmpty());
  }

  @Test
  void explicitNullIsStored() {
    defineAge();
    values.setOne(e1, "age", 20);
    values.setOne(e1, "age", null);
    assertTrue(engine.findValue(e1, "age").isPresent());
    assertNull(values.getOne(e1, "age"));
    assertTrue(values.getAll(e1).containsKey("age"));
  }

  @Test
  void removeDeletesRecordAndRefreshesCache() {
    defineAge();
    values.setOne(e1, "age", 20);
    assertTrue(values.remove(e1, "age"));
    assertFalse(values.remove(e1, "age"));
    assertTrue(engine.findValues(e1).isEmpty());
    assertEquals(Map.of(), engine.cacheDocuments().read(e1).orElseThrow());
  }

  @Test
  void readsFallBackToStoreWithoutCacheDocument() {
    InMemoryStorageEngine plain = new InMemoryStorageEngine();
    DynamicAttributes a = Fixtures.attributes(plain);
    a.catalog().define("age", "Age", AttributeType.NUMBER, false, null, null);
    EntityRef order = EntityRef.of("order", "A-1");
    a.values().setOne(order, "age", "7");
    assertEquals(7.0, a.values().getOne(order, "age"));
    assertEquals(Map.of("age", 7.0), a.values().getAll(order));
  }

  @Test
  void cacheDisabledBySettings() {
    InMemoryStorageEngine eng = Fixtures.engine();
    DynamicAttributes a = DynamicAttributes.builder().engine(eng)
        .settings(DynattrSettings.defaults().setCacheDocumentsEnabled(false))
        .clock(Fixtures.CLOCK)
        .build();
    a.catalog().define("age", "Age", AttributeType.NUMBER, false, null, null);
    a.values().setOne(e1, "age", 3);
    assertTrue(eng.cacheDocuments().read(e1).isEmpty());
    assertEquals(3.0, a.values().getOne(e1, "age"));
  }

  @Test
  void storageFailureRollsBackAndIsSanitized() {
    InMemoryStorageEngine failing = new InMemoryStorageEngine() {
      @Override
      protected void executeUpsertValue(TxHandle tx, ValueRecord record) {
        if (record.attributeName().equals("b")) throw new IllegalStateException("disk full");
        super.executeUpsertValue(tx, record);
      }
    };
    DynamicAttributes a = Fixtures.attributes(failing);
    a.catalog().define("a", "A", AttributeType.TEXT, false, null, null);
    a.catalog().define("b", "B", AttributeType.TEXT, false, null, null);

    Map<String, Object> batch = new LinkedHashMap<>();
    batch.put("a", "x");
    batch.put("b", "y");
    StorageException ex = assertThrows(StorageException.class, () -> a.values().setMany(e1, batch));

    assertEquals("The attribute update could not be completed. Please try again later.", ex.userMessage());
    assertEquals(List.of("a", "b"), ex.context().get("attributes"));
    assertTrue(ex.getCause() instanceof IllegalStateException);
    assertTrue(failing.findValues(e1).isEmpty());
  }
}
