package io.intellixity.dynattr.service;

import io.intellixity.dynattr.error.AttributeNotFoundException;
import io.intellixity.dynattr.error.EntityNotPersistedException;
import io.intellixity.dynattr.error.ValidationException;
import io.intellixity.dynattr.error.Violation;
import io.intellixity.dynattr.model.AttributeDefinition;
import io.intellixity.dynattr.model.EntityRef;
import io.intellixity.dynattr.model.ValueRecord;
import io.intellixity.dynattr.service.internal.StorageGuard;
import io.intellixity.dynattr.spi.exec.StorageEngine;
import io.intellixity.dynattr.validation.ValueValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed attribute values of host entities.
 * <p>
 * Writes validate first and only then touch storage; the value write and the cache refresh share
 * one transaction. Reads prefer the cache document and fall back to the value records.
 */
public final class ValueStore {
  private static final Logger log = LoggerFactory.getLogger(ValueStore.class);

  private final AttributeCatalog catalog;
  private final ValueValidator validator;
  private final StorageEngine engine;
  private final CacheSynchronizer synchronizer;

  public ValueStore(AttributeCatalog catalog, ValueValidator validator, StorageEngine engine,
                    CacheSynchronizer synchronizer) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.validator = Objects.requireNonNull(validator, "validator");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.synchronizer = Objects.requireNonNull(synchronizer, "synchronizer");
  }

  /** A validated value ready to be written. */
  private record Prepared(AttributeDefinition definition, Object value) {}

  /**
   * Validates, casts and stores one value.
   *
   * @return the stored (cast) value
   */
  public Object setOne(EntityRef entity, String attributeName, Object rawValue) {
    requirePersisted(entity, "setting attributes");
    AttributeDefinition def = catalog.require(attributeName, entity);
    validator.validate(def, rawValue);
    Object cast = validator.cast(def, rawValue);

    StorageGuard.run(log, "update", entity, List.of(attributeName), () -> engine.inTx(() -> {
      engine.upsertValue(ValueRecord.of(entity, def, cast));
      synchronizer.refresh(entity);
      return null;
    }));
    log.debug("dynattr.values op=set entity={} attribute={}", entity, attributeName);
    return cast;
  }

  /**
   * Validates every entry, then writes all of them and refreshes the cache once. If any entry is
   * unknown or invalid nothing is written and a single {@link ValidationException} lists all
   * problems.
   *
   * @return the stored (cast) values by attribute name
   */
  public Map<String, Object> setMany(EntityRef entity, Map<String, ?> rawValues) {
    requirePersisted(entity, "setting attributes");
    if (rawValues.isEmpty()) return Map.of();

    List<Prepared> plan = prepare(entity, rawValues);
    List<String> names = new ArrayList<>(rawValues.keySet());

    Map<String, Object> out = new LinkedHashMap<>();
    StorageGuard.run(log, "update", entity, names, () -> engine.inTx(() -> {
      for (Prepared p : plan) {
        engine.upsertValue(ValueRecord.of(entity, p.definition(), p.value()));
        out.put(p.definition().name(), p.value());
      }
      synchronizer.refresh(entity);
      return null;
    }));
    log.debug("dynattr.values op=set-many entity={} attributes={}", entity, names);
    return out;
  }

  /** Phase one of {@link #setMany}: no side effects. */
  private List<Prepared> prepare(EntityRef entity, Map<String, ?> rawValues) {
    List<Prepared> plan = new ArrayList<>();
    List<Violation> violations = new ArrayList<>();
    for (Map.Entry<String, ?> e : rawValues.entrySet()) {
      Optional<AttributeDefinition> def = catalog.lookup(e.getKey());
      if (def.isEmpty()) {
        AttributeNotFoundException nf = new AttributeNotFoundException(e.getKey(), entity);
        violations.add(new Violation(e.getKey(), nf.userMessage(), nf.context()));
        continue;
      }
      List<Violation> v = validator.violations(def.get(), e.getValue());
      if (v.isEmpty()) plan.add(new Prepared(def.get(), validator.cast(def.get(), e.getValue())));
      else violations.addAll(v);
    }
    if (!violations.isEmpty()) {
      Map<String, Object> raw = new LinkedHashMap<>(rawValues);
      throw new ValidationException(violations, raw);
    }
    return plan;
  }

  /** The value, or {@code null} when unset. */
  public Object getOne(EntityRef entity, String attributeName) {
    if (!entity.persisted()) return null;
    Optional<Map<String, Object>> doc = cachedDocument(entity);
    if (doc.isPresent()) {
      return doc.get().containsKey(attributeName) ? decode(attributeName, doc.get().get(attributeName)) : null;
    }
    return StorageGuard.run(log, "read", entity, List.of(attributeName),
        () -> engine.findValue(entity, attributeName).map(ValueRecord::value).orElse(null));
  }

  /** All values by attribute name; empty when none are set. */
  public Map<String, Object> getAll(EntityRef entity) {
    if (!entity.persisted()) return Map.of();
    Optional<Map<String, Object>> doc = cachedDocument(entity);
    if (doc.isPresent()) {
      Map<String, Object> out = new LinkedHashMap<>();
      doc.get().forEach((name, raw) -> {
        if (catalog.lookup(name).isPresent()) out.put(name, decode(name, raw));
      });
      return out;
    }
    return StorageGuard.run(log, "read", entity, List.of(), () -> synchronizer.snapshot(entity));
  }

  /**
   * Deletes the entity's value of the attribute and refreshes its cache document.
   *
   * @return whether a value existed
   */
  public boolean remove(EntityRef entity, String attributeName) {
    requirePersisted(entity, "removing attributes");
    boolean removed = StorageGuard.run(log, "removal", entity, List.of(attributeName), () -> engine.inTx(() -> {
      boolean r = engine.deleteValue(entity, attributeName);
      synchronizer.refresh(entity);
      return r;
    }));
    log.debug("dynattr.values op=remove entity={} attribute={} removed={}", entity, attributeName, removed);
    return removed;
  }

  private Optional<Map<String, Object>> cachedDocument(EntityRef entity) {
    return StorageGuard.run(log, "read", entity, List.of(),
        () -> synchronizer.read(entity).filter(d -> !d.isEmpty()));
  }

  /** Cache documents hold serialized values; restore the storage type. */
  private Object decode(String attributeName, Object raw) {
    if (raw == null) return null;
    return catalog.lookup(attributeName).map(def -> validator.cast(def, raw)).orElse(null);
  }

  private static void requirePersisted(EntityRef entity, String operation) {
    if (!entity.persisted()) throw new EntityNotPersistedException(entity, operation);
  }
}
