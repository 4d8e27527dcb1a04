package io.intellixity.dynattr.service;

import io.intellixity.dynattr.error.AttributeNotFoundException;
import io.intellixity.dynattr.error.DefinitionException;
import io.intellixity.dynattr.error.DuplicateAttributeException;
import io.intellixity.dynattr.model.AttributeDefinition;
import io.intellixity.dynattr.model.AttributeDraft;
import io.intellixity.dynattr.model.AttributeType;
import io.intellixity.dynattr.model.EntityRef;
import io.intellixity.dynattr.service.internal.DefinitionCache;
import io.intellixity.dynattr.service.internal.StorageGuard;
import io.intellixity.dynattr.spi.exec.DuplicateKeyException;
import io.intellixity.dynattr.spi.exec.StorageEngine;
import io.intellixity.dynattr.validation.DefinitionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Attribute definitions: define, look up, update, delete. */
public final class AttributeCatalog {
  private static final Logger log = LoggerFactory.getLogger(AttributeCatalog.class);

  private final StorageEngine engine;
  private final DefinitionValidator validator;
  private final DefinitionCache cache;
  private final CacheSynchronizer synchronizer;

  public AttributeCatalog(StorageEngine engine, DefinitionValidator validator, DefinitionCache cache,
                          CacheSynchronizer synchronizer) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.validator = Objects.requireNonNull(validator, "validator");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.synchronizer = Objects.requireNonNull(synchronizer, "synchronizer");
  }

  public AttributeDefinition define(String name, String label, AttributeType type, boolean required,
                                    List<String> options, Map<String, Object> rules) {
    return define(new AttributeDraft(name, label, type == null ? null : type.id(), required, options, rules));
  }

  /**
   * Validates and stores a new attribute.
   *
   * @throws DefinitionException listing every violated constraint
   * @throws DuplicateAttributeException when the name is taken
   */
  public AttributeDefinition define(AttributeDraft draft) {
    AttributeDefinition def = validator.validate(draft);
    List<String> names = List.of(def.name());
    return StorageGuard.run(log, "define", null, names, () -> {
      try {
        return engine.inTx(() -> {
          if (engine.findDefinition(def.name()).isPresent()) throw new DuplicateAttributeException(def.name());
          AttributeDefinition stored = engine.insertDefinition(def);
          log.info("dynattr.catalog op=define attribute={} type={} id={}", stored.name(), stored.type().id(), stored.id());
          return stored;
        });
      } catch (DuplicateKeyException e) {
        // a concurrent define won the insert
        log.debug("dynattr.catalog op=define attribute={} duplicate key: {}", def.name(), e.getMessage());
        throw new DuplicateAttributeException(def.name());
      }
    });
  }

  public Optional<AttributeDefinition> lookup(String name) {
    if (name == null) return Optional.empty();
    return StorageGuard.run(log, "lookup", null, List.of(name), () -> cache.getOrLoad(name, engine::findDefinition));
  }

  public AttributeDefinition require(String name) {
    return lookup(name).orElseThrow(() -> new AttributeNotFoundException(name));
  }

  AttributeDefinition require(String name, EntityRef entity) {
    return lookup(name).orElseThrow(() -> new AttributeNotFoundException(name, entity));
  }

  /** All definitions ordered by name. */
  public List<AttributeDefinition> list() {
    return StorageGuard.run(log, "list", null, List.of(), engine::listDefinitions);
  }

  /**
   * Replaces label, required flag, options and rules. Name and type are immutable.
   *
   * @throws DefinitionException listing every violated constraint
   */
  public AttributeDefinition update(String name, AttributeDraft draft) {
    AttributeDefinition current = require(name);
    AttributeDraft effective = new AttributeDraft(
        draft.name() == null ? name : draft.name(),
        draft.label(),
        draft.type() == null ? current.type().id() : draft.type(),
        draft.required(),
        draft.options(),
        draft.validationRules());

    Map<String, List<String>> errors = new LinkedHashMap<>(validator.violations(effective));
    if (!name.equals(effective.name())) {
      errors.computeIfAbsent("name", k -> new ArrayList<>()).add("The name of an attribute cannot be changed.");
    }
    if (AttributeType.fromId(effective.type()).filter(t -> t != current.type()).isPresent()) {
      errors.computeIfAbsent("type", k -> new ArrayList<>()).add("The type of an attribute cannot be changed.");
    }
    if (!errors.isEmpty()) throw new DefinitionException(errors);

    AttributeDefinition updated = validator.validate(effective).withId(current.id());
    StorageGuard.run(log, "update", null, List.of(name), () -> {
      engine.updateDefinition(updated);
      return null;
    });
    cache.invalidate(name);
    log.info("dynattr.catalog op=update attribute={} id={}", name, updated.id());
    return updated;
  }

  /**
   * Deletes the attribute and all of its values, and refreshes the cache documents of the affected
   * entities, in one transaction.
   *
   * @return the number of deleted value records
   */
  public long delete(String name) {
    AttributeDefinition def = require(name);
    try {
      long removed = StorageGuard.run(log, "delete", null, List.of(name), () -> engine.inTx(() -> {
        List<EntityRef> affected = engine.entitiesWithAttribute(def.id());
        long n = engine.deleteValuesForAttribute(def.id());
        engine.deleteDefinition(def.id());
        synchronizer.refreshAll(affected);
        return n;
      }));
      log.info("dynattr.catalog op=delete attribute={} values={}", name, removed);
      return removed;
    } finally {
      cache.invalidate(name);
    }
  }
}
