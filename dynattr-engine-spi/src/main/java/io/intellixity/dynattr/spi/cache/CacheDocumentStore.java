package io.intellixity.dynattr.spi.cache;

import io.intellixity.dynattr.model.EntityRef;

import java.util.Map;
import java.util.Optional;

/**
 * Denormalized per-entity snapshot of attribute values, stored alongside the host record.
 * <p>
 * Not authoritative. Implementations write within the owning engine's current transaction.
 */
public interface CacheDocumentStore {
  /** Whether host records of {@code entityType} have a cache slot at all. */
  boolean carriesCache(String entityType);

  /** The stored document, empty when the slot is unset or the host type carries none. */
  Optional<Map<String, Object>> read(EntityRef entity);

  /** Replaces the whole document. */
  void write(EntityRef entity, Map<String, Object> document);

  CacheDocumentStore NONE = new CacheDocumentStore() {
    @Override public boolean carriesCache(String entityType) { return false; }
    @Override public Optional<Map<String, Object>> read(EntityRef entity) { return Optional.empty(); }
    @Override public void write(EntityRef entity, Map<String, Object> document) {}
  };
}
