package io.intellixity.dynattr.service;

import io.intellixity.dynattr.config.DynattrSettings;
import io.intellixity.dynattr.error.StorageException;
import io.intellixity.dynattr.exec.Propagation;
import io.intellixity.dynattr.model.EntityRef;
import io.intellixity.dynattr.model.ValueRecord;
import io.intellixity.dynattr.service.internal.StorageGuard;
import io.intellixity.dynattr.spi.cache.CacheDocumentStore;
import io.intellixity.dynattr.spi.exec.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps cache documents equal to the value store.
 * <p>
 * {@link #refresh} always rewrites the whole document from the stored values and runs in the
 * caller's transaction, so a value write and its cache refresh commit together.
 */
public final class CacheSynchronizer {
  private static final Logger log = LoggerFactory.getLogger(CacheSynchronizer.class);

  private final StorageEngine engine;
  private final CacheDocumentStore documents;
  private final DynattrSettings settings;

  public CacheSynchronizer(StorageEngine engine, CacheDocumentStore documents, DynattrSettings settings) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.documents = Objects.requireNonNull(documents, "documents");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /** Whether entities of this type get a cache document. */
  public boolean enabledFor(String entityType) {
    return settings.isCacheDocumentsEnabled() && documents.carriesCache(entityType);
  }

  /**
   * Rebuilds the entity's document from the value store.
   *
   * @return {@code false} when the entity type has no cache document
   */
  public boolean refresh(EntityRef entity) {
    if (!entity.persisted() || !enabledFor(entity.type())) return false;
    engine.inTx(Propagation.REQUIRED, () -> {
      documents.write(entity, snapshot(entity));
      return null;
    });
    return true;
  }

  public void refreshAll(Collection<EntityRef> entities) {
    for (EntityRef e : entities) refresh(e);
  }

  /** Current values straight from the value store, by attribute name. */
  public Map<String, Object> snapshot(EntityRef entity) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (ValueRecord r : engine.findValues(entity)) {
      out.put(r.attributeName(), r.value());
    }
    return out;
  }

  /** The stored document; empty when absent, disabled, or never written. */
  public Optional<Map<String, Object>> read(EntityRef entity) {
    if (!entity.persisted() || !enabledFor(entity.type())) return Optional.empty();
    return documents.read(entity);
  }

  public long resync(String entityType) {
    return resync(entityType, settings.getResyncBatchSize());
  }

  /**
   * Rebuilds the documents of every entity of {@code entityType} holding at least one value.
   * Each batch commits on its own; when a batch fails, earlier batches stay committed and the
   * failure is rethrown.
   *
   * @return the number of entities processed
   */
  public long resync(String entityType, int batchSize) {
    if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
    if (!enabledFor(entityType)) {
      log.debug("dynattr.cache op=resync entityType={} skipped=no-cache-document", entityType);
      return 0;
    }

    long processed = 0;
    String after = null;
    while (true) {
      final String from = after;
      List<String> batch = StorageGuard.run(log, "resync", null, List.of(),
          () -> engine.entityIdsAfter(entityType, from, batchSize));
      if (batch.isEmpty()) break;

      try {
        engine.inTx(Propagation.REQUIRES_NEW, () -> {
          for (String id : batch) refresh(new EntityRef(id, entityType));
          return null;
        });
      } catch (RuntimeException e) {
        log.error("dynattr.cache op=resync entityType={} batchFirst={} batchLast={} processed={} error={}",
            entityType, batch.get(0), batch.get(batch.size() - 1), processed, e.toString(), e);
        throw new StorageException("resync", null, List.of(), e);
      }
      processed += batch.size();
      after = batch.get(batch.size() - 1);
      log.debug("dynattr.cache op=resync entityType={} processed={}", entityType, processed);
      if (batch.size() < batchSize) break;
    }
    log.info("dynattr.cache op=resync entityType={} processed={}", entityType, processed);
    return processed;
  }
}
