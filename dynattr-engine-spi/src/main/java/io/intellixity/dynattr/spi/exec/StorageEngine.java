package io.intellixity.dynattr.spi.exec;

import io.intellixity.dynattr.exec.Propagation;
import io.intellixity.dynattr.model.AttributeDefinition;
import io.intellixity.dynattr.model.EntityRef;
import io.intellixity.dynattr.model.ValueRecord;
import io.intellixity.dynattr.model.ValueSlot;
import io.intellixity.dynattr.query.SortField;
import io.intellixity.dynattr.spi.cache.CacheDocumentStore;
import io.intellixity.dynattr.spi.capability.BackendCapabilities;
import io.intellixity.dynattr.spi.search.SlotPredicate;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Persistence port for attribute definitions, value records and their search indexes.
 * <p>
 * Writes join the caller's transaction (see {@link #inTx(Propagation, Supplier)}) or run in their
 * own. Reads see the current transaction when one is active. Backend failures surface as
 * {@link StorageEngineException}.
 */
public interface StorageEngine {
  /** Backend identifier for logging. */
  String id();

  Propagation defaultPropagation();

  <T> T inTx(Supplier<T> work);

  <T> T inTx(Propagation propagation, Supplier<T> work);

  BackendCapabilities capabilities();

  /** Cache document store bound to this engine's transactions. */
  CacheDocumentStore cacheDocuments();

  // --- definitions ---

  /** Persists a new definition and returns it with its id. */
  AttributeDefinition insertDefinition(AttributeDefinition def);

  void updateDefinition(AttributeDefinition def);

  Optional<AttributeDefinition> findDefinition(String name);

  /** All definitions ordered by name. */
  List<AttributeDefinition> listDefinitions();

  boolean deleteDefinition(long attributeId);

  // --- values ---

  /** Inserts or replaces the record keyed by (entity id, entity type, attribute id). */
  void upsertValue(ValueRecord record);

  Optional<ValueRecord> findValue(EntityRef entity, String attributeName);

  /** All records of one entity ordered by attribute name. */
  List<ValueRecord> findValues(EntityRef entity);

  boolean deleteValue(EntityRef entity, String attributeName);

  long deleteValuesForAttribute(long attributeId);

  List<EntityRef> entitiesWithAttribute(long attributeId);

  // --- search ---

  /** Ids of every entity of the type holding at least one value record. */
  Set<String> entityIds(String entityType);

  Set<String> matchingEntityIds(String entityType, String attributeName, SlotPredicate predicate);

  /** Keyset page of {@link #entityIds} ordered by id, starting after {@code afterExclusive}. */
  List<String> entityIdsAfter(String entityType, String afterExclusive, int limit);

  /**
   * {@code ids} ordered by the attribute's value in {@code slot}; ids without a value (or with an
   * explicit null) follow in their original order.
   */
  List<String> orderEntityIds(String entityType, Collection<String> ids, String attributeName,
                              ValueSlot slot, SortField.Direction direction);

  /**
   * Runs the backend's advisory index statements. Failing statements are logged and skipped.
   *
   * @return the statements that succeeded
   */
  List<String> applyAdvisoryIndexes();
}
