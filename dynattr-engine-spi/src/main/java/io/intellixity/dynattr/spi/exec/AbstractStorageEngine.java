package io.intellixity.dynattr.spi.exec;

import io.intellixity.dynattr.exec.Propagation;
import io.intellixity.dynattr.exec.TxHandle;
import io.intellixity.dynattr.model.AttributeDefinition;
import io.intellixity.dynattr.model.EntityRef;
import io.intellixity.dynattr.model.ValueRecord;
import io.intellixity.dynattr.model.ValueSlot;
import io.intellixity.dynattr.query.SortField;
import io.intellixity.dynattr.spi.search.SlotPredicate;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Template-method base for storage engines.\n
 *
 * Responsibilities:\n
 * - Transaction scoping via {@link #inTx(Propagation, Supplier)}\n
 * - Writes open a transaction with {@link #defaultWritePropagation()} when the caller has none\n
 * - Reads run against the current transaction, if any\n
 * - Delegation to backend hooks that receive the active {@link TxHandle}\n
 */
public abstract class AbstractStorageEngine implements StorageEngine {
  /**
   * Engine-scoped transaction slot. Each engine has its own, so a transaction opened by another
   * engine on the same thread is never joined.
   */
  private final ThreadLocal<TxHandle> current = new ThreadLocal<>();
  private final Propagation defaultPropagation;

  protected AbstractStorageEngine(Propagation defaultPropagation) {
    this.defaultPropagation = (defaultPropagation == null) ? Propagation.REQUIRED : defaultPropagation;
  }

  protected AbstractStorageEngine() {
    this(Propagation.REQUIRED);
  }

  /** Backend-specific transaction begin. */
  protected abstract TxHandle begin();

  /** Backend-specific transaction commit (paired with {@link #begin()}). */
  protected abstract void commit(TxHandle tx);

  /** Backend-specific transaction rollback (paired with {@link #begin()}). */
  protected abstract void rollback(TxHandle tx);

  @Override
  public final Propagation defaultPropagation() {
    return defaultPropagation;
  }

  /** Propagation used by writes when the caller did not wrap them in {@link #inTx}. */
  protected Propagation defaultWritePropagation() { return defaultPropagation; }

  protected final TxHandle currentTxOrNull() {
    return current.get();
  }

  @Override
  public <T> T inTx(Supplier<T> work) {
    return inTx(defaultPropagation, work);
  }

  @Override
  public final <T> T inTx(Propagation propagation, Supplier<T> work) {
    Objects.requireNonNull(propagation, "propagation");
    Objects.requireNonNull(work, "work");
    TxHandle existing = currentTxOrNull();
    return switch (propagation) {
      case REQUIRED -> (existing != null) ? work.get() : runInNewTx(work);
      case SUPPORTS -> work.get();
      case MANDATORY -> {
        if (existing == null) throw new IllegalStateException("No existing transaction for propagation=MANDATORY");
        yield work.get();
      }
      case REQUIRES_NEW -> runInNewTx(work);
      case NEVER -> {
        if (existing != null) throw new IllegalStateException("Existing transaction found for propagation=NEVER");
        yield work.get();
      }
      case NESTED -> (existing != null) ? work.get() : runInNewTx(work);
    };
  }

  private <T> T runInNewTx(Supplier<T> work) {
    TxHandle outer = current.get();
    TxHandle tx = begin();
    current.set(tx);
    try {
      T result = work.get();
      commit(tx);
      return result;
    } catch (RuntimeException | Error t) {
      try {
        rollback(tx);
      } catch (RuntimeException suppressed) {
        t.addSuppressed(suppressed);
      }
      throw t;
    } finally {
      if (outer == null) current.remove();
      else current.set(outer);
    }
  }

  // --- Reads (no auto-tx creation) ---

  @Override
  public final Optional<AttributeDefinition> findDefinition(String name) {
    Objects.requireNonNull(name, "name");
    return Optional.ofNullable(selectDefinition(currentTxOrNull(), name));
  }

  @Override
  public final List<AttributeDefinition> listDefinitions() {
    return selectDefinitions(currentTxOrNull());
  }

  @Override
  public final Optional<ValueRecord> findValue(EntityRef entity, String attributeName) {
    Objects.requireNonNull(attributeName, "attributeName");
    if (!entity.persisted()) return Optional.empty();
    return Optional.ofNullable(selectValue(currentTxOrNull(), entity, attributeName));
  }

  @Override
  public final List<ValueRecord> findValues(EntityRef entity) {
    if (!entity.persisted()) return List.of();
    return selectValues(currentTxOrNull(), entity);
  }

  @Override
  public final List<EntityRef> entitiesWithAttribute(long attributeId) {
    return selectEntitiesWithAttribute(currentTxOrNull(), attributeId);
  }

  @Override
  public final Set<String> entityIds(String entityType) {
    return selectEntityIds(currentTxOrNull(), entityType);
  }

  @Override
  public final Set<String> matchingEntityIds(String entityType, String attributeName, SlotPredicate predicate) {
    Objects.requireNonNull(predicate, "predicate");
    return selectMatchingEntityIds(currentTxOrNull(), entityType, attributeName, predicate);
  }

  @Override
  public final List<String> entityIdsAfter(String entityType, String afterExclusive, int limit) {
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    return selectEntityIdsAfter(currentTxOrNull(), entityType, afterExclusive, limit);
  }

  @Override
  public final List<String> orderEntityIds(String entityType, Collection<String> ids, String attributeName,
                                           ValueSlot slot, SortField.Direction direction) {
    if (ids.isEmpty()) return List.of();
    return selectOrderedEntityIds(currentTxOrNull(), entityType, ids, attributeName, slot,
        direction == null ? SortField.Direction.ASC : direction);
  }

  // --- Writes (auto-tx creation) ---

  @Override
  public final AttributeDefinition insertDefinition(AttributeDefinition def) {
    return inTx(defaultWritePropagation(), () -> def.withId(executeInsertDefinition(currentTxOrNull(), def)));
  }

  @Override
  public final void updateDefinition(AttributeDefinition def) {
    Objects.requireNonNull(def.id(), "definition id");
    inTx(defaultWritePropagation(), () -> {
      executeUpdateDefinition(currentTxOrNull(), def);
      return null;
    });
  }

  @Override
  public final boolean deleteDefinition(long attributeId) {
    return inTx(defaultWritePropagation(), () -> executeDeleteDefinition(currentTxOrNull(), attributeId) > 0);
  }

  @Override
  public final void upsertValue(ValueRecord record) {
    inTx(defaultWritePropagation(), () -> {
      executeUpsertValue(currentTxOrNull(), record);
      return null;
    });
  }

  @Override
  public final boolean deleteValue(EntityRef entity, String attributeName) {
    if (!entity.persisted()) return false;
    return inTx(defaultWritePropagation(), () -> executeDeleteValue(currentTxOrNull(), entity, attributeName) > 0);
  }

  @Override
  public final long deleteValuesForAttribute(long attributeId) {
    return inTx(defaultWritePropagation(), () -> executeDeleteValuesForAttribute(currentTxOrNull(), attributeId));
  }

  // --- Backend-specific hooks ---

  protected abstract AttributeDefinition selectDefinition(TxHandle txOrNull, String name);

  protected abstract List<AttributeDefinition> selectDefinitions(TxHandle txOrNull);

  protected abstract ValueRecord selectValue(TxHandle txOrNull, EntityRef entity, String attributeName);

  protected abstract List<ValueRecord> selectValues(TxHandle txOrNull, EntityRef entity);

  protected abstract List<EntityRef> selectEntitiesWithAttribute(TxHandle txOrNull, long attributeId);

  protected abstract Set<String> selectEntityIds(TxHandle txOrNull, String entityType);

  protected abstract Set<String> selectMatchingEntityIds(TxHandle txOrNull, String entityType,
                                                         String attributeName, SlotPredicate predicate);

  protected abstract List<String> selectEntityIdsAfter(TxHandle txOrNull, String entityType,
                                                       String afterExclusive, int limit);

  protected abstract List<String> selectOrderedEntityIds(TxHandle txOrNull, String entityType, Collection<String> ids,
                                                         String attributeName, ValueSlot slot,
                                                         SortField.Direction direction);

  /** @return the generated attribute id */
  protected abstract long executeInsertDefinition(TxHandle tx, AttributeDefinition def);

  protected abstract void executeUpdateDefinition(TxHandle tx, AttributeDefinition def);

  protected abstract long executeDeleteDefinition(TxHandle tx, long attributeId);

  protected abstract void executeUpsertValue(TxHandle tx, ValueRecord record);

  protected abstract long executeDeleteValue(TxHandle tx, EntityRef entity, String attributeName);

  protected abstract long executeDeleteValuesForAttribute(TxHandle tx, long attributeId);
}
