package io.intellixity.dynattr.memory;

import io.intellixity.dynattr.exec.Propagation;
import io.intellixity.dynattr.exec.TxHandle;
import io.intellixity.dynattr.model.AttributeDefinition;
import io.intellixity.dynattr.model.EntityRef;
import io.intellixity.dynattr.model.ValueRecord;
import io.intellixity.dynattr.model.ValueSlot;
import io.intellixity.dynattr.query.SortField;
import io.intellixity.dynattr.spi.cache.CacheDocumentStore;
import io.intellixity.dynattr.spi.capability.BackendCapabilities;
import io.intellixity.dynattr.spi.exec.AbstractStorageEngine;
import io.intellixity.dynattr.spi.exec.DuplicateKeyException;
import io.intellixity.dynattr.spi.exec.StorageEngineException;
import io.intellixity.dynattr.spi.search.SlotPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Storage engine keeping everything in process memory.
 * <p>
 * Transactions snapshot the whole state on begin and restore it on rollback. All access is
 * serialized on one lock, so concurrent callers see committed and uncommitted work alike; it is
 * meant for embedding and tests, not for concurrent production use.
 * <p>
 * Cache documents live in the same state and therefore share its transactions. Only entity types
 * registered through {@link #carryCacheFor(String...)} have a cache slot.
 */
public class InMemoryStorageEngine extends AbstractStorageEngine {
  private static final Logger log = LoggerFactory.getLogger(InMemoryStorageEngine.class);

  private record ValueKey(String entityId, String entityType, long attributeId) {}

  private static final class State {
    long nextAttributeId = 1;
    final TreeMap<String, AttributeDefinition> definitions = new TreeMap<>();
    final LinkedHashMap<ValueKey, ValueRecord> values = new LinkedHashMap<>();
    final HashMap<EntityRef, Map<String, Object>> documents = new HashMap<>();

    State copy() {
      State s = new State();
      s.nextAttributeId = nextAttributeId;
      s.definitions.putAll(definitions);
      s.values.putAll(values);
      documents.forEach((k, v) -> s.documents.put(k, new LinkedHashMap<>(v)));
      return s;
    }
  }

  private record MemoryTx(State snapshot) implements TxHandle {}

  private final Object lock = new Object();
  private final Set<String> cacheTypes = new HashSet<>();
  private final BackendCapabilities capabilities;
  private final CacheDocumentStore documents = new Documents();
  private State state = new State();

  public InMemoryStorageEngine(BackendCapabilities capabilities, Propagation defaultPropagation) {
    super(defaultPropagation);
    this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
  }

  public InMemoryStorageEngine(BackendCapabilities capabilities) {
    this(capabilities, Propagation.REQUIRED);
  }

  public InMemoryStorageEngine() {
    this(new InMemoryCapabilities());
  }

  /** Gives host records of these types a cache document slot. */
  public InMemoryStorageEngine carryCacheFor(String... entityTypes) {
    synchronized (lock) {
      cacheTypes.addAll(Arrays.asList(entityTypes));
    }
    return this;
  }

  @Override public String id() { return "memory"; }
  @Override public BackendCapabilities capabilities() { return capabilities; }
  @Override public CacheDocumentStore cacheDocuments() { return documents; }

  @Override
  public List<String> applyAdvisoryIndexes() {
    return List.of();
  }

  // --- transactions ---

  @Override
  protected TxHandle begin() {
    synchronized (lock) {
      return new MemoryTx(state.copy());
    }
  }

  @Override
  protected void commit(TxHandle tx) {
    // writes are applied in place
  }

  @Override
  protected void rollback(TxHandle tx) {
    synchronized (lock) {
      state = ((MemoryTx) tx).snapshot();
    }
    log.debug("dynattr.memory rollback");
  }

  // --- reads ---

  @Override
  protected AttributeDefinition selectDefinition(TxHandle txOrNull, String name) {
    synchronized (lock) {
      return state.definitions.get(name);
    }
  }

  @Override
  protected List<AttributeDefinition> selectDefinitions(TxHandle txOrNull) {
    synchronized (lock) {
      return List.copyOf(state.definitions.values());
    }
  }

  @Override
  protected ValueRecord selectValue(TxHandle txOrNull, EntityRef entity, String attributeName) {
    synchronized (lock) {
      for (ValueRecord r : state.values.values()) {
        if (owns(r, entity) && r.attributeName().equals(attributeName)) return r;
      }
      return null;
    }
  }

  @Override
  protected List<ValueRecord> selectValues(TxHandle txOrNull, EntityRef entity) {
    synchronized (lock) {
      List<ValueRecord> out = new ArrayList<>();
      for (ValueRecord r : state.values.values()) {
        if (owns(r, entity)) out.add(r);
      }
      out.sort(Comparator.comparing(ValueRecord::attributeName));
      return out;
    }
  }

  @Override
  protected List<EntityRef> selectEntitiesWithAttribute(TxHandle txOrNull, long attributeId) {
    synchronized (lock) {
      Set<EntityRef> out = new LinkedHashSet<>();
      for (ValueRecord r : state.values.values()) {
        if (r.attributeId() == attributeId) out.add(r.entity());
      }
      return List.copyOf(out);
    }
  }

  @Override
  protected Set<String> selectEntityIds(TxHandle txOrNull, String entityType) {
    synchronized (lock) {
      Set<String> out = new LinkedHashSet<>();
      for (ValueRecord r : state.values.values()) {
        if (r.entityType().equals(entityType)) out.add(r.entityId());
      }
      return out;
    }
  }

  @Override
  protected Set<String> selectMatchingEntityIds(TxHandle txOrNull, String entityType, String attributeName,
                                                SlotPredicate predicate) {
    synchronized (lock) {
      Set<String> out = new LinkedHashSet<>();
      for (ValueRecord r : state.values.values()) {
        if (!r.entityType().equals(entityType) || !r.attributeName().equals(attributeName)) continue;
        if (SlotPredicates.test(predicate, r)) out.add(r.entityId());
      }
      return out;
    }
  }

  @Override
  protected List<String> selectEntityIdsAfter(TxHandle txOrNull, String entityType, String afterExclusive, int limit) {
    TreeSet<String> ids = new TreeSet<>(selectEntityIds(txOrNull, entityType));
    SortedSet<String> tail = afterExclusive == null ? ids : ids.tailSet(afterExclusive, false);
    List<String> out = new ArrayList<>(Math.min(limit, tail.size()));
    for (String id : tail) {
      if (out.size() == limit) break;
      out.add(id);
    }
    return out;
  }

  @Override
  protected List<String> selectOrderedEntityIds(TxHandle txOrNull, String entityType, Collection<String> ids,
                                                String attributeName, ValueSlot slot, SortField.Direction direction) {
    Map<String, Object> keys = new HashMap<>();
    synchronized (lock) {
      for (ValueRecord r : state.values.values()) {
        if (r.entityType().equals(entityType) && r.attributeName().equals(attributeName)) {
          Object v = slot.read(r);
          if (v != null) keys.put(r.entityId(), v);
        }
      }
    }
    List<String> withValue = new ArrayList<>();
    List<String> without = new ArrayList<>();
    for (String id : new LinkedHashSet<>(ids)) {
      if (keys.containsKey(id)) withValue.add(id);
      else without.add(id);
    }
    Comparator<String> cmp = (a, b) -> SlotPredicates.compare(keys.get(a), keys.get(b));
    if (direction == SortField.Direction.DESC) cmp = cmp.reversed();
    withValue.sort(cmp.thenComparing(Comparator.naturalOrder()));
    withValue.addAll(without);
    return withValue;
  }

  // --- writes ---

  @Override
  protected long executeInsertDefinition(TxHandle tx, AttributeDefinition def) {
    synchronized (lock) {
      if (state.definitions.containsKey(def.name())) {
        throw new DuplicateKeyException("Unique constraint violated: attribute name " + def.name());
      }
      long id = state.nextAttributeId++;
      state.definitions.put(def.name(), def.withId(id));
      return id;
    }
  }

  @Override
  protected void executeUpdateDefinition(TxHandle tx, AttributeDefinition def) {
    synchronized (lock) {
      AttributeDefinition cur = state.definitions.get(def.name());
      if (cur == null || !cur.id().equals(def.id())) {
        throw new StorageEngineException("No attribute " + def.name() + " with id " + def.id());
      }
      state.definitions.put(def.name(), def);
    }
  }

  @Override
  protected long executeDeleteDefinition(TxHandle tx, long attributeId) {
    synchronized (lock) {
      boolean removed = state.definitions.values().removeIf(d -> d.id() == attributeId);
      if (removed) state.values.values().removeIf(r -> r.attributeId() == attributeId);
      return removed ? 1 : 0;
    }
  }

  @Override
  protected void executeUpsertValue(TxHandle tx, ValueRecord record) {
    synchronized (lock) {
      state.values.put(new ValueKey(record.entityId(), record.entityType(), record.attributeId()), record);
    }
  }

  @Override
  protected long executeDeleteValue(TxHandle tx, EntityRef entity, String attributeName) {
    synchronized (lock) {
      return state.values.values().removeIf(r -> owns(r, entity) && r.attributeName().equals(attributeName)) ? 1 : 0;
    }
  }

  @Override
  protected long executeDeleteValuesForAttribute(TxHandle tx, long attributeId) {
    synchronized (lock) {
      long before = state.values.size();
      state.values.values().removeIf(r -> r.attributeId() == attributeId);
      return before - state.values.size();
    }
  }

  private static boolean owns(ValueRecord r, EntityRef entity) {
    return r.entityId().equals(entity.id()) && r.entityType().equals(entity.type());
  }

  private final class Documents implements CacheDocumentStore {
    @Override
    public boolean carriesCache(String entityType) {
      synchronized (lock) {
        return cacheTypes.contains(entityType);
      }
    }

    @Override
    public Optional<Map<String, Object>> read(EntityRef entity) {
      synchronized (lock) {
        if (!cacheTypes.contains(entity.type())) return Optional.empty();
        Map<String, Object> doc = state.documents.get(entity);
        return doc == null ? Optional.empty() : Optional.of(new LinkedHashMap<>(doc));
      }
    }

    @Override
    public void write(EntityRef entity, Map<String, Object> document) {
      inTx(defaultWritePropagation(), () -> {
        synchronized (lock) {
          if (cacheTypes.contains(entity.type())) {
            state.documents.put(entity, new LinkedHashMap<>(document));
          }
        }
        return null;
      });
    }
  }
}
