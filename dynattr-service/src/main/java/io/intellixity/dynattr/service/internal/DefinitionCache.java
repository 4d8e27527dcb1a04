package io.intellixity.dynattr.service.internal;

import io.intellixity.dynattr.model.AttributeDefinition;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Synchronized LRU cache of attribute definitions by name with expire-after-write.\n
 *
 * Misses are not cached, so a definition created elsewhere becomes visible on the next lookup.\n
 * A max size of 0 disables caching.\n
 */
public final class DefinitionCache {
  private final int maxEntries;
  private final long ttlMillis;
  private final LongSupplier nowMillis;

  private final LinkedHashMap<String, Entry> map = new LinkedHashMap<>(16, 0.75f, true);

  private record Entry(AttributeDefinition definition, long writtenAt) {}

  public DefinitionCache(int maxEntries, long ttlMillis) {
    this(maxEntries, ttlMillis, System::currentTimeMillis);
  }

  public DefinitionCache(int maxEntries, long ttlMillis, LongSupplier nowMillis) {
    if (maxEntries < 0) throw new IllegalArgumentException("maxEntries must be >= 0");
    if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
    this.maxEntries = maxEntries;
    this.ttlMillis = ttlMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  public static DefinitionCache disabled() {
    return new DefinitionCache(0, 0);
  }

  public synchronized Optional<AttributeDefinition> get(String name) {
    Objects.requireNonNull(name, "name");
    Entry e = map.get(name);
    if (e == null) return Optional.empty();
    if (expired(e, nowMillis.getAsLong())) {
      map.remove(name);
      return Optional.empty();
    }
    return Optional.of(e.definition());
  }

  public synchronized void put(AttributeDefinition def) {
    if (maxEntries == 0) return;
    map.put(def.name(), new Entry(def, nowMillis.getAsLong()));
    while (map.size() > maxEntries) {
      Iterator<Map.Entry<String, Entry>> it = map.entrySet().iterator();
      it.next();
      it.remove();
    }
  }

  /** Cached definition, or the loader's result which is cached when present. */
  public synchronized Optional<AttributeDefinition> getOrLoad(String name, Function<String, Optional<AttributeDefinition>> loader) {
    Optional<AttributeDefinition> hit = get(name);
    if (hit.isPresent()) return hit;
    Optional<AttributeDefinition> loaded = loader.apply(name);
    loaded.ifPresent(this::put);
    return loaded;
  }

  public synchronized void invalidate(String name) {
    map.remove(name);
  }

  public synchronized void clear() {
    map.clear();
  }

  public synchronized int size() {
    long now = nowMillis.getAsLong();
    map.values().removeIf(e -> expired(e, now));
    return map.size();
  }

  private boolean expired(Entry e, long now) {
    return ttlMillis > 0 && (now - e.writtenAt()) >= ttlMillis;
  }
}
