package io.intellixity.dynattr.service;

import io.intellixity.dynattr.config.DynattrSettings;
import io.intellixity.dynattr.service.internal.DefinitionCache;
import io.intellixity.dynattr.spi.capability.BackendCapabilities;
import io.intellixity.dynattr.spi.capability.Feature;
import io.intellixity.dynattr.spi.exec.StorageEngine;
import io.intellixity.dynattr.validation.DefinitionValidator;
import io.intellixity.dynattr.validation.ValueValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point wiring catalog, value store, cache synchronizer and search compiler over one
 * storage engine.
 *
 * <pre>
 * DynamicAttributes attrs = DynamicAttributes.builder().engine(engine).build();
 * attrs.catalog().define("age", "Age", AttributeType.NUMBER, false, null, null);
 * attrs.values().setOne(EntityRef.of("customer", 42), "age", "31");
 * </pre>
 */
public final class DynamicAttributes {
  private static final Logger log = LoggerFactory.getLogger(DynamicAttributes.class);

  private final StorageEngine engine;
  private final BackendCapabilities capabilities;
  private final AttributeCatalog catalog;
  private final ValueStore values;
  private final CacheSynchronizer cache;
  private final SearchCompiler search;

  private DynamicAttributes(Builder b) {
    this.engine = Objects.requireNonNull(b.engine, "engine");
    DynattrSettings settings = (b.settings == null) ? DynattrSettings.load() : b.settings;
    Clock clock = (b.clock == null) ? Clock.systemDefaultZone() : b.clock;
    this.capabilities = (b.capabilities == null) ? engine.capabilities() : b.capabilities;

    DefinitionCache definitions = settings.isDefinitionCacheEnabled()
        ? new DefinitionCache(settings.getDefinitionCacheMaxEntries(), settings.getDefinitionCacheTtlMillis())
        : DefinitionCache.disabled();

    this.cache = new CacheSynchronizer(engine, engine.cacheDocuments(), settings);
    this.catalog = new AttributeCatalog(engine, new DefinitionValidator(clock), definitions, cache);
    this.values = new ValueStore(catalog, new ValueValidator(clock), engine, cache);
    this.search = new SearchCompiler(catalog, engine, capabilities, clock);
  }

  public static Builder builder() {
    return new Builder();
  }

  public AttributeCatalog catalog() { return catalog; }
  public ValueStore values() { return values; }
  public CacheSynchronizer cache() { return cache; }
  public SearchCompiler search() { return search; }
  public StorageEngine engine() { return engine; }
  public BackendCapabilities capabilities() { return capabilities; }

  /**
   * Applies the backend's advisory search indexes. Statements the backend rejects are skipped.
   *
   * @return the statements that were applied
   */
  public List<String> optimize() {
    List<String> applied = engine.applyAdvisoryIndexes();
    log.info("dynattr op=optimize engine={} applied={}", engine.id(), applied.size());
    return applied;
  }

  /** Engine id, backend kind and supported features. */
  public Map<String, Object> backendInfo() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("engine", engine.id());
    out.put("backend", capabilities.backendKind());
    Map<String, Boolean> features = new LinkedHashMap<>();
    for (Feature f : Feature.values()) features.put(f.id(), capabilities.supports(f));
    out.put("features", features);
    return out;
  }

  public void clearCapabilityCache() {
    capabilities.clearCache();
  }

  public static final class Builder {
    private StorageEngine engine;
    private BackendCapabilities capabilities;
    private DynattrSettings settings;
    private Clock clock;

    private Builder() {}

    public Builder engine(StorageEngine engine) { this.engine = engine; return this; }

    /** Overrides the engine's own capability adapter. */
    public Builder capabilities(BackendCapabilities capabilities) { this.capabilities = capabilities; return this; }

    public Builder settings(DynattrSettings settings) { this.settings = settings; return this; }
    public Builder clock(Clock clock) { this.clock = clock; return this; }

    public DynamicAttributes build() {
      return new DynamicAttributes(this);
    }
  }
}
