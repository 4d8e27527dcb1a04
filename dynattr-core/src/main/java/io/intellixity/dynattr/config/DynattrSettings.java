package io.intellixity.dynattr.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Engine settings.
 * <p>
 * {@link #load()} reads {@value #RESOURCE} from the classpath when present, then applies
 * {@code dynattr.*} system properties on top. Missing keys keep their defaults.
 */
public final class DynattrSettings {
  public static final String RESOURCE = "dynattr.properties";

  public static final String CACHE_DOCUMENTS_ENABLED = "dynattr.cache-documents.enabled";
  public static final String DEFINITION_CACHE_ENABLED = "dynattr.definitions.cache.enabled";
  public static final String DEFINITION_CACHE_TTL_MS = "dynattr.definitions.cache.ttl-ms";
  public static final String DEFINITION_CACHE_MAX_ENTRIES = "dynattr.definitions.cache.max-entries";
  public static final String RESYNC_BATCH_SIZE = "dynattr.resync.batch-size";

  private boolean cacheDocumentsEnabled = true;
  private boolean definitionCacheEnabled = true;
  private long definitionCacheTtlMillis = 3_600_000L;
  private int definitionCacheMaxEntries = 1000;
  private int resyncBatchSize = 100;

  public boolean isCacheDocumentsEnabled() { return cacheDocumentsEnabled; }
  public DynattrSettings setCacheDocumentsEnabled(boolean v) { this.cacheDocumentsEnabled = v; return this; }

  public boolean isDefinitionCacheEnabled() { return definitionCacheEnabled; }
  public DynattrSettings setDefinitionCacheEnabled(boolean v) { this.definitionCacheEnabled = v; return this; }

  public long getDefinitionCacheTtlMillis() { return definitionCacheTtlMillis; }
  public DynattrSettings setDefinitionCacheTtlMillis(long v) { this.definitionCacheTtlMillis = v; return this; }

  public int getDefinitionCacheMaxEntries() { return definitionCacheMaxEntries; }
  public DynattrSettings setDefinitionCacheMaxEntries(int v) { this.definitionCacheMaxEntries = v; return this; }

  public int getResyncBatchSize() { return resyncBatchSize; }
  public DynattrSettings setResyncBatchSize(int v) {
    if (v <= 0) throw new IllegalArgumentException("resyncBatchSize must be > 0");
    this.resyncBatchSize = v;
    return this;
  }

  public static DynattrSettings defaults() {
    return new DynattrSettings();
  }

  public static DynattrSettings load() {
    Properties p = new Properties();
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = DynattrSettings.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
      if (in != null) p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + RESOURCE, e);
    }
    for (String key : System.getProperties().stringPropertyNames()) {
      if (key.startsWith("dynattr.")) p.setProperty(key, System.getProperty(key));
    }
    return fromProperties(p);
  }

  public static DynattrSettings fromProperties(Properties p) {
    DynattrSettings s = new DynattrSettings();
    String v;
    if ((v = p.getProperty(CACHE_DOCUMENTS_ENABLED)) != null) s.setCacheDocumentsEnabled(Boolean.parseBoolean(v.trim()));
    if ((v = p.getProperty(DEFINITION_CACHE_ENABLED)) != null) s.setDefinitionCacheEnabled(Boolean.parseBoolean(v.trim()));
    if ((v = p.getProperty(DEFINITION_CACHE_TTL_MS)) != null) s.setDefinitionCacheTtlMillis(Long.parseLong(v.trim()));
    if ((v = p.getProperty(DEFINITION_CACHE_MAX_ENTRIES)) != null) s.setDefinitionCacheMaxEntries(Integer.parseInt(v.trim()));
    if ((v = p.getProperty(RESYNC_BATCH_SIZE)) != null) s.setResyncBatchSize(Integer.parseInt(v.trim()));
    return s;
  }
}
