package io.intellixity.dynattr.memory;

import io.intellixity.dynattr.spi.capability.BackendCapabilities;
import io.intellixity.dynattr.spi.capability.Feature;
import io.intellixity.dynattr.spi.capability.FeatureCache;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Capabilities of the in-memory backend. Full-text matching is built in; the rest is configurable
 * so callers can emulate other backends.
 */
public final class InMemoryCapabilities implements BackendCapabilities {
  public static final String KIND = "memory";

  private final FeatureCache cache;
  private final Set<Feature> declared;

  public InMemoryCapabilities(FeatureCache cache, Set<Feature> declared) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.declared = declared.isEmpty() ? Set.of() : EnumSet.copyOf(declared);
  }

  public InMemoryCapabilities() {
    this(new FeatureCache(), EnumSet.of(Feature.FULLTEXT_SEARCH, Feature.CASE_SENSITIVE_LIKE));
  }

  @Override public String backendKind() { return KIND; }

  @Override
  public Set<Feature> features() {
    return cache.getOrProbe(KIND, () -> declared);
  }

  @Override
  public void clearCache() {
    cache.clear(KIND);
  }

  @Override
  public List<String> advisoryIndexStatements() {
    return List.of();
  }
}
