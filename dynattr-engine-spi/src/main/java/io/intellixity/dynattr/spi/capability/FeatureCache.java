package io.intellixity.dynattr.spi.capability;

import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Probe results keyed by backend kind.
 * <p>
 * {@link #shared()} lives for the whole process; tests can pass their own instance to adapters.
 */
public final class FeatureCache {
  private static final FeatureCache SHARED = new FeatureCache();

  private final Map<String, Set<Feature>> byKind = new ConcurrentHashMap<>();

  public static FeatureCache shared() {
    return SHARED;
  }

  /** Cached features of {@code kind}, probing once when absent. */
  public Set<Feature> getOrProbe(String kind, Supplier<Set<Feature>> probe) {
    Objects.requireNonNull(kind, "kind");
    return byKind.computeIfAbsent(kind, k -> {
      Set<Feature> found = probe.get();
      return found.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(found));
    });
  }

  public boolean isCached(String kind) {
    return byKind.containsKey(kind);
  }

  public void clear(String kind) {
    byKind.remove(kind);
  }

  public void clearAll() {
    byKind.clear();
  }
}
