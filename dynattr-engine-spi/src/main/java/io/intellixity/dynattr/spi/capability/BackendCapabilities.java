package io.intellixity.dynattr.spi.capability;

import java.util.List;
import java.util.Set;

/**
 * Reports what a backend can do. Probing happens at most once per backend kind until
 * {@link #clearCache()} is called.
 */
public interface BackendCapabilities {
  /** Backend kind the probe results are cached under, e.g. {@code postgres}. */
  String backendKind();

  Set<Feature> features();

  default boolean supports(Feature feature) {
    return features().contains(feature);
  }

  /** Forgets the cached probe result of this backend kind. */
  void clearCache();

  /** Index statements that speed up searches on this backend; applying them is optional. */
  List<String> advisoryIndexStatements();

  static BackendCapabilities none(String backendKind) {
    return new BackendCapabilities() {
      @Override public String backendKind() { return backendKind; }
      @Override public Set<Feature> features() { return Set.of(); }
      @Override public void clearCache() {}
      @Override public List<String> advisoryIndexStatements() { return List.of(); }
    };
  }
}
