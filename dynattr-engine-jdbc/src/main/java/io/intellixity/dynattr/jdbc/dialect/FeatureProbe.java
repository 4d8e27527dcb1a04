package io.intellixity.dynattr.jdbc.dialect;

/** Live checks a dialect may run against the database while detecting features. */
public interface FeatureProbe {
  /** Whether the statement executes without error. */
  boolean succeeds(String sql);

  /** {@code DatabaseMetaData#getDatabaseProductVersion()}, or {@code null} when unknown. */
  String databaseVersion();
}
