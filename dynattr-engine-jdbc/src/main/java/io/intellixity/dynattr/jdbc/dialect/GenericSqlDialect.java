package io.intellixity.dynattr.jdbc.dialect;

import io.intellixity.dynattr.jdbc.JdbcTables;
import io.intellixity.dynattr.spi.capability.Feature;

import java.util.List;
import java.util.Set;

/** Standard SQL for databases without a dedicated dialect. Supports no optional feature. */
public final class GenericSqlDialect extends AbstractSqlDialect {
  public static final String ID = "generic";

  @Override public String id() { return ID; }

  @Override
  public boolean matches(String productName) {
    return true;
  }

  @Override
  public Set<Feature> probeFeatures(FeatureProbe probe) {
    return Set.of();
  }

  @Override
  public List<String> advisoryIndexStatements(JdbcTables tables, Set<Feature> features) {
    return List.of();
  }
}
