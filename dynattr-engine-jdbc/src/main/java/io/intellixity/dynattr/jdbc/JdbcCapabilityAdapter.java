package io.intellixity.dynattr.jdbc;

import io.intellixity.dynattr.jdbc.dialect.FeatureProbe;
import io.intellixity.dynattr.jdbc.dialect.SqlDialect;
import io.intellixity.dynattr.spi.capability.BackendCapabilities;
import io.intellixity.dynattr.spi.capability.Feature;
import io.intellixity.dynattr.spi.capability.FeatureCache;
import io.intellixity.dynattr.spi.exec.StorageEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Capabilities of a JDBC backend, probed through the dialect on one autocommit connection and
 * cached per dialect id.
 */
public final class JdbcCapabilityAdapter implements BackendCapabilities {
  private static final Logger log = LoggerFactory.getLogger(JdbcCapabilityAdapter.class);

  private final DataSource ds;
  private final SqlDialect dialect;
  private final JdbcTables tables;
  private final FeatureCache cache;

  public JdbcCapabilityAdapter(DataSource ds, SqlDialect dialect, JdbcTables tables, FeatureCache cache) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.cache = (cache == null) ? FeatureCache.shared() : cache;
  }

  @Override public String backendKind() { return dialect.id(); }

  @Override
  public Set<Feature> features() {
    return cache.getOrProbe(dialect.id(), this::probe);
  }

  @Override
  public void clearCache() {
    cache.clear(dialect.id());
  }

  @Override
  public List<String> advisoryIndexStatements() {
    return dialect.advisoryIndexStatements(tables, features());
  }

  private Set<Feature> probe() {
    try (Connection c = ds.getConnection()) {
      c.setAutoCommit(true);
      Set<Feature> found = dialect.probeFeatures(new ConnectionProbe(c));
      log.info("dynattr.capabilities probed backend={} version={} features={}",
          dialect.id(), c.getMetaData().getDatabaseProductVersion(), found);
      return found;
    } catch (SQLException e) {
      throw new StorageEngineException("Failed to probe " + dialect.id() + " capabilities", e);
    }
  }

  private record ConnectionProbe(Connection conn) implements FeatureProbe {
    @Override
    public boolean succeeds(String sql) {
      try (Statement st = conn.createStatement()) {
        st.execute(sql);
        return true;
      } catch (SQLException e) {
        log.debug("dynattr.capabilities probe failed sql={} error={}", sql, e.getMessage());
        return false;
      }
    }

    @Override
    public String databaseVersion() {
      try {
        return conn.getMetaData().getDatabaseProductVersion();
      } catch (SQLException e) {
        throw new StorageEngineException("Failed to read database version", e);
      }
    }
  }
}
