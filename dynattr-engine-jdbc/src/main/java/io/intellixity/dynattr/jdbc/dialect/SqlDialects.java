package io.intellixity.dynattr.jdbc.dialect;

import io.intellixity.dynattr.spi.exec.StorageEngineException;
import io.intellixity.dynattr.util.DynattrFactoriesLoader;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lookup of dialects registered in {@code META-INF/dynattr.factories}. {@link GenericSqlDialect}
 * is always available and serves databases no registered dialect claims.
 */
public final class SqlDialects {
  private SqlDialects() {}

  public static List<SqlDialect> available() {
    List<SqlDialect> out = new ArrayList<>(DynattrFactoriesLoader.load(SqlDialect.class));
    out.add(new GenericSqlDialect());
    return out;
  }

  public static SqlDialect byId(String id) {
    String norm = id.trim().toLowerCase(Locale.ROOT);
    for (SqlDialect d : available()) {
      if (d.id().equals(norm)) return d;
    }
    throw new IllegalArgumentException("No SQL dialect registered with id '" + id + "'");
  }

  /** First registered dialect matching the product name, else the generic one. */
  public static SqlDialect forProduct(String productName) {
    for (SqlDialect d : available()) {
      if (d.matches(productName)) return d;
    }
    return new GenericSqlDialect();
  }

  public static SqlDialect detect(DataSource ds) {
    try (Connection c = ds.getConnection()) {
      return forProduct(c.getMetaData().getDatabaseProductName());
    } catch (SQLException e) {
      throw new StorageEngineException("Failed to detect database product", e);
    }
  }
}
