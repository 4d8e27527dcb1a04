package io.intellixity.dynattr.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/** Pooled data sources for {@link JdbcSettings}. */
public final class JdbcDataSources {
  private JdbcDataSources() {}

  public static HikariDataSource create(JdbcSettings s) {
    if (s.getJdbcUrl() == null || s.getJdbcUrl().isBlank()) {
      throw new IllegalArgumentException("Missing " + JdbcSettings.URL);
    }
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("dynattr");
    hc.setJdbcUrl(s.getJdbcUrl());
    hc.setUsername(s.getUsername());
    hc.setPassword(s.getPassword());
    hc.setMaximumPoolSize(s.getMaximumPoolSize());
    return new HikariDataSource(hc);
  }
}
