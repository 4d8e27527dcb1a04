package io.intellixity.dynattr.jdbc;

import javax.sql.DataSource;
import java.util.Objects;

/** Data source plus the schema the attribute tables live in. */
public final class JdbcHandle {
  private final String id;
  private final DataSource client;
  private final String schema;

  public JdbcHandle(String id, DataSource client, String schema) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
  }

  public String id() { return id; }
  public DataSource client() { return client; }

  /** {@code null} when tables are unqualified. */
  public String schema() { return schema; }
}
