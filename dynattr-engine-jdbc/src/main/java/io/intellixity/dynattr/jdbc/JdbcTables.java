package io.intellixity.dynattr.jdbc;

import java.util.Objects;

/**
 * Names of the definition table and the value table.
 *
 * @param schema     optional schema qualifier, {@code null} for none
 * @param attributes attribute definition table
 * @param values     value record table
 */
public record JdbcTables(String schema, String attributes, String values) {
  public static final String DEFAULT_ATTRIBUTES = "attributes";
  public static final String DEFAULT_VALUES = "attribute_values";

  public JdbcTables {
    schema = (schema == null || schema.isBlank()) ? null : schema;
    Objects.requireNonNull(attributes, "attributes");
    Objects.requireNonNull(values, "values");
  }

  public static JdbcTables defaults() {
    return new JdbcTables(null, DEFAULT_ATTRIBUTES, DEFAULT_VALUES);
  }

  public JdbcTables inSchema(String schema) {
    return new JdbcTables(schema, attributes, values);
  }
}
