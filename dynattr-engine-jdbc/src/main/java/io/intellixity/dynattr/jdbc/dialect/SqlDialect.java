package io.intellixity.dynattr.jdbc.dialect;

import io.intellixity.dynattr.jdbc.Bind;
import io.intellixity.dynattr.jdbc.HostTable;
import io.intellixity.dynattr.jdbc.JdbcTables;
import io.intellixity.dynattr.jdbc.SqlStatement;
import io.intellixity.dynattr.model.EntityRef;
import io.intellixity.dynattr.model.ValueRecord;
import io.intellixity.dynattr.model.ValueSlot;
import io.intellixity.dynattr.query.SortField;
import io.intellixity.dynattr.spi.capability.Feature;
import io.intellixity.dynattr.spi.search.SlotPredicate;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * SQL rendering and binding for one database family.\n
 *
 * Implementations are discovered through {@code META-INF/dynattr.factories} (see
 * {@link SqlDialects}). Rendered statements use named binds ({@code :b1}) in registration order.
 */
public interface SqlDialect {
  /** Backend kind, also the key feature probes are cached under. */
  String id();

  /** Whether this dialect serves a database reporting {@code productName}. */
  boolean matches(String productName);

  Set<Feature> probeFeatures(FeatureProbe probe);

  /** Index statements that speed up searches; applied on demand and allowed to fail. */
  List<String> advisoryIndexStatements(JdbcTables tables, Set<Feature> features);

  List<String> createSchemaStatements(JdbcTables tables);

  // --- definitions ---

  SqlStatement selectDefinition(JdbcTables t, String name);

  SqlStatement selectDefinitions(JdbcTables t);

  SqlStatement insertDefinition(JdbcTables t, String name, String label, String type, boolean required,
                                String optionsJson, String rulesJson);

  SqlStatement updateDefinition(JdbcTables t, long id, String label, boolean required,
                                String optionsJson, String rulesJson);

  SqlStatement deleteDefinition(JdbcTables t, long id);

  // --- values ---

  /** Whether {@link #upsertValue} renders a single native upsert. */
  boolean supportsUpsert();

  SqlStatement upsertValue(JdbcTables t, ValueRecord r);

  /** Update half of the update-then-insert fallback. */
  SqlStatement updateValue(JdbcTables t, ValueRecord r);

  SqlStatement insertValue(JdbcTables t, ValueRecord r);

  SqlStatement selectValue(JdbcTables t, EntityRef entity, String attributeName);

  SqlStatement selectValues(JdbcTables t, EntityRef entity);

  SqlStatement deleteValue(JdbcTables t, EntityRef entity, String attributeName);

  SqlStatement deleteValuesForAttribute(JdbcTables t, long attributeId);

  SqlStatement selectEntitiesWithAttribute(JdbcTables t, long attributeId);

  // --- search ---

  SqlStatement selectEntityIds(JdbcTables t, String entityType);

  SqlStatement selectMatchingEntityIds(JdbcTables t, String entityType, String attributeName, SlotPredicate p);

  SqlStatement selectEntityIdsAfter(JdbcTables t, String entityType, String afterExclusive, int limit);

  /**
   * Ids among {@code ids} having a non-null value, ordered by it. Rows carry the entity id and
   * the slot value, in that order.
   */
  SqlStatement selectOrderedEntityIds(JdbcTables t, String entityType, Collection<String> ids,
                                      String attributeName, ValueSlot slot, SortField.Direction direction);

  /** Largest id list passed to one {@link #selectOrderedEntityIds} statement. */
  default int maxIdsPerStatement() {
    return 900;
  }

  // --- cache documents ---

  SqlStatement selectCacheDocument(HostTable host, String entityId);

  SqlStatement updateCacheDocument(HostTable host, String entityId, String json);

  // --- binding ---

  void bind(PreparedStatement ps, int position, Bind bind) throws SQLException;

  LocalDate readDate(ResultSet rs, String column) throws SQLException;
}
