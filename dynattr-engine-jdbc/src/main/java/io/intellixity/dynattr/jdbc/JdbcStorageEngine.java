package io.intellixity.dynattr.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.dynattr.exec.Propagation;
import io.intellixity.dynattr.exec.TxHandle;
import io.intellixity.dynattr.jdbc.dialect.SqlDialect;
import io.intellixity.dynattr.jdbc.dialect.SqlDialects;
import io.intellixity.dynattr.model.AttributeDefinition;
import io.intellixity.dynattr.model.AttributeType;
import io.intellixity.dynattr.model.EntityRef;
import io.intellixity.dynattr.model.ValueRecord;
import io.intellixity.dynattr.model.ValueSlot;
import io.intellixity.dynattr.query.SortField;
import io.intellixity.dynattr.spi.cache.CacheDocumentStore;
import io.intellixity.dynattr.spi.capability.BackendCapabilities;
import io.intellixity.dynattr.spi.capability.FeatureCache;
import io.intellixity.dynattr.spi.exec.AbstractStorageEngine;
import io.intellixity.dynattr.spi.exec.DuplicateKeyException;
import io.intellixity.dynattr.spi.exec.StorageEngineException;
import io.intellixity.dynattr.spi.search.SlotPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.LocalDate;
import java.util.*;

/**
 * Storage engine over a JDBC {@link DataSource}.\n
 *
 * SQL comes from the {@link SqlDialect}; this class owns connections, transactions, binding and
 * row mapping. Without an active transaction each read borrows and returns its own connection.
 */
public final class JdbcStorageEngine extends AbstractStorageEngine {
  private static final Logger log = LoggerFactory.getLogger(JdbcStorageEngine.class);
  private static final TypeReference<List<String>> OPTIONS = new TypeReference<>() {};
  private static final TypeReference<LinkedHashMap<String, Object>> RULES = new TypeReference<>() {};

  private final JdbcHandle handle;
  private final DataSource ds;
  private final SqlDialect dialect;
  private final JdbcTables tables;
  private final JdbcCapabilityAdapter capabilities;
  private final JdbcCacheDocumentStore documents;
  private final ObjectMapper mapper = JdbcCacheDocumentStore.newMapper();

  public JdbcStorageEngine(JdbcHandle handle,
                           SqlDialect dialect,
                           JdbcTables tables,
                           Collection<HostTable> hostTables,
                           FeatureCache featureCache,
                           Propagation defaultPropagation) {
    super(defaultPropagation);
    this.handle = Objects.requireNonNull(handle, "handle");
    this.ds = handle.client();
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.capabilities = new JdbcCapabilityAdapter(ds, dialect, tables, featureCache);
    this.documents = new JdbcCacheDocumentStore(this, hostTables);
  }

  public JdbcStorageEngine(JdbcHandle handle, SqlDialect dialect, Collection<HostTable> hostTables) {
    this(handle, dialect, JdbcTables.defaults().inSchema(handle.schema()), hostTables,
        FeatureCache.shared(), Propagation.REQUIRED);
  }

  /** Pooled engine built from settings; the dialect is detected when none is configured. */
  public static JdbcStorageEngine fromSettings(JdbcSettings settings) {
    DataSource ds = JdbcDataSources.create(settings);
    SqlDialect dialect = (settings.getDialect() == null)
        ? SqlDialects.detect(ds)
        : SqlDialects.byId(settings.getDialect());
    JdbcHandle h = new JdbcHandle("jdbc:" + dialect.id(), ds, settings.getSchema());
    JdbcTables t = new JdbcTables(h.schema(), settings.getAttributesTable(), settings.getValuesTable());
    return new JdbcStorageEngine(h, dialect, t, settings.getHostTables(), FeatureCache.shared(), Propagation.REQUIRED);
  }

  @Override public String id() { return handle.id(); }
  @Override public BackendCapabilities capabilities() { return capabilities; }
  @Override public CacheDocumentStore cacheDocuments() { return documents; }

  public SqlDialect dialect() { return dialect; }
  public JdbcTables tables() { return tables; }

  /**
   * Creates the attribute and value tables unless the attribute table already exists.
   *
   * @return whether the tables were created
   */
  public boolean createSchema() {
    try (Connection c = ds.getConnection()) {
      if (tableExists(c, tables.attributes())) {
        log.debug("dynattr.jdbc op=CREATE_SCHEMA skipped table={}", tables.attributes());
        return false;
      }
      c.setAutoCommit(false);
      try (Statement st = c.createStatement()) {
        for (String ddl : dialect.createSchemaStatements(tables)) {
          log.debug("dynattr.jdbc op=DDL sql={}", ddl);
          st.execute(ddl);
        }
        c.commit();
      } catch (SQLException e) {
        c.rollback();
        throw e;
      }
      log.info("dynattr.jdbc op=CREATE_SCHEMA handleId={} attributes={} values={}",
          handle.id(), tables.attributes(), tables.values());
      return true;
    } catch (SQLException e) {
      throw new StorageEngineException("Failed to create attribute tables", e);
    }
  }

  private boolean tableExists(Connection c, String table) throws SQLException {
    DatabaseMetaData md = c.getMetaData();
    for (String candidate : List.of(table, table.toUpperCase(Locale.ROOT), table.toLowerCase(Locale.ROOT))) {
      try (ResultSet rs = md.getTables(null, tables.schema(), candidate, null)) {
        if (rs.next()) return true;
      }
    }
    return false;
  }

  @Override
  public List<String> applyAdvisoryIndexes() {
    List<String> applied = new ArrayList<>();
    for (String ddl : capabilities.advisoryIndexStatements()) {
      try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
        c.setAutoCommit(true);
        st.execute(ddl);
        applied.add(ddl);
        log.info("dynattr.jdbc op=ADVISORY_INDEX applied sql={}", ddl);
      } catch (SQLException e) {
        log.warn("dynattr.jdbc op=ADVISORY_INDEX skipped sql={} error={}", ddl, e.getMessage());
      }
    }
    return applied;
  }

  // --- transactions ---

  public record JdbcTxHandle(Connection conn) implements TxHandle {}

  @Override
  protected TxHandle begin() {
    Connection c = null;
    try {
      c = ds.getConnection();
      c.setAutoCommit(false);
      return new JdbcTxHandle(c);
    } catch (SQLException e) {
      if (c != null) closeQuietly(c);
      throw new StorageEngineException("Failed to begin transaction", e);
    }
  }

  @Override
  protected void commit(TxHandle tx) {
    Connection c = ((JdbcTxHandle) tx).conn();
    try {
      c.commit();
    } catch (SQLException e) {
      throw new StorageEngineException("Commit failed", e);
    } finally {
      closeQuietly(c);
    }
  }

  @Override
  protected void rollback(TxHandle tx) {
    Connection c = ((JdbcTxHandle) tx).conn();
    try {
      c.rollback();
      log.debug("dynattr.jdbc op=ROLLBACK handleId={}", handle.id());
    } catch (SQLException e) {
      throw new StorageEngineException("Rollback failed", e);
    } finally {
      closeQuietly(c);
    }
  }

  private static void closeQuietly(Connection c) {
    try {
      c.close();
    } catch (SQLException e) {
      log.warn("dynattr.jdbc connection close failed: {}", e.getMessage());
    }
  }

  /** Current transaction of this engine, for collaborators writing alongside it. */
  TxHandle currentTx() {
    return currentTxOrNull();
  }

  // --- reads ---

  @Override
  protected AttributeDefinition selectDefinition(TxHandle txOrNull, String name) {
    List<AttributeDefinition> rows = query(txOrNull, "SELECT_DEFINITION", dialect.selectDefinition(tables, name), this::readDefinition);
    return rows.isEmpty() ? null : rows.get(0);
  }

  @Override
  protected List<AttributeDefinition> selectDefinitions(TxHandle txOrNull) {
    return query(txOrNull, "SELECT_DEFINITIONS", dialect.selectDefinitions(tables), this::readDefinition);
  }

  @Override
  protected ValueRecord selectValue(TxHandle txOrNull, EntityRef entity, String attributeName) {
    List<ValueRecord> rows = query(txOrNull, "SELECT_VALUE", dialect.selectValue(tables, entity, attributeName), this::readValue);
    return rows.isEmpty() ? null : rows.get(0);
  }

  @Override
  protected List<ValueRecord> selectValues(TxHandle txOrNull, EntityRef entity) {
    return query(txOrNull, "SELECT_VALUES", dialect.selectValues(tables, entity), this::readValue);
  }

  @Override
  protected List<EntityRef> selectEntitiesWithAttribute(TxHandle txOrNull, long attributeId) {
    return query(txOrNull, "SELECT_ENTITIES", dialect.selectEntitiesWithAttribute(tables, attributeId),
        rs -> new EntityRef(rs.getString(1), rs.getString(2)));
  }

  @Override
  protected Set<String> selectEntityIds(TxHandle txOrNull, String entityType) {
    return new LinkedHashSet<>(query(txOrNull, "SELECT_IDS", dialect.selectEntityIds(tables, entityType), rs -> rs.getString(1)));
  }

  @Override
  protected Set<String> selectMatchingEntityIds(TxHandle txOrNull, String entityType, String attributeName,
                                                SlotPredicate predicate) {
    SqlStatement ss = dialect.selectMatchingEntityIds(tables, entityType, attributeName, predicate);
    return new LinkedHashSet<>(query(txOrNull, "SEARCH", ss, rs -> rs.getString(1)));
  }

  @Override
  protected List<String> selectEntityIdsAfter(TxHandle txOrNull, String entityType, String afterExclusive, int limit) {
    return query(txOrNull, "PAGE_IDS", dialect.selectEntityIdsAfter(tables, entityType, afterExclusive, limit), rs -> rs.getString(1));
  }

  @Override
  protected List<String> selectOrderedEntityIds(TxHandle txOrNull, String entityType, Collection<String> ids,
                                                String attributeName, ValueSlot slot, SortField.Direction direction) {
    List<String> distinct = new ArrayList<>(new LinkedHashSet<>(ids));
    int chunk = Math.max(1, dialect.maxIdsPerStatement());
    List<String> ordered;
    if (distinct.size() <= chunk) {
      SqlStatement ss = dialect.selectOrderedEntityIds(tables, entityType, distinct, attributeName, slot, direction);
      ordered = new ArrayList<>(query(txOrNull, "ORDER_IDS", ss, rs -> rs.getString(1)));
    } else {
      List<SortKey> keys = new ArrayList<>(distinct.size());
      for (int from = 0; from < distinct.size(); from += chunk) {
        List<String> part = distinct.subList(from, Math.min(from + chunk, distinct.size()));
        SqlStatement ss = dialect.selectOrderedEntityIds(tables, entityType, part, attributeName, slot, direction);
        keys.addAll(query(txOrNull, "ORDER_IDS", ss, rs -> new SortKey(rs.getString(1), readSortValue(rs, slot))));
      }
      keys.sort(SortKey.comparator(direction));
      ordered = new ArrayList<>(keys.size());
      for (SortKey k : keys) ordered.add(k.entityId());
    }
    Set<String> seen = new HashSet<>(ordered);
    for (String id : distinct) {
      if (seen.add(id)) ordered.add(id);
    }
    return ordered;
  }

  /** Entity id with its sort value; ties order by id as the SQL does. */
  private record SortKey(String entityId, Comparable<Object> value) {
    static Comparator<SortKey> comparator(SortField.Direction direction) {
      Comparator<SortKey> byValue = (a, b) -> a.value().compareTo(b.value());
      if (direction == SortField.Direction.DESC) byValue = byValue.reversed();
      return byValue.thenComparing(SortKey::entityId);
    }
  }

  @SuppressWarnings("unchecked")
  private Comparable<Object> readSortValue(ResultSet rs, ValueSlot slot) throws SQLException {
    Object v = switch (slot) {
      case STRING -> rs.getString(2);
      case NUMBER -> rs.getDouble(2);
      case DATE -> dialect.readDate(rs, slot.column());
      case BOOLEAN -> rs.getBoolean(2);
    };
    return (Comparable<Object>) v;
  }

  // --- writes ---

  @Override
  protected long executeInsertDefinition(TxHandle tx, AttributeDefinition def) {
    SqlStatement ss = dialect.insertDefinition(tables, def.name(), def.label(), def.type().id(), def.required(),
        toJson(def.options()), toJson(def.validationRules()));
    Object id = insertForId(tx, ss);
    if (!(id instanceof Number n)) throw new StorageEngineException("No id generated for attribute " + def.name());
    return n.longValue();
  }

  @Override
  protected void executeUpdateDefinition(TxHandle tx, AttributeDefinition def) {
    SqlStatement ss = dialect.updateDefinition(tables, def.id(), def.label(), def.required(),
        toJson(def.options()), toJson(def.validationRules()));
    if (update(tx, "UPDATE_DEFINITION", ss) == 0) {
      throw new StorageEngineException("No attribute " + def.name() + " with id " + def.id());
    }
  }

  @Override
  protected long executeDeleteDefinition(TxHandle tx, long attributeId) {
    return update(tx, "DELETE_DEFINITION", dialect.deleteDefinition(tables, attributeId));
  }

  @Override
  protected void executeUpsertValue(TxHandle tx, ValueRecord record) {
    if (dialect.supportsUpsert()) {
      update(tx, "UPSERT", dialect.upsertValue(tables, record));
      return;
    }
    if (update(tx, "UPDATE_VALUE", dialect.updateValue(tables, record)) == 0) {
      update(tx, "INSERT_VALUE", dialect.insertValue(tables, record));
    }
  }

  @Override
  protected long executeDeleteValue(TxHandle tx, EntityRef entity, String attributeName) {
    return update(tx, "DELETE_VALUE", dialect.deleteValue(tables, entity, attributeName));
  }

  @Override
  protected long executeDeleteValuesForAttribute(TxHandle tx, long attributeId) {
    return update(tx, "DELETE_VALUES", dialect.deleteValuesForAttribute(tables, attributeId));
  }

  // --- row mapping ---

  private AttributeDefinition readDefinition(ResultSet rs) throws SQLException {
    String type = rs.getString("type");
    AttributeType t = AttributeType.fromId(type)
        .orElseThrow(() -> new StorageEngineException("Unknown stored attribute type: " + type));
    String options = rs.getString("options");
    String rules = rs.getString("validation_rules");
    return new AttributeDefinition(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("label"),
        t,
        rs.getBoolean("required"),
        options == null ? List.of() : fromJson(options, OPTIONS),
        rules == null ? Map.of() : fromJson(rules, RULES));
  }

  private ValueRecord readValue(ResultSet rs) throws SQLException {
    double n = rs.getDouble("number_value");
    Double number = rs.wasNull() ? null : n;
    LocalDate date = dialect.readDate(rs, "date_value");
    boolean b = rs.getBoolean("boolean_value");
    Boolean bool = rs.wasNull() ? null : b;
    return new ValueRecord(
        rs.getString("entity_id"),
        rs.getString("entity_type"),
        rs.getLong("attribute_id"),
        rs.getString("attribute_name"),
        rs.getString("string_value"),
        number,
        date,
        bool);
  }

  private String toJson(Object v) {
    try {
      return mapper.writeValueAsString(v);
    } catch (JsonProcessingException e) {
      throw new StorageEngineException("Failed to encode JSON column", e);
    }
  }

  private <T> T fromJson(String json, TypeReference<T> type) {
    try {
      return mapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new StorageEngineException("Failed to decode JSON column", e);
    }
  }

  // --- execution ---

  @FunctionalInterface
  interface RowReader<T> {
    T read(ResultSet rs) throws SQLException;
  }

  <T> List<T> query(TxHandle txOrNull, String op, SqlStatement ss, RowReader<T> reader) {
    try {
      Connection c = (txOrNull == null) ? ds.getConnection() : ((JdbcTxHandle) txOrNull).conn();
      try {
        String jdbcSql = NamedParams.toJdbcSql(ss.sql());
        long start = System.nanoTime();
        debugSql(op, ss, jdbcSql);
        try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
          bindAll(ps, ss);
          try (ResultSet rs = ps.executeQuery()) {
            List<T> out = new ArrayList<>();
            while (rs.next()) out.add(reader.read(rs));
            debugDone(op, ss, out.size(), System.nanoTime() - start);
            return out;
          }
        }
      } finally {
        if (txOrNull == null) c.close();
      }
    } catch (SQLException e) {
      throw failure(op, e);
    }
  }

  long update(TxHandle tx, String op, SqlStatement ss) {
    try {
      Connection c = (tx == null) ? ds.getConnection() : ((JdbcTxHandle) tx).conn();
      try {
        String jdbcSql = NamedParams.toJdbcSql(ss.sql());
        long start = System.nanoTime();
        debugSql(op, ss, jdbcSql);
        try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
          bindAll(ps, ss);
          long n = ps.executeUpdate();
          debugDone(op, ss, n, System.nanoTime() - start);
          return n;
        }
      } finally {
        if (tx == null) c.close();
      }
    } catch (SQLException e) {
      throw failure(op, e);
    }
  }

  private Object insertForId(TxHandle tx, SqlStatement ss) {
    String op = "INSERT_DEFINITION";
    try {
      Connection c = (tx == null) ? ds.getConnection() : ((JdbcTxHandle) tx).conn();
      try {
        String jdbcSql = NamedParams.toJdbcSql(ss.sql());
        long start = System.nanoTime();
        debugSql(op, ss, jdbcSql);
        return switch (ss.execKind()) {
          case QUERY_ONE_VALUE -> {
            try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
              bindAll(ps, ss);
              try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) yield null;
                Object v = rs.getObject(1);
                debugDone(op, ss, "returning", System.nanoTime() - start);
                yield v;
              }
            }
          }
          case UPDATE_GENERATED_KEYS -> {
            try (PreparedStatement ps = c.prepareStatement(jdbcSql, Statement.RETURN_GENERATED_KEYS)) {
              bindAll(ps, ss);
              int n = ps.executeUpdate();
              try (ResultSet rs = ps.getGeneratedKeys()) {
                if (rs == null || !rs.next()) yield null;
                Object v = rs.getObject(1);
                debugDone(op, ss, n, System.nanoTime() - start);
                yield v;
              }
            }
          }
          case UPDATE, QUERY -> throw new IllegalArgumentException(
              "Invalid execKind=" + ss.execKind() + " for insert; use QUERY_ONE_VALUE/UPDATE_GENERATED_KEYS");
        };
      } finally {
        if (tx == null) c.close();
      }
    } catch (SQLException e) {
      throw failure(op, e);
    }
  }

  private void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    for (int i = 0; i < ss.binds().size(); i++) {
      dialect.bind(ps, i + 1, ss.binds().get(i));
    }
  }

  private StorageEngineException failure(String op, SQLException e) {
    log.debug("dynattr.jdbc_failed op={} sqlState={} errorCode={} error={}",
        op, e.getSQLState(), e.getErrorCode(), e.getMessage());
    if (isUniqueViolation(e)) {
      return new DuplicateKeyException("JDBC " + op + " violated a unique constraint: " + e.getMessage(), e);
    }
    return new StorageEngineException("JDBC " + op + " failed: " + e.getMessage(), e);
  }

  /**
   * Unique-key violations as the supported drivers report them: SQLSTATE 23505 (PostgreSQL),
   * SQLSTATE 23000 with error 1062 (MySQL, MariaDB), and SQLITE_CONSTRAINT naming a UNIQUE
   * constraint or its extended codes (SQLite).
   */
  static boolean isUniqueViolation(SQLException e) {
    String state = e.getSQLState();
    int code = e.getErrorCode();
    if ("23505".equals(state)) return true;
    if ("23000".equals(state) && code == 1062) return true;
    if (code == 2067 || code == 1555) return true;
    String msg = e.getMessage();
    return msg != null && msg.contains("UNIQUE constraint failed");
  }

  private void debugSql(String op, SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    log.debug("dynattr.jdbc op={} execKind={} bindCount={} handleId={} schema={} sql={}",
        op, ss.execKind(), ss.binds().size(), handle.id(), handle.schema(), jdbcSql);

    // TRACE: bind summary only (no raw values; attribute values may be personal data)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value();
        String vType = (v == null) ? "null" : v.getClass().getSimpleName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("dynattr.jdbc bind index={} typeId={} valueType={} valueLen={}", idx++, b.typeId(), vType, vLen);
      }
    }
  }

  private void debugDone(String op, SqlStatement ss, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("dynattr.jdbc_done op={} execKind={} durationMs={} result={}",
        op, ss.execKind(), durationNanos / 1_000_000.0, result);
  }
}
