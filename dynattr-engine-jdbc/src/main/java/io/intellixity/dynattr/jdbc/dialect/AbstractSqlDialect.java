package io.intellixity.dynattr.jdbc.dialect;

import io.intellixity.dynattr.jdbc.Bind;
import io.intellixity.dynattr.jdbc.HostTable;
import io.intellixity.dynattr.jdbc.JdbcTables;
import io.intellixity.dynattr.jdbc.SqlStatement;
import io.intellixity.dynattr.jdbc.SqlStatement.ExecKind;
import io.intellixity.dynattr.model.EntityRef;
import io.intellixity.dynattr.model.ValueRecord;
import io.intellixity.dynattr.model.ValueSlot;
import io.intellixity.dynattr.query.Operator;
import io.intellixity.dynattr.query.SortField;
import io.intellixity.dynattr.spi.search.SlotPredicate;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.*;

/**
 * JDBC-generic SQL dialect base.\n
 *
 * Provides common rendering for:\n
 * - definition and value DML against the attribute and value tables\n
 * - slot predicates (comparison, IN, BETWEEN, null checks, LIKE, full-text)\n
 * - keyset paging and ordering of entity ids\n
 *
 * DB-specific dialects override hooks for quoting, paging, returning, upsert syntax, LIKE and
 * full-text fragments, DDL types and binding.\n
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  protected static final String DEFINITION_COLUMNS = "id, name, label, type, required, options, validation_rules";
  protected static final String VALUE_COLUMNS =
      "entity_id, entity_type, attribute_id, attribute_name, string_value, number_value, date_value, boolean_value";

  protected static final class RenderCtx {
    private int n = 1;
    private final List<Bind> binds = new ArrayList<>();

    public RenderCtx() {}

    public String add(Bind b) {
      binds.add(b);
      return ":b" + (n++);
    }

    public List<Bind> binds() { return binds; }
  }

  // --- definitions ---

  @Override
  public SqlStatement selectDefinition(JdbcTables t, String name) {
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT " + DEFINITION_COLUMNS + " FROM " + attributesTable(t)
        + " WHERE name = " + ctx.add(Bind.string(name));
    return new SqlStatement(sql, ctx.binds());
  }

  @Override
  public SqlStatement selectDefinitions(JdbcTables t) {
    return new SqlStatement("SELECT " + DEFINITION_COLUMNS + " FROM " + attributesTable(t) + " ORDER BY name", List.of());
  }

  @Override
  public SqlStatement insertDefinition(JdbcTables t, String name, String label, String type, boolean required,
                                       String optionsJson, String rulesJson) {
    RenderCtx ctx = new RenderCtx();
    List<String> ph = List.of(
        ctx.add(Bind.string(name)),
        ctx.add(Bind.string(label)),
        ctx.add(Bind.string(type)),
        ctx.add(Bind.bool(required)),
        ctx.add(Bind.json(optionsJson)),
        ctx.add(Bind.json(rulesJson)));
    String sql = "INSERT INTO " + attributesTable(t)
        + " (name, label, type, required, options, validation_rules) VALUES (" + String.join(", ", ph) + ")";
    return new SqlStatement(applyInsertReturning(sql, "id"), ctx.binds(), insertExecKind());
  }

  @Override
  public SqlStatement updateDefinition(JdbcTables t, long id, String label, boolean required,
                                       String optionsJson, String rulesJson) {
    RenderCtx ctx = new RenderCtx();
    String sql = "UPDATE " + attributesTable(t)
        + " SET label = " + ctx.add(Bind.string(label))
        + ", required = " + ctx.add(Bind.bool(required))
        + ", options = " + ctx.add(Bind.json(optionsJson))
        + ", validation_rules = " + ctx.add(Bind.json(rulesJson))
        + " WHERE id = " + ctx.add(Bind.id(id));
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement deleteDefinition(JdbcTables t, long id) {
    RenderCtx ctx = new RenderCtx();
    String sql = "DELETE FROM " + attributesTable(t) + " WHERE id = " + ctx.add(Bind.id(id));
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  /**
   * Decide execution strategy for the definition insert.\n
   *
   * Default uses JDBC generated keys. Dialects with SQL-level returning override to
   * {@link ExecKind#QUERY_ONE_VALUE}.
   */
  protected ExecKind insertExecKind() {
    return ExecKind.UPDATE_GENERATED_KEYS;
  }

  protected String applyInsertReturning(String insertSql, String idColumn) {
    return insertSql;
  }

  // --- values ---

  @Override
  public boolean supportsUpsert() {
    return false;
  }

  @Override
  public SqlStatement upsertValue(JdbcTables t, ValueRecord r) {
    throw new UnsupportedOperationException(id() + " has no native upsert; use updateValue + insertValue");
  }

  @Override
  public SqlStatement updateValue(JdbcTables t, ValueRecord r) {
    RenderCtx ctx = new RenderCtx();
    String sql = "UPDATE " + valuesTable(t)
        + " SET attribute_name = " + ctx.add(Bind.string(r.attributeName()))
        + ", string_value = " + ctx.add(Bind.string(r.stringSlot()))
        + ", number_value = " + ctx.add(Bind.number(r.numberSlot()))
        + ", date_value = " + ctx.add(Bind.date(r.dateSlot()))
        + ", boolean_value = " + ctx.add(Bind.bool(r.booleanSlot()))
        + " WHERE entity_id = " + ctx.add(Bind.string(r.entityId()))
        + " AND entity_type = " + ctx.add(Bind.string(r.entityType()))
        + " AND attribute_id = " + ctx.add(Bind.id(r.attributeId()));
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement insertValue(JdbcTables t, ValueRecord r) {
    RenderCtx ctx = new RenderCtx();
    return new SqlStatement(insertValueSql(t, r, ctx), ctx.binds(), ExecKind.UPDATE);
  }

  /** Plain INSERT of a value record; native upserts append their conflict clause to it. */
  protected String insertValueSql(JdbcTables t, ValueRecord r, RenderCtx ctx) {
    List<String> ph = List.of(
        ctx.add(Bind.string(r.entityId())),
        ctx.add(Bind.string(r.entityType())),
        ctx.add(Bind.id(r.attributeId())),
        ctx.add(Bind.string(r.attributeName())),
        ctx.add(Bind.string(r.stringSlot())),
        ctx.add(Bind.number(r.numberSlot())),
        ctx.add(Bind.date(r.dateSlot())),
        ctx.add(Bind.bool(r.booleanSlot())));
    return "INSERT INTO " + valuesTable(t) + " (" + VALUE_COLUMNS + ") VALUES (" + String.join(", ", ph) + ")";
  }

  /** Columns a conflicting value upsert overwrites. */
  protected static List<String> valueUpdateColumns() {
    return List.of("attribute_name", "string_value", "number_value", "date_value", "boolean_value");
  }

  @Override
  public SqlStatement selectValue(JdbcTables t, EntityRef entity, String attributeName) {
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT " + VALUE_COLUMNS + " FROM " + valuesTable(t) + " WHERE " + entityWhere(entity, ctx)
        + " AND attribute_name = " + ctx.add(Bind.string(attributeName));
    return new SqlStatement(sql, ctx.binds());
  }

  @Override
  public SqlStatement selectValues(JdbcTables t, EntityRef entity) {
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT " + VALUE_COLUMNS + " FROM " + valuesTable(t) + " WHERE " + entityWhere(entity, ctx)
        + " ORDER BY attribute_name";
    return new SqlStatement(sql, ctx.binds());
  }

  @Override
  public SqlStatement deleteValue(JdbcTables t, EntityRef entity, String attributeName) {
    RenderCtx ctx = new RenderCtx();
    String sql = "DELETE FROM " + valuesTable(t) + " WHERE " + entityWhere(entity, ctx)
        + " AND attribute_name = " + ctx.add(Bind.string(attributeName));
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement deleteValuesForAttribute(JdbcTables t, long attributeId) {
    RenderCtx ctx = new RenderCtx();
    String sql = "DELETE FROM " + valuesTable(t) + " WHERE attribute_id = " + ctx.add(Bind.id(attributeId));
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement selectEntitiesWithAttribute(JdbcTables t, long attributeId) {
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT DISTINCT entity_id, entity_type FROM " + valuesTable(t)
        + " WHERE attribute_id = " + ctx.add(Bind.id(attributeId));
    return new SqlStatement(sql, ctx.binds());
  }

  private static String entityWhere(EntityRef entity, RenderCtx ctx) {
    return "entity_id = " + ctx.add(Bind.string(entity.id())) + " AND entity_type = " + ctx.add(Bind.string(entity.type()));
  }

  // --- search ---

  @Override
  public SqlStatement selectEntityIds(JdbcTables t, String entityType) {
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT DISTINCT entity_id FROM " + valuesTable(t) + " WHERE entity_type = " + ctx.add(Bind.string(entityType));
    return new SqlStatement(sql, ctx.binds());
  }

  @Override
  public SqlStatement selectMatchingEntityIds(JdbcTables t, String entityType, String attributeName, SlotPredicate p) {
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT DISTINCT v.entity_id FROM " + valuesTable(t) + " v"
        + " WHERE v.entity_type = " + ctx.add(Bind.string(entityType))
        + " AND v.attribute_name = " + ctx.add(Bind.string(attributeName))
        + " AND " + predicateSql(t, "v." + p.slot().column(), p, ctx);
    return new SqlStatement(sql, ctx.binds());
  }

  @Override
  public SqlStatement selectEntityIdsAfter(JdbcTables t, String entityType, String afterExclusive, int limit) {
    RenderCtx ctx = new RenderCtx();
    StringBuilder sql = new StringBuilder("SELECT DISTINCT entity_id FROM ").append(valuesTable(t))
        .append(" WHERE entity_type = ").append(ctx.add(Bind.string(entityType)));
    if (afterExclusive != null) sql.append(" AND entity_id > ").append(ctx.add(Bind.string(afterExclusive)));
    sql.append(" ORDER BY entity_id").append(limitClause(limit));
    return new SqlStatement(sql.toString(), ctx.binds());
  }

  @Override
  public SqlStatement selectOrderedEntityIds(JdbcTables t, String entityType, Collection<String> ids,
                                             String attributeName, ValueSlot slot, SortField.Direction direction) {
    RenderCtx ctx = new RenderCtx();
    String col = "v." + slot.column();
    StringBuilder sql = new StringBuilder("SELECT v.entity_id, ").append(col)
        .append(" FROM ").append(valuesTable(t)).append(" v")
        .append(" WHERE v.entity_type = ").append(ctx.add(Bind.string(entityType)))
        .append(" AND v.attribute_name = ").append(ctx.add(Bind.string(attributeName)))
        .append(" AND ").append(col).append(" IS NOT NULL");
    List<String> ph = new ArrayList<>(ids.size());
    for (String id : ids) ph.add(ctx.add(Bind.string(id)));
    String dir = direction == SortField.Direction.DESC ? "DESC" : "ASC";
    sql.append(" AND v.entity_id IN (").append(String.join(", ", ph)).append(")")
        .append(" ORDER BY ").append(col).append(' ').append(dir).append(", v.entity_id");
    return new SqlStatement(sql.toString(), ctx.binds());
  }

  protected String predicateSql(JdbcTables t, String col, SlotPredicate p, RenderCtx ctx) {
    return switch (p.operator()) {
      case NULL -> col + " IS NULL";
      case NOT_NULL -> col + " IS NOT NULL";
      case EQ, NE, LT, GT, LE, GE -> comparisonFragment(p.slot(), col, p.value(), p.operator(), ctx);
      case IN -> {
        if (p.values() == null || p.values().isEmpty()) yield "1 = 0";
        List<String> ph = new ArrayList<>();
        for (Object v : p.values()) ph.add(ctx.add(slotBind(p.slot(), v)));
        yield col + " IN (" + String.join(", ", ph) + ")";
      }
      case BETWEEN -> col + " BETWEEN " + ctx.add(slotBind(p.slot(), p.lower()))
          + " AND " + ctx.add(slotBind(p.slot(), p.upper()));
      case LIKE -> p.fullText()
          ? fullTextFragment(t, col, String.valueOf(p.value()), ctx)
          : likeFragment(col, String.valueOf(p.value()), p.caseSensitive(), ctx);
    };
  }

  protected String comparisonFragment(ValueSlot slot, String col, Object value, Operator op, RenderCtx ctx) {
    return col + " " + sqlOperator(op) + " " + ctx.add(slotBind(slot, value));
  }

  /** Substring match of {@code term}; SQL wildcards inside the term keep their meaning. */
  protected String likeFragment(String col, String term, boolean caseSensitive, RenderCtx ctx) {
    String p = ctx.add(Bind.string(likePattern(term)));
    return caseSensitive ? col + " LIKE " + p : "LOWER(" + col + ") LIKE LOWER(" + p + ")";
  }

  /** Backend full-text match; the generic form is a case-insensitive LIKE. */
  protected String fullTextFragment(JdbcTables t, String col, String term, RenderCtx ctx) {
    return likeFragment(col, term, false, ctx);
  }

  protected static String likePattern(String term) {
    return "%" + term + "%";
  }

  protected static String sqlOperator(Operator op) {
    return op == Operator.NE ? "<>" : op.symbol();
  }

  protected static Bind slotBind(ValueSlot slot, Object value) {
    return switch (slot) {
      case STRING -> Bind.string((String) value);
      case NUMBER -> Bind.number(value == null ? null : ((Number) value).doubleValue());
      case DATE -> Bind.date((LocalDate) value);
      case BOOLEAN -> Bind.bool((Boolean) value);
    };
  }

  protected String limitClause(int limit) {
    return " FETCH FIRST " + limit + " ROWS ONLY";
  }

  // --- cache documents ---

  @Override
  public SqlStatement selectCacheDocument(HostTable host, String entityId) {
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT " + quoteIdent(host.cacheColumn()) + " FROM " + qualified(host.table())
        + " WHERE " + quoteIdent(host.idColumn()) + " = " + ctx.add(host.idBind(entityId));
    return new SqlStatement(sql, ctx.binds());
  }

  @Override
  public SqlStatement updateCacheDocument(HostTable host, String entityId, String json) {
    RenderCtx ctx = new RenderCtx();
    String sql = "UPDATE " + qualified(host.table())
        + " SET " + quoteIdent(host.cacheColumn()) + " = " + ctx.add(Bind.json(json))
        + " WHERE " + quoteIdent(host.idColumn()) + " = " + ctx.add(host.idBind(entityId));
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  // --- DDL ---

  @Override
  public List<String> createSchemaStatements(JdbcTables t) {
    String attributes = attributesTable(t);
    String values = valuesTable(t);
    List<String> out = new ArrayList<>();
    out.add("CREATE TABLE " + attributes + " ("
        + "id " + identityColumn() + ", "
        + "name VARCHAR(191) NOT NULL, "
        + "label VARCHAR(255) NOT NULL, "
        + "type VARCHAR(16) NOT NULL, "
        + "required BOOLEAN NOT NULL, "
        + "options " + jsonType() + ", "
        + "validation_rules " + jsonType() + ", "
        + "CONSTRAINT uq_" + t.attributes() + "_name UNIQUE (name))");
    out.add("CREATE TABLE " + values + " ("
        + "id " + identityColumn() + ", "
        + "entity_id VARCHAR(191) NOT NULL, "
        + "entity_type VARCHAR(191) NOT NULL, "
        + "attribute_id BIGINT NOT NULL, "
        + "attribute_name VARCHAR(191) NOT NULL, "
        + "string_value " + textType() + ", "
        + "number_value DOUBLE PRECISION, "
        + "date_value DATE, "
        + "boolean_value BOOLEAN, "
        + "CONSTRAINT uq_" + t.values() + "_entity UNIQUE (entity_id, entity_type, attribute_id), "
        + "CONSTRAINT fk_" + t.values() + "_attribute FOREIGN KEY (attribute_id) REFERENCES " + attributes
        + " (id) ON DELETE CASCADE)");
    out.add("CREATE INDEX idx_" + t.values() + "_entity ON " + values + " (entity_id, entity_type)");
    for (ValueSlot slot : ValueSlot.values()) {
      out.add("CREATE INDEX idx_" + t.values() + "_" + slot.name().toLowerCase(Locale.ROOT) + "_search ON " + values
          + " (entity_type, attribute_name, " + slotIndexColumn(slot) + ")");
    }
    return out;
  }

  protected String identityColumn() {
    return "BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY";
  }

  protected String jsonType() {
    return "TEXT";
  }

  protected String textType() {
    return "TEXT";
  }

  protected String slotIndexColumn(ValueSlot slot) {
    return slot.column();
  }

  // --- binding ---

  @Override
  public void bind(PreparedStatement ps, int position, Bind bind) throws SQLException {
    Object v = bind.value();
    switch (bind.typeId()) {
      case Bind.STRING -> {
        if (v == null) ps.setNull(position, Types.VARCHAR);
        else ps.setString(position, v.toString());
      }
      case Bind.DOUBLE -> {
        if (v == null) ps.setNull(position, Types.DOUBLE);
        else ps.setDouble(position, ((Number) v).doubleValue());
      }
      case Bind.LONG -> {
        if (v == null) ps.setNull(position, Types.BIGINT);
        else ps.setLong(position, ((Number) v).longValue());
      }
      case Bind.BOOL -> {
        if (v == null) ps.setNull(position, Types.BOOLEAN);
        else ps.setBoolean(position, (Boolean) v);
      }
      case Bind.DATE -> bindDate(ps, position, (LocalDate) v);
      case Bind.JSON -> bindJson(ps, position, (String) v);
      default -> throw new IllegalArgumentException("Unknown bind type: " + bind.typeId());
    }
  }

  protected void bindDate(PreparedStatement ps, int position, LocalDate d) throws SQLException {
    if (d == null) ps.setNull(position, Types.DATE);
    else ps.setDate(position, java.sql.Date.valueOf(d));
  }

  protected void bindJson(PreparedStatement ps, int position, String json) throws SQLException {
    if (json == null) ps.setNull(position, Types.VARCHAR);
    else ps.setString(position, json);
  }

  @Override
  public LocalDate readDate(ResultSet rs, String column) throws SQLException {
    java.sql.Date d = rs.getDate(column);
    return d == null ? null : d.toLocalDate();
  }

  // --- naming ---

  protected String attributesTable(JdbcTables t) {
    return table(t, t.attributes());
  }

  protected String valuesTable(JdbcTables t) {
    return table(t, t.values());
  }

  protected String table(JdbcTables t, String name) {
    return t.schema() == null ? quoteIdent(name) : quoteIdent(t.schema()) + "." + quoteIdent(name);
  }

  /** Quotes each part of a possibly schema-qualified name. */
  protected String qualified(String name) {
    List<String> parts = new ArrayList<>();
    for (String p : name.split("\\.")) parts.add(quoteIdent(p));
    return String.join(".", parts);
  }

  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }
}
