package io.intellixity.dynattr.jdbc.sqlite;

import io.intellixity.dynattr.jdbc.Bind;
import io.intellixity.dynattr.jdbc.JdbcTables;
import io.intellixity.dynattr.jdbc.SqlStatement;
import io.intellixity.dynattr.jdbc.SqlStatement.ExecKind;
import io.intellixity.dynattr.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.dynattr.jdbc.dialect.FeatureProbe;
import io.intellixity.dynattr.model.ValueRecord;
import io.intellixity.dynattr.spi.capability.Feature;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * SQLite dialect.\n
 *
 * Notes:\n
 * - JSON1 and FTS5 are compile-time options of SQLite, so both are probed\n
 * - Full-text search reads the {@code <values>_fts} table that {@link #advisoryIndexStatements}
 *   creates; it matches nothing until those statements have been applied\n
 * - Dates are stored as ISO-8601 text, which orders like the dates themselves\n
 */
public final class SqliteDialect extends AbstractSqlDialect {
  public static final String ID = "sqlite";
  static final String FTS_PROBE_TABLE = "temp.dynattr_fts_probe";

  @Override public String id() { return ID; }

  @Override
  public boolean matches(String productName) {
    return productName != null && productName.toLowerCase(Locale.ROOT).contains("sqlite");
  }

  @Override
  public Set<Feature> probeFeatures(FeatureProbe probe) {
    Set<Feature> out = EnumSet.noneOf(Feature.class);
    if (probe.succeeds("SELECT json('{}')")) {
      out.add(Feature.JSON_FUNCTIONS);
      out.add(Feature.JSON_EXTRACT);
      out.add(Feature.JSON1_EXTENSION);
    }
    if (probe.succeeds("CREATE VIRTUAL TABLE IF NOT EXISTS " + FTS_PROBE_TABLE + " USING fts5(content)")) {
      probe.succeeds("DROP TABLE IF EXISTS " + FTS_PROBE_TABLE);
      out.add(Feature.FTS_EXTENSION);
      out.add(Feature.FULLTEXT_SEARCH);
    }
    return out;
  }

  @Override
  public List<String> advisoryIndexStatements(JdbcTables t, Set<Feature> features) {
    String values = valuesTable(t);
    List<String> out = new ArrayList<>();
    if (features.contains(Feature.FTS_EXTENSION)) {
      String fts = ftsTable(t);
      String ftsName = quoteIdent(t.values() + "_fts");
      out.add("CREATE VIRTUAL TABLE IF NOT EXISTS " + fts + " USING fts5(string_value, content='"
          + t.values() + "', content_rowid='id')");
      out.add("CREATE TRIGGER IF NOT EXISTS " + quoteIdent(t.values() + "_fts_ai") + " AFTER INSERT ON " + values
          + " BEGIN INSERT INTO " + ftsName + " (rowid, string_value) VALUES (new.id, new.string_value); END");
      out.add("CREATE TRIGGER IF NOT EXISTS " + quoteIdent(t.values() + "_fts_ad") + " AFTER DELETE ON " + values
          + " BEGIN INSERT INTO " + ftsName + " (" + ftsName + ", rowid, string_value)"
          + " VALUES ('delete', old.id, old.string_value); END");
      out.add("CREATE TRIGGER IF NOT EXISTS " + quoteIdent(t.values() + "_fts_au") + " AFTER UPDATE ON " + values
          + " BEGIN INSERT INTO " + ftsName + " (" + ftsName + ", rowid, string_value)"
          + " VALUES ('delete', old.id, old.string_value);"
          + " INSERT INTO " + ftsName + " (rowid, string_value) VALUES (new.id, new.string_value); END");
      out.add("INSERT INTO " + fts + " (" + ftsName + ") VALUES ('rebuild')");
    }
    out.add("CREATE INDEX IF NOT EXISTS idx_" + t.values() + "_string_nocase ON " + values
        + " (entity_type, attribute_name, string_value COLLATE NOCASE)");
    return out;
  }

  private String ftsTable(JdbcTables t) {
    return table(t, t.values() + "_fts");
  }

  /** RETURNING requires SQLite 3.35 or later. */
  @Override
  protected ExecKind insertExecKind() {
    return ExecKind.QUERY_ONE_VALUE;
  }

  @Override
  protected String applyInsertReturning(String insertSql, String idColumn) {
    return insertSql + " RETURNING " + idColumn;
  }

  @Override
  public boolean supportsUpsert() {
    return true;
  }

  @Override
  public SqlStatement upsertValue(JdbcTables t, ValueRecord r) {
    RenderCtx ctx = new RenderCtx();
    String set = valueUpdateColumns().stream()
        .map(c -> c + " = excluded." + c)
        .collect(Collectors.joining(", "));
    String sql = insertValueSql(t, r, ctx)
        + " ON CONFLICT (entity_id, entity_type, attribute_id) DO UPDATE SET " + set;
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  /** SQLite's LIKE ignores ASCII case, so case-sensitive matching uses {@code instr}. */
  @Override
  protected String likeFragment(String col, String term, boolean caseSensitive, RenderCtx ctx) {
    if (caseSensitive) return "instr(" + col + ", " + ctx.add(Bind.string(term)) + ") > 0";
    return col + " LIKE " + ctx.add(Bind.string(likePattern(term)));
  }

  @Override
  protected String fullTextFragment(JdbcTables t, String col, String term, RenderCtx ctx) {
    String alias = col.contains(".") ? col.substring(0, col.indexOf('.') + 1) : "";
    return alias + "id IN (SELECT rowid FROM " + ftsTable(t) + " WHERE " + quoteIdent(t.values() + "_fts")
        + " MATCH " + ctx.add(Bind.string(phrase(term))) + ")";
  }

  /** FTS5 query syntax treats bare words as operators; a quoted phrase matches the text as typed. */
  static String phrase(String term) {
    return "\"" + term.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String limitClause(int limit) {
    return " LIMIT " + limit;
  }

  @Override
  protected String identityColumn() {
    return "INTEGER PRIMARY KEY AUTOINCREMENT";
  }

  @Override
  protected void bindDate(PreparedStatement ps, int position, LocalDate d) throws SQLException {
    if (d == null) ps.setNull(position, Types.VARCHAR);
    else ps.setString(position, d.toString());
  }

  @Override
  public LocalDate readDate(ResultSet rs, String column) throws SQLException {
    String s = rs.getString(column);
    return (s == null || s.isBlank()) ? null : LocalDate.parse(s.length() > 10 ? s.substring(0, 10) : s);
  }
}
