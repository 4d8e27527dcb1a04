package io.intellixity.dynattr.jdbc.mysql;

import io.intellixity.dynattr.jdbc.Bind;
import io.intellixity.dynattr.jdbc.JdbcTables;
import io.intellixity.dynattr.jdbc.SqlStatement;
import io.intellixity.dynattr.jdbc.SqlStatement.ExecKind;
import io.intellixity.dynattr.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.dynattr.jdbc.dialect.FeatureProbe;
import io.intellixity.dynattr.model.ValueRecord;
import io.intellixity.dynattr.model.ValueSlot;
import io.intellixity.dynattr.spi.capability.Feature;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * MySQL and MariaDB dialect.\n
 *
 * TEXT columns can only be indexed by prefix, so every index over {@code string_value} uses the
 * first 100 characters.
 */
public final class MySqlDialect extends AbstractSqlDialect {
  public static final String ID = "mysql";
  static final int STRING_INDEX_PREFIX = 100;

  @Override public String id() { return ID; }

  @Override
  public boolean matches(String productName) {
    if (productName == null) return false;
    String p = productName.toLowerCase(Locale.ROOT);
    return p.contains("mysql") || p.contains("mariadb");
  }

  @Override
  public Set<Feature> probeFeatures(FeatureProbe probe) {
    Set<Feature> out = EnumSet.of(
        Feature.JSON_FUNCTIONS,
        Feature.FULLTEXT_SEARCH,
        Feature.JSON_EXTRACT,
        Feature.JSON_SEARCH,
        Feature.CASE_SENSITIVE_LIKE);
    if (atLeast(probe.databaseVersion(), 5, 7)) out.add(Feature.GENERATED_COLUMNS);
    return out;
  }

  /** Compares the leading {@code major.minor} of a version string such as {@code 8.0.36-log}. */
  static boolean atLeast(String version, int major, int minor) {
    if (version == null) return false;
    String[] parts = version.trim().split("[^0-9]+");
    try {
      int ma = Integer.parseInt(parts[0]);
      int mi = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
      return ma > major || (ma == major && mi >= minor);
    } catch (NumberFormatException e) {
      return false;
    }
  }

  @Override
  public List<String> advisoryIndexStatements(JdbcTables t, Set<Feature> features) {
    String values = valuesTable(t);
    List<String> out = new ArrayList<>();
    if (features.contains(Feature.FULLTEXT_SEARCH)) {
      out.add("ALTER TABLE " + values + " ADD FULLTEXT INDEX ft_" + t.values() + "_string (string_value)");
    }
    out.add("CREATE INDEX idx_" + t.values() + "_entity_attribute_value ON " + values
        + " (entity_type, attribute_name, string_value(" + STRING_INDEX_PREFIX + "))");
    out.add("ALTER TABLE " + attributesTable(t) + " ENGINE=InnoDB ROW_FORMAT=DYNAMIC");
    out.add("ALTER TABLE " + values + " ENGINE=InnoDB ROW_FORMAT=DYNAMIC");
    return out;
  }

  @Override
  public boolean supportsUpsert() {
    return true;
  }

  @Override
  public SqlStatement upsertValue(JdbcTables t, ValueRecord r) {
    RenderCtx ctx = new RenderCtx();
    String set = valueUpdateColumns().stream()
        .map(c -> c + " = VALUES(" + c + ")")
        .collect(Collectors.joining(", "));
    return new SqlStatement(insertValueSql(t, r, ctx) + " ON DUPLICATE KEY UPDATE " + set, ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  protected String likeFragment(String col, String term, boolean caseSensitive, RenderCtx ctx) {
    if (!caseSensitive) return super.likeFragment(col, term, false, ctx);
    return col + " LIKE BINARY " + ctx.add(Bind.string(likePattern(term)));
  }

  @Override
  protected String fullTextFragment(JdbcTables t, String col, String term, RenderCtx ctx) {
    return "MATCH(" + col + ") AGAINST(" + ctx.add(Bind.string(term)) + " IN BOOLEAN MODE)";
  }

  @Override
  protected String limitClause(int limit) {
    return " LIMIT " + limit;
  }

  @Override
  protected String identityColumn() {
    return "BIGINT AUTO_INCREMENT PRIMARY KEY";
  }

  @Override
  protected String jsonType() {
    return "JSON";
  }

  @Override
  protected String slotIndexColumn(ValueSlot slot) {
    return slot == ValueSlot.STRING ? slot.column() + "(" + STRING_INDEX_PREFIX + ")" : slot.column();
  }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "`" + ident.replace("`", "``") + "`";
  }
}
