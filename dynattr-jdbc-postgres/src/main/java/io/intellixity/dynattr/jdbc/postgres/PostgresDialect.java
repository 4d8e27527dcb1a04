package io.intellixity.dynattr.jdbc.postgres;

import io.intellixity.dynattr.jdbc.Bind;
import io.intellixity.dynattr.jdbc.JdbcTables;
import io.intellixity.dynattr.jdbc.SqlStatement;
import io.intellixity.dynattr.jdbc.SqlStatement.ExecKind;
import io.intellixity.dynattr.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.dynattr.jdbc.dialect.FeatureProbe;
import io.intellixity.dynattr.model.ValueRecord;
import io.intellixity.dynattr.spi.capability.Feature;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides and bind behavior.\n
 * Generic SQL rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  public static final String ID = "postgres";

  private static final Set<Feature> FEATURES = Collections.unmodifiableSet(EnumSet.of(
      Feature.JSON_FUNCTIONS,
      Feature.FULLTEXT_SEARCH,
      Feature.GENERATED_COLUMNS,
      Feature.JSON_EXTRACT,
      Feature.JSON_SEARCH,
      Feature.CASE_SENSITIVE_LIKE,
      Feature.JSONB_SUPPORT));

  @Override public String id() { return ID; }

  @Override
  public boolean matches(String productName) {
    return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
  }

  /** Every supported Postgres release has these; nothing to probe. */
  @Override
  public Set<Feature> probeFeatures(FeatureProbe probe) {
    return FEATURES;
  }

  @Override
  public List<String> advisoryIndexStatements(JdbcTables t, Set<Feature> features) {
    String values = valuesTable(t);
    List<String> out = new ArrayList<>();
    if (features.contains(Feature.FULLTEXT_SEARCH)) {
      out.add("CREATE INDEX IF NOT EXISTS idx_" + t.values() + "_string_fulltext ON " + values
          + " USING gin (to_tsvector('english', coalesce(string_value, '')))");
    }
    // substring LIKE / ILIKE
    out.add("CREATE EXTENSION IF NOT EXISTS pg_trgm");
    out.add("CREATE INDEX IF NOT EXISTS idx_" + t.values() + "_string_trgm ON " + values
        + " USING gin (string_value gin_trgm_ops)");
    return out;
  }

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
        .map(c -> c + " = EXCLUDED." + c)
        .collect(Collectors.joining(", "));
    String sql = insertValueSql(t, r, ctx)
        + " ON CONFLICT (entity_id, entity_type, attribute_id) DO UPDATE SET " + set;
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  protected String likeFragment(String col, String term, boolean caseSensitive, RenderCtx ctx) {
    String p = ctx.add(Bind.string(likePattern(term)));
    return col + (caseSensitive ? " LIKE " : " ILIKE ") + p;
  }

  @Override
  protected String fullTextFragment(JdbcTables t, String col, String term, RenderCtx ctx) {
    String p = ctx.add(Bind.string(term));
    return "to_tsvector('english', coalesce(" + col + ", '')) @@ plainto_tsquery('english', " + p + ")";
  }

  @Override
  protected String limitClause(int limit) {
    return " LIMIT " + limit;
  }

  @Override
  protected String identityColumn() {
    return "BIGSERIAL PRIMARY KEY";
  }

  @Override
  protected String jsonType() {
    return "JSONB";
  }

  @Override
  protected void bindJson(PreparedStatement ps, int position, String json) throws SQLException {
    if (json == null) {
      ps.setNull(position, Types.OTHER);
      return;
    }
    PGobject obj = new PGobject();
    obj.setType("jsonb");
    obj.setValue(json);
    ps.setObject(position, obj);
  }
}
