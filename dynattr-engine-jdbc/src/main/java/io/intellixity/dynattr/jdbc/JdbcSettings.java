package io.intellixity.dynattr.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Connection and table settings of the JDBC engine.
 * <p>
 * {@link #load()} reads {@code dynattr.properties} from the classpath, then {@code dynattr.*}
 * system properties. Host tables are declared one per entity type:
 *
 * <pre>
 * dynattr.jdbc.cache.customer=customers:id:dynamic_attributes
 * </pre>
 *
 * See {@link HostTable#parse(String, String)} for the value format.
 */
public final class JdbcSettings {
  public static final String RESOURCE = "dynattr.properties";

  public static final String URL = "dynattr.jdbc.url";
  public static final String USERNAME = "dynattr.jdbc.username";
  public static final String PASSWORD = "dynattr.jdbc.password";
  public static final String SCHEMA = "dynattr.jdbc.schema";
  public static final String MAX_POOL_SIZE = "dynattr.jdbc.maximum-pool-size";
  public static final String DIALECT = "dynattr.jdbc.dialect";
  public static final String ATTRIBUTES_TABLE = "dynattr.jdbc.attributes-table";
  public static final String VALUES_TABLE = "dynattr.jdbc.values-table";
  public static final String CACHE_PREFIX = "dynattr.jdbc.cache.";

  private String jdbcUrl;
  private String username;
  private String password;
  private String schema;
  private int maximumPoolSize = 10;
  private String dialect;
  private String attributesTable = JdbcTables.DEFAULT_ATTRIBUTES;
  private String valuesTable = JdbcTables.DEFAULT_VALUES;
  private final List<HostTable> hostTables = new ArrayList<>();

  public String getJdbcUrl() { return jdbcUrl; }
  public JdbcSettings setJdbcUrl(String v) { this.jdbcUrl = v; return this; }

  public String getUsername() { return username; }
  public JdbcSettings setUsername(String v) { this.username = v; return this; }

  public String getPassword() { return password; }
  public JdbcSettings setPassword(String v) { this.password = v; return this; }

  public String getSchema() { return schema; }
  public JdbcSettings setSchema(String v) { this.schema = v; return this; }

  public int getMaximumPoolSize() { return maximumPoolSize; }
  public JdbcSettings setMaximumPoolSize(int v) {
    if (v <= 0) throw new IllegalArgumentException("maximumPoolSize must be > 0");
    this.maximumPoolSize = v;
    return this;
  }

  /** Dialect id, {@code null} to detect it from the database product name. */
  public String getDialect() { return dialect; }
  public JdbcSettings setDialect(String v) { this.dialect = (v == null || v.isBlank()) ? null : v.trim(); return this; }

  public String getAttributesTable() { return attributesTable; }
  public JdbcSettings setAttributesTable(String v) { this.attributesTable = v; return this; }

  public String getValuesTable() { return valuesTable; }
  public JdbcSettings setValuesTable(String v) { this.valuesTable = v; return this; }

  public List<HostTable> getHostTables() { return List.copyOf(hostTables); }
  public JdbcSettings addHostTable(HostTable h) { hostTables.add(h); return this; }

  public static JdbcSettings load() {
    Properties p = new Properties();
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = JdbcSettings.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
      if (in != null) p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + RESOURCE, e);
    }
    for (String key : System.getProperties().stringPropertyNames()) {
      if (key.startsWith("dynattr.")) p.setProperty(key, System.getProperty(key));
    }
    return fromProperties(p);
  }

  public static JdbcSettings fromProperties(Properties p) {
    JdbcSettings s = new JdbcSettings();
    String v;
    if ((v = p.getProperty(URL)) != null) s.setJdbcUrl(v.trim());
    if ((v = p.getProperty(USERNAME)) != null) s.setUsername(v.trim());
    if ((v = p.getProperty(PASSWORD)) != null) s.setPassword(v);
    if ((v = p.getProperty(SCHEMA)) != null) s.setSchema(v.trim());
    if ((v = p.getProperty(MAX_POOL_SIZE)) != null) s.setMaximumPoolSize(Integer.parseInt(v.trim()));
    if ((v = p.getProperty(DIALECT)) != null) s.setDialect(v);
    if ((v = p.getProperty(ATTRIBUTES_TABLE)) != null) s.setAttributesTable(v.trim());
    if ((v = p.getProperty(VALUES_TABLE)) != null) s.setValuesTable(v.trim());
    p.stringPropertyNames().stream()
        .filter(k -> k.startsWith(CACHE_PREFIX))
        .sorted()
        .forEach(k -> s.addHostTable(HostTable.parse(k.substring(CACHE_PREFIX.length()), p.getProperty(k))));
    return s;
  }
}
