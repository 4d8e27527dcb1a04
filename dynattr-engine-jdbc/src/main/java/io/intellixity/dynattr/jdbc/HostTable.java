package io.intellixity.dynattr.jdbc;

import java.util.Objects;

/**
 * Host table of one entity type and the column holding its cache document.
 *
 * @param numericId bind entity ids as numbers (for integer primary keys)
 */
public record HostTable(String entityType, String table, String idColumn, String cacheColumn, boolean numericId) {
  public static final String DEFAULT_ID_COLUMN = "id";
  public static final String DEFAULT_CACHE_COLUMN = "dynamic_attributes";

  public HostTable {
    Objects.requireNonNull(entityType, "entityType");
    Objects.requireNonNull(table, "table");
    idColumn = (idColumn == null || idColumn.isBlank()) ? DEFAULT_ID_COLUMN : idColumn;
    cacheColumn = (cacheColumn == null || cacheColumn.isBlank()) ? DEFAULT_CACHE_COLUMN : cacheColumn;
  }

  public static HostTable of(String entityType, String table) {
    return new HostTable(entityType, table, null, null, true);
  }

  /**
   * Parses {@code table[:idColumn[:cacheColumn[:string]]]}; the trailing {@code string} marks
   * textual ids.
   */
  public static HostTable parse(String entityType, String declaration) {
    String[] parts = declaration.trim().split(":");
    if (parts[0].isBlank()) throw new IllegalArgumentException("Host table declaration needs a table name: " + declaration);
    String id = parts.length > 1 ? parts[1].trim() : null;
    String cache = parts.length > 2 ? parts[2].trim() : null;
    boolean numeric = parts.length <= 3 || !"string".equalsIgnoreCase(parts[3].trim());
    return new HostTable(entityType, parts[0].trim(), id, cache, numeric);
  }

  public Bind idBind(String entityId) {
    if (!numericId) return Bind.string(entityId);
    try {
      return Bind.id(Long.parseLong(entityId));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Entity id '" + entityId + "' of " + entityType + " is not numeric", e);
    }
  }
}
