package io.intellixity.dynattr.spi.capability;

/** Backend query features the search compiler and index advisor can exploit. */
public enum Feature {
  JSON_FUNCTIONS("json_functions"),
  FULLTEXT_SEARCH("fulltext_search"),
  GENERATED_COLUMNS("generated_columns"),
  CASE_SENSITIVE_LIKE("case_sensitive_like"),
  JSON_EXTRACT("json_extract"),
  JSON_SEARCH("json_search"),
  JSONB_SUPPORT("jsonb_support"),
  JSON1_EXTENSION("json1_extension"),
  FTS_EXTENSION("fts_extension");

  private final String id;

  Feature(String id) {
    this.id = id;
  }

  public String id() { return id; }
}
