package io.intellixity.dynattr.model;

/** The four typed storage columns of a value record. */
public enum ValueSlot {
  STRING("string_value"),
  NUMBER("number_value"),
  DATE("date_value"),
  BOOLEAN("boolean_value");

  private final String column;

  ValueSlot(String column) {
    this.column = column;
  }

  /** Column name in the value table. */
  public String column() { return column; }

  public Object read(ValueRecord r) {
    return switch (this) {
      case STRING -> r.stringSlot();
      case NUMBER -> r.numberSlot();
      case DATE -> r.dateSlot();
      case BOOLEAN -> r.booleanSlot();
    };
  }
}
