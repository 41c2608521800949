package com.onthegomap.gpkg.schema;

/** The kind of user table described by a row of {@code gpkg_contents}. */
public enum DataType {
  FEATURES("features"),
  TILES("tiles"),
  ATTRIBUTES("attributes");

  private final String value;

  DataType(String value) {
    this.value = value;
  }

  /** Returns the string stored in the {@code data_type} column. */
  public String value() {
    return value;
  }

  public static DataType fromValue(String value) {
    for (DataType type : values()) {
      if (type.value.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Invalid data type: " + value);
  }
}
