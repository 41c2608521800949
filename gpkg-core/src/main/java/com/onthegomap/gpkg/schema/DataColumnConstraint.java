package com.onthegomap.gpkg.schema;

import java.util.Locale;

/**
 * A row of {@code gpkg_data_column_constraints}. Range constraints use the min/max fields, enum and glob constraints
 * use {@code value}. An enum constraint is made of one row per allowed value sharing a name.
 */
public record DataColumnConstraint(
  String constraintName,
  Type type,
  String value,
  Double min,
  Boolean minIsInclusive,
  Double max,
  Boolean maxIsInclusive,
  String description
) {

  public static DataColumnConstraint range(String name, Double min, boolean minIsInclusive, Double max,
    boolean maxIsInclusive, String description) {
    return new DataColumnConstraint(name, Type.RANGE, null, min, minIsInclusive, max, maxIsInclusive, description);
  }

  public static DataColumnConstraint enumValue(String name, String value, String description) {
    return new DataColumnConstraint(name, Type.ENUM, value, null, null, null, null, description);
  }

  public static DataColumnConstraint glob(String name, String pattern, String description) {
    return new DataColumnConstraint(name, Type.GLOB, pattern, null, null, null, null, description);
  }

  public enum Type {
    RANGE,
    ENUM,
    GLOB;

    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }

    public static Type fromValue(String value) {
      try {
        return valueOf(value.toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Unknown constraint type: " + value, e);
      }
    }
  }
}
