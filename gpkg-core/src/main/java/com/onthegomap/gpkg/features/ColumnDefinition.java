package com.onthegomap.gpkg.features;

import com.onthegomap.gpkg.db.SqlNames;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A user column of a feature or attribute table.
 *
 * @param name         column name
 * @param type         sqlite type name like {@code TEXT}, {@code INTEGER}, {@code REAL}, {@code BLOB} or
 *                     {@code VARCHAR(50)}
 * @param notNull      whether to add a {@code NOT NULL} constraint
 * @param unique       whether to add a {@code UNIQUE} constraint
 * @param defaultValue literal default value, or null for none
 */
public record ColumnDefinition(
  String name,
  String type,
  boolean notNull,
  boolean unique,
  Object defaultValue
) {

  private static final Pattern TYPE = Pattern.compile("^[A-Za-z]+(\\s*\\(\\s*\\d+\\s*\\))?$");

  public ColumnDefinition {
    SqlNames.validateColumn(name);
    if (type == null || !TYPE.matcher(type).matches()) {
      throw new IllegalArgumentException("Invalid type for column " + name + ": " + type);
    }
  }

  public static ColumnDefinition of(String name, String type) {
    return new ColumnDefinition(name, type, false, false, null);
  }

  public ColumnDefinition withNotNull() {
    return new ColumnDefinition(name, type, true, unique, defaultValue);
  }

  public ColumnDefinition withDefault(Object value) {
    return new ColumnDefinition(name, type, notNull, unique, value);
  }

  /** Returns the column definition clause of a {@code CREATE TABLE} statement. */
  public String toSql() {
    StringBuilder sql = new StringBuilder(SqlNames.quote(name)).append(' ').append(type.toUpperCase(Locale.ROOT));
    if (notNull) {
      sql.append(" NOT NULL");
    }
    if (unique) {
      sql.append(" UNIQUE");
    }
    if (defaultValue != null) {
      sql.append(" DEFAULT ").append(literal(defaultValue));
    }
    return sql.toString();
  }

  private static String literal(Object value) {
    if (value instanceof Boolean bool) {
      return bool ? "1" : "0";
    } else if (value instanceof Number number) {
      return number.toString();
    }
    return "'" + value.toString().replace("'", "''") + "'";
  }
}
