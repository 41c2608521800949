package com.onthegomap.gpkg.db;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Helpers for reading and writing rows of user feature and attribute tables with arbitrary columns. */
public class UserRows {

  // should not instantiate
  private UserRows() {}

  /**
   * Returns the value of every column of the current row except {@code skip}, keyed by column name in table order.
   * <p>
   * Integers come back as {@link Long}, reals as {@link Double}, text as {@link String} and blobs as {@code byte[]}.
   */
  public static Map<String, Object> values(ResultSet rs, Set<String> skip) throws SQLException {
    ResultSetMetaData meta = rs.getMetaData();
    Map<String, Object> result = new LinkedHashMap<>();
    for (int i = 1; i <= meta.getColumnCount(); i++) {
      String name = meta.getColumnName(i);
      if (!skip.contains(name)) {
        result.put(name, normalize(rs.getObject(i)));
      }
    }
    return result;
  }

  private static Object normalize(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    } else if (value instanceof Float f) {
      return f.doubleValue();
    }
    return value;
  }

  /** Converts a property value to something the sqlite driver can bind. */
  public static Object bindable(Object value) {
    if (value instanceof Boolean bool) {
      return bool ? 1 : 0;
    } else if (value instanceof Enum<?> e) {
      return e.name();
    }
    return value;
  }

  /**
   * Throws if any key of {@code properties} is not a valid column name or is not one of {@code writable}.
   *
   * @throws IllegalArgumentException for the first offending key
   */
  public static void checkColumns(String table, Collection<String> keys, Collection<String> writable) {
    for (String key : keys) {
      SqlNames.validateColumn(key);
      if (!writable.contains(key)) {
        throw new IllegalArgumentException("Table " + table + " has no column " + key);
      }
    }
  }

  /** Returns {@code "a" = ?, "b" = ?} for the keys of {@code values}. */
  public static String assignments(Collection<String> columns) {
    List<String> result = new ArrayList<>();
    for (String column : columns) {
      result.add(SqlNames.quote(column) + " = ?");
    }
    return String.join(", ", result);
  }
}
